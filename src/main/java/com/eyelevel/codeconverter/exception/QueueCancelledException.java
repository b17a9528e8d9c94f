package com.eyelevel.codeconverter.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Completes the future of a queued task that was discarded by the work queue before it started.
 */
@Getter
public class QueueCancelledException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 7394187322520761902L;

    private final String taskId;

    public QueueCancelledException(String taskId) {
        super("Task " + taskId + " was cancelled before it started.");
        this.taskId = taskId;
    }
}
