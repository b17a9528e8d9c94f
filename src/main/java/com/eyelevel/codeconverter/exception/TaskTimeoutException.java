package com.eyelevel.codeconverter.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Raised when a single attempt of a queued task does not settle within the configured request timeout.
 * The attempt is abandoned, not interrupted.
 */
@Getter
public class TaskTimeoutException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -5273106542930812203L;

    private final String taskId;
    private final long timeoutMs;

    public TaskTimeoutException(String taskId, long timeoutMs) {
        super("Task " + taskId + " timed out after " + timeoutMs + " ms.");
        this.taskId = taskId;
        this.timeoutMs = timeoutMs;
    }
}
