package com.eyelevel.codeconverter.queue;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * A unit of asynchronous work handed to the {@link RateLimitedWorkQueue}.
 *
 * @param id         Identifies the task in logs and in cancellation errors.
 * @param action     Starts one attempt. Called again for every retry, so it must not capture
 *                   per-attempt state such as a credential.
 * @param maxRetries Retries after the first attempt, or {@code null} for the queue default.
 * @param <T>        The result type.
 */
public record QueueTask<T>(String id, Supplier<CompletableFuture<T>> action, Integer maxRetries) {

    public QueueTask {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(action, "action must not be null");
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
    }

    public static <T> QueueTask<T> of(String id, Supplier<CompletableFuture<T>> action) {
        return new QueueTask<>(id, action, null);
    }

    /**
     * Starts one attempt.
     */
    public CompletableFuture<T> execute() {
        return action.get();
    }
}
