package com.eyelevel.codeconverter.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs the attempts of tasks run by the {@link RateLimitedWorkQueue}.
 */
@Slf4j
@Component("queueRetryListener")
public class QueueRetryListener implements RetryListener {

    /**
     * Called after every failed attempt, whether or not another one follows.
     */
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        final Object taskId = context.getAttribute(RateLimitedWorkQueue.TASK_ID_ATTRIBUTE);
        if (RetryableErrors.isRetryable(throwable)) {
            log.warn("Task {} failed on attempt {} with a transient error: {}", taskId, context.getRetryCount(),
                     throwable.getMessage());
        } else {
            log.warn("Task {} failed on attempt {} with a fatal error, not retrying: {}", taskId,
                     context.getRetryCount(), throwable.getMessage());
        }
    }

    /**
     * Called once after the last attempt.
     */
    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (throwable != null) {
            log.error("Task {} gave up after {} attempt(s): {}",
                      context.getAttribute(RateLimitedWorkQueue.TASK_ID_ATTRIBUTE), context.getRetryCount(),
                      throwable.getMessage());
        } else if (context.getRetryCount() > 0) {
            log.info("Task {} succeeded after {} failed attempt(s).",
                     context.getAttribute(RateLimitedWorkQueue.TASK_ID_ATTRIBUTE), context.getRetryCount());
        }
    }
}
