package com.eyelevel.codeconverter.queue;

import com.eyelevel.codeconverter.config.ConversionProperties;
import com.eyelevel.codeconverter.exception.QueueCancelledException;
import com.eyelevel.codeconverter.exception.TaskTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs asynchronous tasks under three limits at once: at most {@code capacity} tasks hold a slot,
 * two dispatches are at least {@code interval} apart, and a task failing with a
 * {@linkplain RetryableErrors transient error} is retried with exponential backoff.
 *
 * <p>Tasks are dispatched in submission order. A dispatched task keeps its slot for all of its
 * attempts, including the backoff sleeps in between, so a retry never waits behind newer submissions
 * and the number of in-flight requests never exceeds the capacity. Each attempt is awaited for at most
 * the request timeout; an attempt that overruns fails with {@link TaskTimeoutException} and is left to
 * finish on its own.
 *
 * <p>The FIFO, the running count and the last dispatch time are only touched while holding
 * {@link #lock}. When the rate gate is closed the queue schedules a single wake-up for the moment it
 * opens instead of polling.
 */
@Slf4j
public class RateLimitedWorkQueue {

    static final String TASK_ID_ATTRIBUTE = "queue.taskId";

    private final int capacity;
    private final long intervalMs;
    private final int defaultMaxRetries;
    private final long requestTimeoutMs;
    private final ConversionProperties.Backoff backoff;
    private final Sleeper sleeper;
    private final RetryListener[] retryListeners;

    private final ThreadPoolTaskExecutor slotExecutor;
    private final ThreadPoolTaskScheduler gateScheduler;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<QueueEntry<?>> pending = new ArrayDeque<>();
    private final List<CompletableFuture<Void>> drainWaiters = new ArrayList<>();
    private int running;
    private long lastDispatchNanos;
    private boolean dispatchedBefore;
    private ScheduledFuture<?> wakeUp;
    private boolean shutdown;

    public RateLimitedWorkQueue(final ConversionProperties.Queue settings) {
        this(settings, new ThreadWaitSleeper(), List.of());
    }

    /**
     * @param settings       Capacity, interval, retry and timeout limits.
     * @param sleeper        Performs the backoff waits. Tests pass one that records instead of sleeping.
     * @param retryListeners Notified of every attempt.
     */
    public RateLimitedWorkQueue(final ConversionProperties.Queue settings, final Sleeper sleeper,
                                final List<? extends RetryListener> retryListeners) {
        this.capacity = settings.getMaxConcurrency();
        this.intervalMs = settings.getRequestIntervalMs();
        this.defaultMaxRetries = settings.getMaxRetries();
        this.requestTimeoutMs = settings.getRequestTimeoutMs();
        this.backoff = settings.getBackoff();
        this.sleeper = sleeper;
        this.retryListeners = retryListeners.toArray(new RetryListener[0]);

        this.slotExecutor = new ThreadPoolTaskExecutor();
        slotExecutor.setCorePoolSize(capacity);
        slotExecutor.setMaxPoolSize(capacity);
        slotExecutor.setThreadNamePrefix("queue-slot-");
        slotExecutor.initialize();

        this.gateScheduler = new ThreadPoolTaskScheduler();
        gateScheduler.setPoolSize(1);
        gateScheduler.setThreadNamePrefix("queue-gate-");
        gateScheduler.initialize();

        log.info("Work queue initialized: capacity={}, interval={}ms, maxRetries={}, timeout={}ms",
                 capacity, intervalMs, defaultMaxRetries, requestTimeoutMs);
    }

    /**
     * Enqueues a task. Never throws: a null task, or a task submitted after {@link #shutdown()}, gets an
     * already failed future.
     *
     * @return A future completing with the task's result, or exceptionally with the error of its last
     *         attempt, or with {@link QueueCancelledException} if it was cancelled before starting.
     */
    public <T> CompletableFuture<T> submit(final QueueTask<T> task) {
        if (task == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("task must not be null"));
        }
        final int maxRetries = task.maxRetries() != null ? task.maxRetries() : defaultMaxRetries;
        final QueueEntry<T> entry = new QueueEntry<>(task, maxRetries);

        lock.lock();
        try {
            if (shutdown) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Work queue is shut down, task " + task.id() + " rejected."));
            }
            pending.addLast(entry);
            log.debug("Task {} queued (queued={}, running={})", task.id(), pending.size(), running);
        } finally {
            lock.unlock();
        }

        dispatch();
        return entry.result;
    }

    public QueueStatus status() {
        lock.lock();
        try {
            return new QueueStatus(pending.size(), running, capacity, intervalMs);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return A future completing once nothing is queued and nothing is running.
     */
    public CompletableFuture<Void> drain() {
        lock.lock();
        try {
            if (pending.isEmpty() && running == 0) {
                return CompletableFuture.completedFuture(null);
            }
            final CompletableFuture<Void> waiter = new CompletableFuture<>();
            drainWaiters.add(waiter);
            return waiter;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails every task that has not started yet with {@link QueueCancelledException}. Running tasks,
     * including those between retries, are left alone.
     *
     * @return The number of tasks cancelled.
     */
    public int cancelAll() {
        final List<QueueEntry<?>> cancelled;
        final List<CompletableFuture<Void>> idleWaiters;
        lock.lock();
        try {
            cancelled = new ArrayList<>(pending);
            pending.clear();
            idleWaiters = takeDrainWaitersIfIdle();
        } finally {
            lock.unlock();
        }

        cancelled.forEach(entry -> entry.result.completeExceptionally(new QueueCancelledException(entry.task.id())));
        idleWaiters.forEach(waiter -> waiter.complete(null));
        if (!cancelled.isEmpty()) {
            log.info("Cancelled {} queued task(s).", cancelled.size());
        }
        return cancelled.size();
    }

    /**
     * Cancels queued tasks and stops the worker threads. Called on container shutdown.
     */
    public void shutdown() {
        cancelAll();
        lock.lock();
        try {
            shutdown = true;
            if (wakeUp != null) {
                wakeUp.cancel(false);
                wakeUp = null;
            }
        } finally {
            lock.unlock();
        }
        gateScheduler.shutdown();
        slotExecutor.shutdown();
        log.info("Work queue shut down.");
    }

    /**
     * Starts as many queued tasks as the slot and rate gates allow. Runs on submit, on slot release
     * and when a scheduled wake-up fires.
     */
    private void dispatch() {
        lock.lock();
        try {
            while (!shutdown && running < capacity && !pending.isEmpty()) {
                final long now = System.nanoTime();
                if (dispatchedBefore) {
                    final long elapsedMs = TimeUnit.NANOSECONDS.toMillis(now - lastDispatchNanos);
                    if (elapsedMs < intervalMs) {
                        scheduleWakeUp(intervalMs - elapsedMs);
                        return;
                    }
                }

                final QueueEntry<?> entry = pending.pollFirst();
                running++;
                lastDispatchNanos = now;
                dispatchedBefore = true;
                log.debug("Dispatching task {} (queued={}, running={})", entry.task.id(), pending.size(), running);
                slotExecutor.execute(() -> runEntry(entry));
            }
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private void scheduleWakeUp(final long delayMs) {
        if (wakeUp != null && !wakeUp.isDone()) {
            return;
        }
        wakeUp = gateScheduler.schedule(this::onWakeUp, Instant.now().plusMillis(delayMs));
    }

    private void onWakeUp() {
        lock.lock();
        try {
            wakeUp = null;
        } finally {
            lock.unlock();
        }
        dispatch();
    }

    private <T> void runEntry(final QueueEntry<T> entry) {
        try {
            final T value = executeWithRetry(entry);
            log.debug("Task {} completed after {} attempt(s)", entry.task.id(), entry.attempt);
            entry.result.complete(value);
        } catch (final Exception e) {
            log.debug("Task {} failed after {} attempt(s)", entry.task.id(), entry.attempt);
            entry.result.completeExceptionally(e);
        } catch (final Error e) {
            log.error("Task {} failed with an error after {} attempt(s)", entry.task.id(), entry.attempt, e);
            entry.result.completeExceptionally(e);
        } finally {
            releaseSlot();
            dispatch();
        }
    }

    private <T> T executeWithRetry(final QueueEntry<T> entry) throws Exception {
        final RetryTemplate retryTemplate = retryTemplateFor(entry.maxRetries);
        return retryTemplate.execute(context -> {
            context.setAttribute(TASK_ID_ATTRIBUTE, entry.task.id());
            entry.attempt = context.getRetryCount() + 1;
            log.debug("Task {} attempt {} of {}", entry.task.id(), entry.attempt, entry.maxRetries + 1);
            return attempt(entry);
        });
    }

    private RetryTemplate retryTemplateFor(final int maxRetries) {
        final ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(backoff.getInitialIntervalMs());
        backOffPolicy.setMultiplier(backoff.getMultiplier());
        backOffPolicy.setMaxInterval(backoff.getMaxIntervalMs());
        backOffPolicy.setSleeper(sleeper);

        final RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new SimpleRetryPolicy(maxRetries + 1, RetryableErrors.TYPES, true));
        retryTemplate.setBackOffPolicy(backOffPolicy);
        retryTemplate.setListeners(retryListeners);
        return retryTemplate;
    }

    /**
     * Runs one attempt and waits for it within the request timeout.
     */
    private <T> T attempt(final QueueEntry<T> entry) throws Exception {
        final CompletableFuture<T> future = entry.task.execute();
        if (future == null) {
            throw new IllegalStateException("Task " + entry.task.id() + " did not return a future.");
        }
        try {
            return future.get(requestTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            throw new TaskTimeoutException(entry.task.id(), requestTimeoutMs);
        } catch (final ExecutionException e) {
            throw unwrap(e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private static Exception unwrap(final Throwable error) {
        Throwable cause = error;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
               && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof Error fatal) {
            throw fatal;
        }
        return (Exception) cause;
    }

    private void releaseSlot() {
        final List<CompletableFuture<Void>> idleWaiters;
        lock.lock();
        try {
            running--;
            idleWaiters = takeDrainWaitersIfIdle();
        } finally {
            lock.unlock();
        }
        idleWaiters.forEach(waiter -> waiter.complete(null));
    }

    // Caller holds the lock.
    private List<CompletableFuture<Void>> takeDrainWaitersIfIdle() {
        if (!pending.isEmpty() || running != 0 || drainWaiters.isEmpty()) {
            return List.of();
        }
        final List<CompletableFuture<Void>> waiters = new ArrayList<>(drainWaiters);
        drainWaiters.clear();
        return waiters;
    }

    private static final class QueueEntry<T> {
        private final QueueTask<T> task;
        private final int maxRetries;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private volatile int attempt;

        private QueueEntry(final QueueTask<T> task, final int maxRetries) {
            this.task = task;
            this.maxRetries = maxRetries;
        }
    }
}
