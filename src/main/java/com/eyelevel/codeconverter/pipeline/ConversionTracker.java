package com.eyelevel.codeconverter.pipeline;

import com.eyelevel.codeconverter.model.ConversionStats;
import com.eyelevel.codeconverter.model.FailureStage;
import com.eyelevel.codeconverter.model.ItemFailure;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counters and progress of one run. Every change is published to the listener while the lock is held,
 * so listeners observe a single ordered sequence of snapshots.
 */
@Slf4j
class ConversionTracker {

    private static final double COMPLETE = 100.0;

    private final int totalItems;
    private final ConversionListener listener;
    private final ReentrantLock lock = new ReentrantLock();
    private final CompletableFuture<ConversionStats> completion = new CompletableFuture<>();

    private int success;
    private int failed;
    private int processing;
    private double progress;

    ConversionTracker(final int totalItems, final ConversionListener listener) {
        this.totalItems = totalItems;
        this.listener = listener;
    }

    CompletableFuture<ConversionStats> completion() {
        return completion;
    }

    /**
     * Finishes a run that accepted no items.
     */
    void completeEmpty() {
        lock.lock();
        try {
            publishProgress(COMPLETE);
            publishStats(snapshot());
        } finally {
            lock.unlock();
        }
        completion.complete(ConversionStats.EMPTY);
    }

    void accepted() {
        lock.lock();
        try {
            processing++;
            publishStats(snapshot());
        } finally {
            lock.unlock();
        }
    }

    void succeeded() {
        settle(true, null);
    }

    void failed(final String recordId, final String value, final String reason, final FailureStage stage) {
        settle(false, new ItemFailure(recordId, value, reason, stage));
    }

    private void settle(final boolean ok, final ItemFailure failure) {
        final ConversionStats finalStats;
        lock.lock();
        try {
            processing--;
            if (ok) {
                success++;
            } else {
                failed++;
                notifyListener(() -> listener.onItemFailed(failure));
            }

            final ConversionStats stats = snapshot();
            final boolean done = stats.settled() == totalItems;
            publishStats(stats);
            publishProgress(done ? COMPLETE : stats.settled() * COMPLETE / totalItems);
            finalStats = done ? stats : null;
        } finally {
            lock.unlock();
        }

        if (finalStats != null) {
            log.info("Conversion finished: {} succeeded, {} failed of {}", finalStats.success(), finalStats.failed(),
                     totalItems);
            completion.complete(finalStats);
        }
    }

    // Caller holds the lock.
    private void publishProgress(final double value) {
        if (value < progress) {
            return;
        }
        progress = value;
        notifyListener(() -> listener.onProgress(value));
    }

    // Caller holds the lock.
    private void publishStats(final ConversionStats stats) {
        notifyListener(() -> listener.onStatsChange(stats));
    }

    private ConversionStats snapshot() {
        return new ConversionStats(success, failed, processing);
    }

    private static void notifyListener(final Runnable callback) {
        try {
            callback.run();
        } catch (final RuntimeException e) {
            log.warn("Conversion listener threw an exception, ignoring it.", e);
        }
    }
}
