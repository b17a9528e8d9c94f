package com.eyelevel.codeconverter.model;

/**
 * A snapshot of a run's counters.
 *
 * @param success    Items whose attachment was stored.
 * @param failed     Items that failed to encode or upload, including cancelled ones.
 * @param processing Items accepted but not settled yet.
 */
public record ConversionStats(int success, int failed, int processing) {

    public static final ConversionStats EMPTY = new ConversionStats(0, 0, 0);

    public int settled() {
        return success + failed;
    }

    public int total() {
        return success + failed + processing;
    }
}
