package com.eyelevel.codeconverter.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * The outcome of a finished run, as shown to the user.
 *
 * @param totalItems Records with a non-empty value; empty ones are not counted anywhere.
 * @param stats      Final counters. {@code processing} is always zero.
 * @param failures   One entry per failed item, in settlement order.
 * @param startedAt  When the run was requested.
 * @param finishedAt When the last item settled.
 */
public record ConversionReport(int totalItems, ConversionStats stats, List<ItemFailure> failures,
                               Instant startedAt, Instant finishedAt) {

    public ConversionReport {
        failures = List.copyOf(failures);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
