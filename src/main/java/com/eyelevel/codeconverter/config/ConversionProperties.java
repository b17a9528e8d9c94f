package com.eyelevel.codeconverter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Binds application properties under the "app.conversion" prefix: the limits of the upload work queue
 * and how records are read from the table.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.conversion")
public class ConversionProperties {

    @Valid
    private Queue queue = new Queue();

    @Valid
    private Records records = new Records();

    @Data
    public static class Queue {
        @Positive
        private int maxConcurrency = 3;

        /**
         * Minimum gap between two task dispatches.
         */
        @PositiveOrZero
        private long requestIntervalMs = 150;

        /**
         * Retries after the first attempt, for tasks that do not set their own.
         */
        @PositiveOrZero
        private int maxRetries = 3;

        @Positive
        private long requestTimeoutMs = 30_000;

        @Valid
        private Backoff backoff = new Backoff();
    }

    @Data
    public static class Backoff {
        @Positive
        private long initialIntervalMs = 1_000;

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        @Positive
        private long maxIntervalMs = 10_000;
    }

    @Data
    public static class Records {
        @Positive
        @Max(1000)
        private int pageSize = 1000;
    }
}
