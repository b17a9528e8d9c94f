package com.eyelevel.codeconverter.config;

import com.eyelevel.codeconverter.queue.RateLimitedWorkQueue;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.util.List;

/**
 * Creates the shared upload work queue from the "app.conversion.queue" properties.
 */
@Configuration
public class WorkQueueConfig {

    @Bean(destroyMethod = "shutdown")
    public RateLimitedWorkQueue uploadWorkQueue(ConversionProperties conversionProperties,
                                                @Qualifier("queueRetryListener") RetryListener queueRetryListener) {
        return new RateLimitedWorkQueue(conversionProperties.getQueue(), new ThreadWaitSleeper(),
                                        List.of(queueRetryListener));
    }
}
