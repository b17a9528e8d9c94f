package com.eyelevel.codeconverter.queue;

import com.eyelevel.codeconverter.exception.TaskTimeoutException;
import com.eyelevel.codeconverter.exception.apiclient.BadGatewayException;
import com.eyelevel.codeconverter.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.codeconverter.exception.apiclient.InternalServerException;
import com.eyelevel.codeconverter.exception.apiclient.ServiceUnavailableException;
import org.springframework.classify.BinaryExceptionClassifier;

import java.net.SocketException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * The failures a queued task is retried for: HTTP 500, 502, 503 and 504, reset or refused
 * connections, and timeouts. Anything else is fatal. Causes are inspected too, so a transient
 * failure wrapped by a caller still counts as transient.
 */
public final class RetryableErrors {

    /**
     * Exception types mapped to {@code true} when retryable, in the form spring-retry policies take.
     */
    public static final Map<Class<? extends Throwable>, Boolean> TYPES = Map.of(
            InternalServerException.class, true,
            BadGatewayException.class, true,
            ServiceUnavailableException.class, true,
            GatewayTimeoutException.class, true,
            SocketException.class, true,
            TaskTimeoutException.class, true,
            TimeoutException.class, true
    );

    private static final BinaryExceptionClassifier CLASSIFIER = new BinaryExceptionClassifier(TYPES, false, true);

    private RetryableErrors() {
    }

    public static boolean isRetryable(Throwable error) {
        return error != null && CLASSIFIER.classify(error);
    }
}
