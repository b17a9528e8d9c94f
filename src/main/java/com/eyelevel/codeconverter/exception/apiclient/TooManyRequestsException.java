package com.eyelevel.codeconverter.exception.apiclient;

import java.io.Serial;

/**
 * The server throttled the client (HTTP 429). Treated as fatal; the work queue's own rate limit is expected to prevent it.
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6576126133407459351L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
