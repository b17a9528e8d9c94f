package com.eyelevel.codeconverter.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for failures returned by, or raised while talking to, a remote HTTP API.
 *
 * <p>Carries the HTTP status code so the work queue can decide whether a failed upload is worth
 * another attempt. Subclasses exist for every status the clients map explicitly; any other status
 * is represented by this class directly.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;

    /**
     * Constructs a new ApiException with the specified message and status code.
     *
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
