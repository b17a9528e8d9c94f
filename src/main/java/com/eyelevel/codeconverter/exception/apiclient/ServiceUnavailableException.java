package com.eyelevel.codeconverter.exception.apiclient;

import java.io.Serial;

/**
 * The table API is overloaded or unreachable (HTTP 503). Also raised for refused or reset connections. Transient.
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2812514621225838422L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
