package com.eyelevel.codeconverter.exception.apiclient;

import java.io.Serial;

/**
 * A proxy in front of the table API received an invalid upstream response (HTTP 502). Transient.
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6346735715117211440L;

    public BadGatewayException(String message) {
        super(message, 502);
    }
}
