package com.eyelevel.codeconverter.exception.apiclient;

import java.io.Serial;

/**
 * The table, record or attachment field addressed by the request does not exist (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3051703506470244006L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
