package com.eyelevel.codeconverter.exception.apiclient;

import java.io.Serial;

/**
 * The record changed concurrently and the server refused the write (HTTP 409).
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = -318246245731973719L;

    public ConflictException(String message) {
        super(message, 409);
    }
}
