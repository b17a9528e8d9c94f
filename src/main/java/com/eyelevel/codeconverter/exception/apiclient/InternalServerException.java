package com.eyelevel.codeconverter.exception.apiclient;

import java.io.Serial;

/**
 * The server failed while handling the request (HTTP 500). Transient: the attachment may even have been stored, so the upload is retried.
 */
public class InternalServerException extends ApiException {

    @Serial
    private static final long serialVersionUID = 391091864299701366L;

    public InternalServerException(String message) {
        super(message, 500);
    }
}
