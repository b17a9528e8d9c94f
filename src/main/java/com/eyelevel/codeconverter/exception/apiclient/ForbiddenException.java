package com.eyelevel.codeconverter.exception.apiclient;

import java.io.Serial;

/**
 * The credential is valid but may not write to the target table or field (HTTP 403).
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6437220154468580078L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
