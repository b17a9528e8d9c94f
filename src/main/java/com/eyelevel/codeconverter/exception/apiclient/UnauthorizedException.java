package com.eyelevel.codeconverter.exception.apiclient;

import java.io.Serial;

/**
 * The request carried no valid credential (HTTP 401), or no temporary token could be obtained for it.
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = -5709728403403396930L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
