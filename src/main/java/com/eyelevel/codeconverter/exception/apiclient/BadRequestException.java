package com.eyelevel.codeconverter.exception.apiclient;

import java.io.Serial;

/**
 * The table API rejected the request as malformed (HTTP 400). Never retried: the same payload fails again.
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -4414516763190851688L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
