package com.eyelevel.codeconverter.exception;

import java.io.Serial;

/**
 * A base exception for errors that prevent a conversion run from being attempted at all.
 * Failures of individual records never surface as this type; they are folded into the run statistics.
 */
public class ConversionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
