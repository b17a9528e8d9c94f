package com.eyelevel.codeconverter.exception;

import java.io.Serial;

/**
 * Thrown when a conversion request or its encoding configuration is incomplete.
 */
public class InvalidConversionConfigException extends ConversionException {
    @Serial
    private static final long serialVersionUID = -1950834122983004511L;

    public InvalidConversionConfigException(String message) {
        super(message);
    }
}
