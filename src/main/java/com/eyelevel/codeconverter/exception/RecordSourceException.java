package com.eyelevel.codeconverter.exception;

import java.io.Serial;

/**
 * Thrown when the source records of a run cannot be read, before any item is processed.
 */
public class RecordSourceException extends ConversionException {
    @Serial
    private static final long serialVersionUID = 2386911046213561872L;

    public RecordSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
