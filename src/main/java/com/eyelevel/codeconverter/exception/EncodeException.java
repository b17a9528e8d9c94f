package com.eyelevel.codeconverter.exception;

import java.io.Serial;

/**
 * Thrown by an encoder when a value cannot be represented in the requested symbology,
 * for example a wrong digit count for a checksum-based barcode. Never retried.
 */
public class EncodeException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -2707615300213954164L;

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
