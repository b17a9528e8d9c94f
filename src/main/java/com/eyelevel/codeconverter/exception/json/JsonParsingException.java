package com.eyelevel.codeconverter.exception.json;

import java.io.Serial;

/**
 * Thrown when an API payload cannot be parsed into the expected type.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -4315221486898941505L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
