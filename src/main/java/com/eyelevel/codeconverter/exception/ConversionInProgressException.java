package com.eyelevel.codeconverter.exception;

import java.io.Serial;

/**
 * Thrown when a conversion is requested while another one is still running.
 */
public class ConversionInProgressException extends ConversionException {
    @Serial
    private static final long serialVersionUID = -8122460931587404375L;

    public ConversionInProgressException() {
        super("A conversion is already running. Wait for it to finish or abort it first.");
    }
}
