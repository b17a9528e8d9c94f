package com.eyelevel.codeconverter.exception.apiclient;

import java.io.Serial;

/**
 * The request did not complete within the client timeout, or a proxy timed out upstream (HTTP 504). Transient.
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = -7071019530397087493L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
