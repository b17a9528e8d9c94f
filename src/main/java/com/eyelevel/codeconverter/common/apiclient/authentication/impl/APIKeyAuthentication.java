package com.eyelevel.codeconverter.common.apiclient.authentication.impl;

import com.eyelevel.codeconverter.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Sends a static API key in a configurable header. Used for the token endpoint, which issues the
 * short-lived credentials that every other call is made with.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        if (headers == null) {
            throw new IllegalArgumentException("Header map cannot be null when applying API key authentication.");
        }
        log.debug("Applying API key authentication using header: '{}'", headerName);
        headers.put(headerName, apiKey);
    }
}
