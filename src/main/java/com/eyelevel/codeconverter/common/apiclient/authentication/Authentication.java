package com.eyelevel.codeconverter.common.apiclient.authentication;

import java.util.Map;

/**
 * Defines the contract for applying authentication to an API request.
 *
 * <p>Called once per request, immediately before it is sent. Implementations that hold short-lived
 * credentials must resolve them here rather than at construction time.
 */
public interface Authentication {

    /**
     * Adds the authentication headers for one request.
     *
     * @param headers The mutable header map of the outgoing request.
     */
    void applyAuthentication(Map<String, String> headers);
}
