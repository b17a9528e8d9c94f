package com.eyelevel.codeconverter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A short-lived credential issued by the token endpoint.
 *
 * @param accessToken The bearer token.
 * @param expiresTime When the token stops being accepted, as sent by the server (ISO-8601).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccessToken(String accessToken, String expiresTime) {

    @Override
    public String toString() {
        return "AccessToken[expiresTime=" + expiresTime + "]";
    }
}
