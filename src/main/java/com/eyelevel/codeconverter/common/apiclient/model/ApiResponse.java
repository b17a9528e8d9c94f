package com.eyelevel.codeconverter.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * A successful (2xx) response from a remote API. Error responses never produce an instance;
 * they are raised as {@link com.eyelevel.codeconverter.exception.apiclient.ApiException}s instead.
 */
@Builder
@Getter
public class ApiResponse {

    /**
     * Raw response body. Empty when the server sent no content.
     */
    @Nullable
    private final byte[] data;

    @Nullable
    private final MediaType contentType;

    @Nullable
    private final HttpHeaders headers;

    private final int statusCode;

    /**
     * When the response status line was received.
     */
    private final Instant timestamp;
}
