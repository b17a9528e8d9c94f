package com.eyelevel.codeconverter.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Describes one HTTP call made through an {@link com.eyelevel.codeconverter.common.apiclient.ApiClient}.
 *
 * <p>A request is built per attempt. Authentication headers are not stored here; they are applied to a
 * copy of {@link #headers} every time the request is sent, so a retried upload picks up a new credential.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    /**
     * Path relative to the client's base URL. May contain {@code {name}} placeholders.
     */
    private final String path;

    @Nullable
    private final Map<String, Object> queryParams;

    /**
     * Values for the {@code {name}} placeholders in {@link #path}.
     */
    @Nullable
    private final Map<String, Object> pathVariables;

    /**
     * Request-specific headers. Defaults to an empty mutable map.
     */
    @Builder.Default
    private final Map<String, String> headers = new HashMap<>();

    /**
     * The request body: a JSON-serializable object, or a multipart map built with
     * {@link org.springframework.http.client.MultipartBodyBuilder}.
     */
    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    /**
     * Content type of {@link #body}. JSON is assumed when absent.
     */
    @Nullable
    private final MediaType contentType;
}
