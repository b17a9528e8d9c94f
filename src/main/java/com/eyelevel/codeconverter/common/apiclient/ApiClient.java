package com.eyelevel.codeconverter.common.apiclient;

import com.eyelevel.codeconverter.common.apiclient.authentication.Authentication;
import com.eyelevel.codeconverter.common.apiclient.model.ApiRequest;
import com.eyelevel.codeconverter.common.apiclient.model.ApiResponse;
import com.eyelevel.codeconverter.common.apiclient.model.HeaderConfig;
import com.eyelevel.codeconverter.exception.apiclient.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Abstract base class for API clients, providing common functionality for making API calls,
 * handling responses, and mapping exceptions. Subclasses configure the {@link WebClient},
 * {@link Authentication} and {@link HeaderConfig} they need and expose typed operations.
 *
 * <p>Every failure leaves this class as an {@link ApiException} carrying an HTTP status code:
 * error responses map to the subclass for their status, connection failures to
 * {@link ServiceUnavailableException} and timeouts to {@link GatewayTimeoutException}.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class ApiClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;

    /**
     * Executes an API call and blocks until the response is available.
     *
     * @param apiRequest The API request to execute. Must not be null.
     *
     * @return The API response.
     *
     * @throws ApiException If there is an error during the API call.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.info("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());

        try {
            ApiResponse apiResponse = exchange(apiRequest).block();
            log.debug("Received response with status: {}", apiResponse == null ? null : apiResponse.getStatusCode());
            return apiResponse;
        } catch (ApiException e) {
            log.warn("API call {} {} failed with status {}: {}", apiRequest.getMethod(), apiRequest.getPath(),
                     e.getStatusCode(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Exception during API call", e);
            throw mapException(e);
        }
    }

    /**
     * Executes an API call without blocking the caller. Authentication is applied on a
     * bounded-elastic worker when the returned future is created, since resolving a credential
     * may itself require a blocking call.
     *
     * @param apiRequest The API request to execute. Must not be null.
     *
     * @return A future completing with the response, or exceptionally with an {@link ApiException}.
     */
    protected CompletableFuture<ApiResponse> callAsync(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.info("Calling API asynchronously with method: {} and path: {}", apiRequest.getMethod(),
                 apiRequest.getPath());

        return Mono.defer(() -> exchange(apiRequest))
                   .subscribeOn(Schedulers.boundedElastic())
                   .doOnError(ApiException.class, e -> log.warn("Async API call {} {} failed with status {}: {}",
                                                                apiRequest.getMethod(), apiRequest.getPath(),
                                                                e.getStatusCode(), e.getMessage()))
                   .toFuture();
    }

    private Mono<ApiResponse> exchange(ApiRequest apiRequest) {
        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            return requestBodySpec.exchangeToMono(this::handleResponse)
                                  .timeout(DEFAULT_TIMEOUT)
                                  .onErrorMap(this::mapException);
        } catch (Exception e) {
            return Mono.error(mapException(e));
        }
    }

    /**
     * Maps exceptions to {@link ApiException}s based on the type of exception and, for
     * {@link WebClientResponseException}, the HTTP status code. Exceptions that are already
     * {@link ApiException}s pass through unchanged so their status survives.
     *
     * @param error The throwable error.
     *
     * @return A specific {@link RuntimeException} representing the error.
     */
    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        log.warn("Mapping exception: {}", error.getMessage());

        if (error instanceof WebClientResponseException webClientError) {
            String responseBody = webClientError.getResponseBodyAsString();
            int statusCode = webClientError.getStatusCode().value();
            return createException(responseBody, statusCode);

        } else if (error instanceof WebClientRequestException || error instanceof ConnectException ||
                   error instanceof SocketException || error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());

        } else if (error instanceof java.util.concurrent.TimeoutException) {
            return new GatewayTimeoutException("Request timed out: " + error.getMessage());

        } else if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());

        } else {
            log.error("An error occurred on API client", error);
            return new ApiException("Internal API client error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
    }

    /**
     * Sets the HTTP method and URI. Query parameters and path variables are added to the URI.
     */
    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());

            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));

            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    /**
     * Applies authentication, the client-wide headers from {@link HeaderConfig} and the request headers,
     * in that order. Authentication writes into a copy so the request itself can be sent again.
     */
    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        Map<String, String> headers = new HashMap<>();
        Optional.ofNullable(apiRequest.getHeaders()).ifPresent(headers::putAll);
        authentication.applyAuthentication(headers);

        if (headerConfig != null && headerConfig.getHeaders() != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.getName(), header.getValue()));
        }

        headers.forEach(requestBodySpec::header);
        log.trace("Applied {} request headers", headers.size());

        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }

        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        Instant timestamp = Instant.now();
        HttpHeaders headers = response.headers().asHttpHeaders();
        int statusCode = response.statusCode().value();

        if (response.statusCode().is2xxSuccessful()) {
            log.debug("Response was successful, statusCode {}", statusCode);
            return response.bodyToMono(byte[].class)
                           .defaultIfEmpty(new byte[0])
                           .map(data -> ApiResponse.builder()
                                                   .data(data)
                                                   .contentType(headers.getContentType())
                                                   .headers(headers)
                                                   .statusCode(statusCode)
                                                   .timestamp(timestamp)
                                                   .build())
                           .onErrorMap(error -> new ApiException("Error processing response: " + error.getMessage(),
                                                                 statusCode));
        }

        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    /**
     * Creates the {@link ApiException} subclass matching an HTTP status code.
     *
     * @param body       The error message from the response body.
     * @param statusCode The HTTP status code.
     *
     * @return An {@link ApiException} representing the error.
     */
    private ApiException createException(String body, int statusCode) {
        String message = body == null || body.isBlank() ? "HTTP " + statusCode : body;
        ApiException exception = switch (statusCode) {
            case 400 -> new BadRequestException(message);
            case 401 -> new UnauthorizedException(message);
            case 403 -> new ForbiddenException(message);
            case 404 -> new NotFoundException(message);
            case 409 -> new ConflictException(message);
            case 429 -> new TooManyRequestsException(message);
            case 500 -> new InternalServerException(message);
            case 502 -> new BadGatewayException(message);
            case 503 -> new ServiceUnavailableException(message);
            case 504 -> new GatewayTimeoutException(message);
            default -> new ApiException(message, statusCode);
        };
        log.debug("Api request failing with {}: {}", exception.getClass().getSimpleName(), exception.getMessage());
        return exception;
    }
}
