package com.eyelevel.codeconverter.common.apiclient.auth;

import com.eyelevel.codeconverter.common.apiclient.ApiClient;
import com.eyelevel.codeconverter.common.apiclient.authentication.Authentication;
import com.eyelevel.codeconverter.common.apiclient.model.ApiRequest;
import com.eyelevel.codeconverter.common.apiclient.model.ApiResponse;
import com.eyelevel.codeconverter.common.apiclient.model.HeaderConfig;
import com.eyelevel.codeconverter.common.json.JsonParser;
import com.eyelevel.codeconverter.exception.apiclient.ApiException;
import com.eyelevel.codeconverter.model.AccessToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Client for the token endpoint, which exchanges the static API key for a short-lived access token.
 */
@Slf4j
@Service("authApiClient")
public class AuthApiClient extends ApiClient {

    private final JsonParser jsonParser;
    private final String tempTokenEndpoint;

    public AuthApiClient(
            @Qualifier("authWebClient") final WebClient webClient,
            @Qualifier("authAuthentication") final Authentication authentication,
            @Qualifier("authHeader") final HeaderConfig headerConfig,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Value("${app.auth-client.endpoint.temp-token}") final String tempTokenEndpoint
    ) {
        super(webClient, authentication, headerConfig);
        this.jsonParser = jsonParser;
        this.tempTokenEndpoint = tempTokenEndpoint;
    }

    /**
     * Requests a new temporary token.
     *
     * @return The token and its expiry.
     * @throws ApiException if the endpoint rejects the key or cannot be reached.
     */
    public AccessToken fetchTemporaryToken() {
        final ApiRequest apiRequest = ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(tempTokenEndpoint)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();

        final ApiResponse apiResponse = call(apiRequest);
        final AccessToken token = jsonParser.parseObject(apiResponse.getData(), AccessToken.class);
        log.debug("Issued temporary token expiring at {}", token.expiresTime());
        return token;
    }
}
