package com.eyelevel.codeconverter.common.apiclient.auth.config;

import com.eyelevel.codeconverter.common.apiclient.authentication.Authentication;
import com.eyelevel.codeconverter.common.apiclient.authentication.impl.APIKeyAuthentication;
import com.eyelevel.codeconverter.common.apiclient.model.HeaderConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the {@link WebClient}, authentication and headers of the token endpoint client.
 */
@Slf4j
@Configuration
public class AuthApiClientConfiguration {

    @Value("${app.auth-client.baseurl}")
    private String baseUrl;

    @Value("${app.auth-client.auth-key-name}")
    private String authKeyName;

    @Value("${app.auth-client.auth-key-value}")
    private String authKeyValue;

    @Value("${spring.application.name:codeconverter}")
    private String applicationName;

    @Bean("authWebClient")
    public WebClient authWebClient(WebClient.Builder builder) {
        log.info("Initializing auth API WebClient with base URL: {}", baseUrl);
        return builder.baseUrl(baseUrl).build();
    }

    @Bean("authAuthentication")
    public Authentication authAuthentication() {
        return new APIKeyAuthentication(authKeyName, authKeyValue);
    }

    @Bean("authHeader")
    public HeaderConfig authHeader() {
        return new HeaderConfig().with("X-Client-Name", applicationName);
    }
}
