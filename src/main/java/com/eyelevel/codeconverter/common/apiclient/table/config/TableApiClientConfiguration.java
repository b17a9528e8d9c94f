package com.eyelevel.codeconverter.common.apiclient.table.config;

import com.eyelevel.codeconverter.common.apiclient.authentication.Authentication;
import com.eyelevel.codeconverter.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.codeconverter.common.apiclient.model.HeaderConfig;
import com.eyelevel.codeconverter.upload.credential.CredentialProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the {@link WebClient}, authentication and headers of the table API client.
 */
@Slf4j
@Configuration
public class TableApiClientConfiguration {

    @Value("${app.table-client.baseurl}")
    private String baseUrl;

    @Value("${spring.application.name:codeconverter}")
    private String applicationName;

    @Value("${app.table-client.max-in-memory-size-bytes:16777216}")
    private int maxInMemorySize;

    @Bean("tableWebClient")
    public WebClient tableWebClient(WebClient.Builder builder) {
        log.info("Initializing table API WebClient with base URL: {}", baseUrl);
        return builder
                .baseUrl(baseUrl)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .build();
    }

    /**
     * Bearer authentication resolving a new temporary token for every request.
     */
    @Bean("tableAuthentication")
    public Authentication tableAuthentication(CredentialProvider credentialProvider) {
        return new BearerTokenAuthentication(credentialProvider);
    }

    @Bean("tableHeader")
    public HeaderConfig tableHeader() {
        return new HeaderConfig().with("X-Client-Name", applicationName);
    }
}
