package com.eyelevel.codeconverter.upload.credential;

import com.eyelevel.codeconverter.common.apiclient.auth.AuthApiClient;
import com.eyelevel.codeconverter.exception.apiclient.BadGatewayException;
import com.eyelevel.codeconverter.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.codeconverter.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.codeconverter.exception.apiclient.UnauthorizedException;
import com.eyelevel.codeconverter.model.AccessToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Issues a new temporary token for every request. Tokens are never cached, so a run that outlives
 * a token's lifetime keeps working.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemporaryTokenCredentialProvider implements CredentialProvider {

    private final AuthApiClient authApiClient;

    @Override
    @Retryable(
            retryFor = {ServiceUnavailableException.class, GatewayTimeoutException.class, BadGatewayException.class},
            maxAttemptsExpression = "#{${app.auth-client.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.auth-client.retry.delay-ms:500}}"),
            listeners = {"credentialRetryListener"}
    )
    public AccessToken fetchCredential() {
        final AccessToken token = authApiClient.fetchTemporaryToken();
        if (token == null || !StringUtils.hasText(token.accessToken())) {
            log.error("Token endpoint answered without an access token.");
            throw new UnauthorizedException("Token endpoint returned no access token.");
        }
        return token;
    }
}
