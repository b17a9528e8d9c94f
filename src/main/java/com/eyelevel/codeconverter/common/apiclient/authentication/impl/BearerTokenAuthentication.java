package com.eyelevel.codeconverter.common.apiclient.authentication.impl;

import com.eyelevel.codeconverter.common.apiclient.authentication.Authentication;
import com.eyelevel.codeconverter.exception.apiclient.UnauthorizedException;
import com.eyelevel.codeconverter.model.AccessToken;
import com.eyelevel.codeconverter.upload.credential.CredentialProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Sends a bearer token obtained from a {@link CredentialProvider} for every single request.
 *
 * <p>No token is kept between requests. Temporary tokens expire within minutes while a large batch
 * can run much longer, so whether a token may be reused is left entirely to the provider.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerTokenAuthentication implements Authentication {

    private final CredentialProvider credentialProvider;

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        final AccessToken token = credentialProvider.fetchCredential();
        if (token == null || !StringUtils.hasText(token.accessToken())) {
            throw new UnauthorizedException("Failed to obtain a fresh access token for the request.");
        }
        log.trace("Applying bearer token expiring at {}", token.expiresTime());
        headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + token.accessToken());
    }
}
