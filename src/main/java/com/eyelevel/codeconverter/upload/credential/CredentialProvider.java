package com.eyelevel.codeconverter.upload.credential;

import com.eyelevel.codeconverter.model.AccessToken;

/**
 * Supplies the credential for one outgoing request.
 *
 * <p>Called for every request. Callers must not hold on to the returned token; an implementation
 * that wants to reuse tokens has to account for their expiry itself.
 */
public interface CredentialProvider {

    /**
     * @return A token valid for at least the duration of one request.
     * @throws com.eyelevel.codeconverter.exception.apiclient.ApiException if no token can be issued.
     */
    AccessToken fetchCredential();
}
