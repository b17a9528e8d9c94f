package com.eyelevel.codeconverter.upload.credential;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("credentialRetryListener")
@Slf4j
public class CredentialRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Fetching a temporary token failed on attempt {}: {}", context.getRetryCount(),
                 throwable.getMessage());
    }
}
