package com.eyelevel.codeconverter.queue;

import com.eyelevel.codeconverter.exception.EncodeException;
import com.eyelevel.codeconverter.exception.TaskTimeoutException;
import com.eyelevel.codeconverter.exception.apiclient.*;
import org.junit.jupiter.api.Test;

import java.net.SocketException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class RetryableErrorsTest {

    @Test
    void testServerErrorsAreRetryable() {
        assertTrue(RetryableErrors.isRetryable(new InternalServerException("500")));
        assertTrue(RetryableErrors.isRetryable(new BadGatewayException("502")));
        assertTrue(RetryableErrors.isRetryable(new ServiceUnavailableException("503")));
        assertTrue(RetryableErrors.isRetryable(new GatewayTimeoutException("504")));
    }

    @Test
    void testConnectionResetAndTimeoutsAreRetryable() {
        assertTrue(RetryableErrors.isRetryable(new SocketException("Connection reset")));
        assertTrue(RetryableErrors.isRetryable(new TimeoutException()));
        assertTrue(RetryableErrors.isRetryable(new TaskTimeoutException("t", 100)));
    }

    @Test
    void testWrappedTransientErrorIsRetryable() {
        assertTrue(RetryableErrors.isRetryable(new CompletionException(new ServiceUnavailableException("503"))));
    }

    @Test
    void testClientErrorsAreFatal() {
        assertFalse(RetryableErrors.isRetryable(new BadRequestException("400")));
        assertFalse(RetryableErrors.isRetryable(new UnauthorizedException("401")));
        assertFalse(RetryableErrors.isRetryable(new ForbiddenException("403")));
        assertFalse(RetryableErrors.isRetryable(new NotFoundException("404")));
        assertFalse(RetryableErrors.isRetryable(new TooManyRequestsException("429")));
        assertFalse(RetryableErrors.isRetryable(new ApiException("418", 418)));
    }

    @Test
    void testOtherErrorsAreFatal() {
        assertFalse(RetryableErrors.isRetryable(new EncodeException("bad digits")));
        assertFalse(RetryableErrors.isRetryable(new IllegalStateException()));
        assertFalse(RetryableErrors.isRetryable(null));
    }
}
