package io.corekit.network;

import java.time.Duration;

import io.corekit.util.Assert;

/**
 * Outcome of {@link RequestInterceptor#shouldRetry}.
 *
 * @param retry whether the request is sent again
 * @param delay how long to wait before sending it; zero retries immediately
 */
public record RetryDecision(boolean retry, Duration delay) {

    public static final RetryDecision DO_NOT_RETRY = new RetryDecision(false, Duration.ZERO);
    public static final RetryDecision RETRY_NOW = new RetryDecision(true, Duration.ZERO);

    public RetryDecision {
        Assert.checkNotNullParam("delay", delay);
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }
}
