package com.xedledom.fetch;

import java.time.Duration;

/**
 * Retry bounds for {@link HttpFetcher}: attempt count and the range of the short
 * randomized pause taken after a failed attempt that was not rate limited.
 */
public record FetchPolicy(int maxAttempts, Duration backoffMin, Duration backoffMax) {

    public static final FetchPolicy DEFAULT = new FetchPolicy(3, Duration.ofMillis(800), Duration.ofMillis(1800));

    public FetchPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        backoffMin = backoffMin == null || backoffMin.isNegative() ? Duration.ZERO : backoffMin;
        backoffMax = backoffMax == null || backoffMax.compareTo(backoffMin) < 0 ? backoffMin : backoffMax;
    }
}
