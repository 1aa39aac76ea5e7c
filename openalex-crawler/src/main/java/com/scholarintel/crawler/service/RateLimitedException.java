package com.scholarintel.crawler.service;

import java.time.Duration;
import java.util.Optional;

/**
 * HTTP 429 from the upstream, with the Retry-After hint when one was sent.
 */
public class RateLimitedException extends RuntimeException {

    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
