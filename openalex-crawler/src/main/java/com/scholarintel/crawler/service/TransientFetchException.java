package com.scholarintel.crawler.service;

/**
 * Timeout, dropped connection or 5xx. Worth retrying the same request.
 */
public class TransientFetchException extends RuntimeException {

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
