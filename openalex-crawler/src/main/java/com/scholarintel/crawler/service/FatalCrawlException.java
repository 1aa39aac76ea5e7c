package com.scholarintel.crawler.service;

/**
 * Persisted state can no longer be trusted. The run aborts without further writes.
 */
public class FatalCrawlException extends RuntimeException {

    public FatalCrawlException(String message, Throwable cause) {
        super(message, cause);
    }
}
