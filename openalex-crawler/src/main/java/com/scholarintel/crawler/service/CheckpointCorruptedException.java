package com.scholarintel.crawler.service;

public class CheckpointCorruptedException extends FatalCrawlException {

    public CheckpointCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
