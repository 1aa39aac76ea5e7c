package com.scholarintel.crawler.service;

public class StoreCorruptedException extends FatalCrawlException {

    public StoreCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
