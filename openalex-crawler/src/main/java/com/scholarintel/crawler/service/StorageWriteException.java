package com.scholarintel.crawler.service;

/**
 * A batch write failed and was rolled back; nothing of the batch is committed.
 */
public class StorageWriteException extends RuntimeException {

    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
