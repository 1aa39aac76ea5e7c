package com.scholarintel.crawler.service;

import com.scholarintel.crawler.config.CrawlerProperties;

/**
 * Per-run overrides of the configured fetch concurrency and storage ceiling.
 *
 * @param concurrency  number of parallel page fetches, at least 1
 * @param maxStorageMb storage ceiling for this run, null for the configured one
 */
public record RunOptions(int concurrency, Long maxStorageMb) {

    public RunOptions {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        if (maxStorageMb != null && maxStorageMb <= 0) {
            throw new IllegalArgumentException("maxStorageMb must be positive, got " + maxStorageMb);
        }
    }

    public static RunOptions defaults(CrawlerProperties properties) {
        return new RunOptions(Math.max(1, properties.getFetch().getConcurrency()), null);
    }
}
