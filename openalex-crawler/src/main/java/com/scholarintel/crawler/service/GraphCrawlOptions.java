package com.scholarintel.crawler.service;

import java.time.Duration;

/**
 * Bounds of a citation-graph crawl.
 *
 * @param seed      work id, short (W123) or full URL
 * @param depth     number of BFS layers beyond the seed, at least 1
 * @param maxNodes  stop once this many works are stored
 * @param timeLimit wall-clock limit, null for none
 */
public record GraphCrawlOptions(String seed, int depth, int maxNodes, Duration timeLimit) {

    public GraphCrawlOptions {
        if (seed == null || seed.isBlank()) {
            throw new IllegalArgumentException("seed must not be blank");
        }
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1, got " + depth);
        }
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be at least 1, got " + maxNodes);
        }
        if (timeLimit != null && (timeLimit.isNegative() || timeLimit.isZero())) {
            throw new IllegalArgumentException("timeLimit must be positive");
        }
    }
}
