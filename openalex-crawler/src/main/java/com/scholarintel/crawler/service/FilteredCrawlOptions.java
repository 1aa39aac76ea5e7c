package com.scholarintel.crawler.service;

import com.scholarintel.crawler.model.WorksQuery;
import com.scholarintel.crawler.model.YearRange;

import java.time.Duration;

/**
 * A one-off crawl of a single filtered /works listing.
 *
 * @param label     run name shown in status, e.g. "author:A123" or "years:2019-2020"
 * @param query     listing to page through
 * @param maxWorks  stop once this many works are stored
 * @param timeLimit wall-clock limit, null for none
 */
public record FilteredCrawlOptions(String label, WorksQuery query, int maxWorks, Duration timeLimit) {

    public FilteredCrawlOptions {
        if (query == null) {
            throw new IllegalArgumentException("query must not be null");
        }
        if (maxWorks < 1) {
            throw new IllegalArgumentException("maxWorks must be at least 1, got " + maxWorks);
        }
        if (timeLimit != null && (timeLimit.isNegative() || timeLimit.isZero())) {
            throw new IllegalArgumentException("timeLimit must be positive");
        }
    }

    /**
     * @param authorId short (A123) or full OpenAlex author id
     */
    public static FilteredCrawlOptions byAuthor(String authorId, int maxWorks, Duration timeLimit) {
        String shortId = WorkRecordExtractor.shortId(authorId);
        if (shortId == null || shortId.isBlank()) {
            throw new IllegalArgumentException("author id must not be blank");
        }
        return new FilteredCrawlOptions("author:" + shortId, WorksQuery.byAuthor(shortId), maxWorks, timeLimit);
    }

    public static FilteredCrawlOptions publishedIn(int fromYear, int toYear, int maxWorks, Duration timeLimit) {
        YearRange range = new YearRange(fromYear, toYear);
        return new FilteredCrawlOptions("years:" + range, WorksQuery.publishedIn(range), maxWorks, timeLimit);
    }
}
