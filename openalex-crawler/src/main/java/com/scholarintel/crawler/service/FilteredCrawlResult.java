package com.scholarintel.crawler.service;

/**
 * Summary of a filtered-listing crawl.
 *
 * @param outcome COMPLETED also covers stopping on the work or time limit
 * @param works   works stored during the crawl
 * @param pages   pages fetched successfully
 * @param reason  why the crawl stopped
 */
public record FilteredCrawlResult(RunOutcome outcome, int works, int pages, String reason) {
}
