package com.scholarintel.crawler.service;

/**
 * Summary of a citation-graph crawl.
 *
 * @param outcome   COMPLETED also covers stopping on the node or time limit
 * @param nodes     works stored during the crawl
 * @param relations relation rows written (duplicates included)
 * @param reason    why the crawl stopped
 */
public record GraphCrawlResult(RunOutcome outcome, int nodes, int relations, String reason) {
}
