package com.scholarintel.crawler.model;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the crawler for the status endpoint.
 */
public record CrawlStatus(
        boolean running,
        String activeRun,
        String state,
        String lastOutcome,
        Instant lastFinishedAt,
        long totalRecords,
        long footprintBytes,
        long budgetBytes,
        RunStats stats,
        List<DomainProgress> domains,
        List<TaskProgress> tasks) {

    public record DomainProgress(
            String name,
            long committed,
            long maxPapers,
            double percent,
            long tasksCompleted,
            long tasksTotal) {
    }

    public record TaskProgress(
            String id,
            String cursor,
            long recordsFetched,
            boolean completed) {
    }
}
