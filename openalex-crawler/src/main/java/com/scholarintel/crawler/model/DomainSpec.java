package com.scholarintel.crawler.model;

import java.util.List;

/**
 * One immutable row of the domain table: scheduling weight, storage quota and the
 * keyword x year-range grid that expands into crawl tasks.
 */
public record DomainSpec(
        String name,
        double weight,
        long maxPapers,
        long maxRecordsPerTask,
        List<String> keywords,
        List<YearRange> yearRanges) {

    public DomainSpec {
        keywords = List.copyOf(keywords);
        yearRanges = List.copyOf(yearRanges);
    }

    public boolean hasTaskCap() {
        return maxRecordsPerTask > 0;
    }
}
