package com.scholarintel.crawler.model;

/**
 * Inclusive publication-year window used as a search filter.
 */
public record YearRange(int from, int to) {

    public YearRange {
        if (from > to) {
            throw new IllegalArgumentException("Year range start " + from + " is after end " + to);
        }
    }

    /** OpenAlex filter expression covering the whole window */
    public String toFilter() {
        return "from_publication_date:" + from + "-01-01,to_publication_date:" + to + "-12-31";
    }

    @Override
    public String toString() {
        return from + "-" + to;
    }
}
