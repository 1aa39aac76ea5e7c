package com.scholarintel.crawler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Unit of schedulable work: one keyword of one domain over one year range.
 *
 * Identity (domain, keyword, year range) never changes. The cursor advances,
 * recordsFetched only grows and completed flips to true at most once.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CrawlTask {

    public static final String START_CURSOR = "*";

    private String domain;
    private String keyword;
    private int fromYear;
    private int toYear;

    /** Cursor of the next page to request; "*" until the first page is committed */
    @Builder.Default
    private String cursor = START_CURSOR;

    /** Records of the page at {@link #cursor} that are already committed and counted */
    private int pageOffset;

    private long recordsFetched;
    private boolean completed;
    private Instant lastUpdate;

    public static String idOf(String domain, String keyword, YearRange range) {
        return domain + "|" + keyword + "|" + range;
    }

    @JsonIgnore
    public String getId() {
        return idOf(domain, keyword, getYearRange());
    }

    @JsonIgnore
    public YearRange getYearRange() {
        return new YearRange(fromYear, toYear);
    }

    public CrawlTask copy() {
        return toBuilder().build();
    }
}
