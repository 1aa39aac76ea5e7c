package com.scholarintel.crawler.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Normalised work ready for the works table.
 *
 * Schema notes:
 *  - id is the full OpenAlex URL and the primary key; re-ingesting it replaces the row
 *  - shortId is the last path segment (W123...) and is unique as well
 *  - list fields are never null, they are empty when the upstream omitted them
 *  - numeric impact fields are null unless the upstream sent a number
 */
@Data
@Builder
public class WorkRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    private String id;
    private String shortId;
    private String title;
    private String doi;
    /** Landing page, falling back to the best open-access location, then the id */
    private String url;

    // ── Authorship ──────────────────────────────────────────────────────────
    @Builder.Default
    private List<Author> authors = List.of();
    @Builder.Default
    private List<String> authorInstitutions = List.of();
    @Builder.Default
    private List<String> authorCountries = List.of();

    // ── Publication ─────────────────────────────────────────────────────────
    private Integer year;
    private String publicationDate;
    private String venue;
    @Builder.Default
    private List<String> venueIssns = List.of();
    private String hostOrganization;

    // ── Content ─────────────────────────────────────────────────────────────
    private String abstractText;
    /** Concept display names */
    @Builder.Default
    private List<String> concepts = List.of();
    @Builder.Default
    private List<String> topics = List.of();
    private String primaryTopic;
    @Builder.Default
    private List<String> keywords = List.of();
    @Builder.Default
    private List<String> funders = List.of();

    // ── Impact ──────────────────────────────────────────────────────────────
    private Integer citationCount;
    /** Field-weighted citation impact */
    private Double fwci;
    private Double citationPercentile;
    @Builder.Default
    private List<String> referenceIds = List.of();

    // ── Metadata ────────────────────────────────────────────────────────────
    private String domain;
    private Instant crawledAt;

    public List<String> authorIds() {
        return authors.stream().map(Author::id).toList();
    }

    public List<String> authorNames() {
        return authors.stream().map(Author::name).toList();
    }
}
