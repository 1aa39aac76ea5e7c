package com.scholarintel.crawler.model;

/**
 * One entry of a work's authorship list, in authorship order.
 * Any component may be null when the upstream omitted it.
 */
public record Author(String id, String name, String orcid) {
}
