package com.scholarintel.crawler.model;

/**
 * Directed edge between two works by short id. Unique per (from, to, type);
 * inserted if absent, never updated.
 */
public record Relation(String fromId, String toId, RelationType type) {
}
