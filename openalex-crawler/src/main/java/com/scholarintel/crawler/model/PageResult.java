package com.scholarintel.crawler.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One fetched page. Only an {@link PageOutcome#OK} page carries items and a next cursor;
 * a null next cursor on an OK page means the sequence is exhausted.
 */
public record PageResult(PageOutcome outcome, String requestCursor, List<JsonNode> items, String nextCursor) {

    public PageResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static PageResult ok(String requestCursor, List<JsonNode> items, String nextCursor) {
        return new PageResult(PageOutcome.OK, requestCursor, items, nextCursor);
    }

    public static PageResult abandoned(String requestCursor) {
        return new PageResult(PageOutcome.ABANDONED, requestCursor, List.of(), null);
    }

    public static PageResult malformed(String requestCursor) {
        return new PageResult(PageOutcome.MALFORMED, requestCursor, List.of(), null);
    }

    public boolean isOk() {
        return outcome == PageOutcome.OK;
    }

    public boolean isLastPage() {
        return isOk() && (nextCursor == null || nextCursor.isBlank());
    }
}
