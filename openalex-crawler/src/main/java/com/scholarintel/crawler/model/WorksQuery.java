package com.scholarintel.crawler.model;

/**
 * Search parameters of a /works listing; the cursor is passed separately per page.
 *
 * @param search free-text search term, null for a pure filter query
 * @param filter OpenAlex filter expression, null for none
 */
public record WorksQuery(String search, String filter) {

    public static WorksQuery forTask(CrawlTask task) {
        return new WorksQuery(task.getKeyword(), task.getYearRange().toFilter());
    }

    /** Every work listing the author (short id, A123...) among its authorships */
    public static WorksQuery byAuthor(String authorShortId) {
        return new WorksQuery(null, "author.id:" + authorShortId);
    }

    /** Every work published inside the window, with no search term */
    public static WorksQuery publishedIn(YearRange range) {
        return new WorksQuery(null, range.toFilter());
    }

    /** Works whose reference list contains the given short id */
    public static WorksQuery citing(String shortId) {
        return new WorksQuery(null, "cites:" + shortId);
    }
}
