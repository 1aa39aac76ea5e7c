package com.scholarintel.crawler.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholarintel.crawler.config.CrawlerProperties;
import com.scholarintel.crawler.model.PageResult;
import com.scholarintel.crawler.model.Relation;
import com.scholarintel.crawler.model.WorkRecord;
import com.scholarintel.crawler.store.WorkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pages through one filtered /works listing (an author's works, or everything published
 * in a year window) and stores what it finds.
 *
 * Works are stored without a domain label, and works already ingested for a domain keep
 * theirs. Progress is not checkpointed: a rerun starts again from the first page and
 * upserts over what the last run stored.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FilteredWorksCrawler {

    private final OpenAlexClient client;
    private final WorkRecordExtractor extractor;
    private final WorkStore store;
    private final SizeGovernor governor;
    private final CrawlerProperties properties;
    private final Clock clock;

    public FilteredCrawlResult crawl(FilteredCrawlOptions options, CancellationToken token) {
        Crawl crawl = new Crawl(options, token);
        try {
            return crawl.execute();
        } catch (FatalCrawlException e) {
            log.error("Crawl {} aborted: {}", options.label(), e.getMessage(), e);
            return crawl.result(RunOutcome.FAILED, e.getMessage());
        }
    }

    private final class Crawl {

        private final FilteredCrawlOptions options;
        private final CancellationToken token;
        private final Instant deadline;
        private int works;
        private int pages;

        Crawl(FilteredCrawlOptions options, CancellationToken token) {
            this.options = options;
            this.token = token;
            this.deadline = options.timeLimit() != null ? clock.instant().plus(options.timeLimit()) : null;
        }

        FilteredCrawlResult execute() {
            log.info("Crawl {} started (filter {}, max {} works)",
                    options.label(), options.query().filter(), options.maxWorks());

            String cursor = "*";
            while (true) {
                Optional<FilteredCrawlResult> stop = checkLimits();
                if (stop.isPresent()) return stop.get();

                PageResult page = client.fetchPage(options.query(), cursor);
                if (!page.isOk()) {
                    log.warn("Crawl {} gave up at cursor {} ({})", options.label(), cursor, page.outcome());
                    return result(RunOutcome.INCOMPLETE, "page " + page.outcome().name().toLowerCase(Locale.ROOT));
                }
                pages++;

                List<WorkRecord> records = new ArrayList<>();
                for (JsonNode item : page.items()) {
                    if (works + records.size() >= options.maxWorks()) break;
                    extractor.extract(item, null).ifPresent(records::add);
                }
                if (!persist(records)) {
                    return result(RunOutcome.INCOMPLETE, "batch rolled back");
                }

                if (page.isLastPage()) {
                    return result(RunOutcome.COMPLETED, "listing exhausted");
                }
                cursor = page.nextCursor();
            }
        }

        /** One transaction per batch-size slice of the page */
        private boolean persist(List<WorkRecord> records) {
            int batchSize = Math.max(1, properties.getIngest().getBatchSize());
            for (int from = 0; from < records.size(); from += batchSize) {
                List<WorkRecord> batch = records.subList(from, Math.min(records.size(), from + batchSize));
                List<Relation> relations = new ArrayList<>();
                if (properties.getIngest().isRecordRelations()) {
                    batch.forEach(r -> relations.addAll(extractor.referenceRelations(r)));
                }
                try {
                    store.upsertUnlabelled(batch, relations);
                    works += batch.size();
                } catch (StorageWriteException e) {
                    log.warn("Crawl {}: batch of {} works rolled back: {}",
                            options.label(), batch.size(), e.getMessage());
                    return false;
                }
            }
            return true;
        }

        private Optional<FilteredCrawlResult> checkLimits() {
            if (token.isStopRequested()) {
                return Optional.of(result(RunOutcome.STOPPED_ON_SIGNAL, "stop requested"));
            }
            if (!governor.withinBudget()) {
                return Optional.of(result(RunOutcome.BUDGET_EXHAUSTED, "storage budget reached"));
            }
            if (works >= options.maxWorks()) {
                return Optional.of(result(RunOutcome.COMPLETED, "work limit reached"));
            }
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                return Optional.of(result(RunOutcome.COMPLETED, "time limit reached"));
            }
            return Optional.empty();
        }

        FilteredCrawlResult result(RunOutcome outcome, String reason) {
            log.info("Crawl {} finished ({}): {} works from {} pages", options.label(), reason, works, pages);
            return new FilteredCrawlResult(outcome, works, pages, reason);
        }
    }
}
