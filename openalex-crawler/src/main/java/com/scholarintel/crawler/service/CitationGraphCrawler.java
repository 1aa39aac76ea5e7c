package com.scholarintel.crawler.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholarintel.crawler.model.PageResult;
import com.scholarintel.crawler.model.Relation;
import com.scholarintel.crawler.model.RelationType;
import com.scholarintel.crawler.model.WorkRecord;
import com.scholarintel.crawler.model.WorksQuery;
import com.scholarintel.crawler.store.WorkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Breadth-first crawl of the citation graph around one seed work.
 *
 * Each layer expands every frontier work in two directions: the works it references
 * (fetched one by one) and the first page of works citing it. Every newly seen work is
 * stored together with its edges and joins the next frontier. New works carry no
 * domain label; works already ingested for a domain keep theirs.
 *
 * Edges: (work, referenced, references) and (citing, work, cited_by).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CitationGraphCrawler {

    private final OpenAlexClient client;
    private final WorkRecordExtractor extractor;
    private final WorkStore store;
    private final SizeGovernor governor;
    private final Clock clock;

    public GraphCrawlResult crawl(GraphCrawlOptions options, CancellationToken token) {
        Crawl crawl = new Crawl(options, token);
        try {
            return crawl.execute();
        } catch (FatalCrawlException e) {
            log.error("Graph crawl aborted: {}", e.getMessage(), e);
            return crawl.result(RunOutcome.FAILED, e.getMessage());
        }
    }

    private final class Crawl {

        private final GraphCrawlOptions options;
        private final CancellationToken token;
        private final Instant deadline;
        private final Set<String> visited = new HashSet<>();
        private int nodes;
        private int relations;

        Crawl(GraphCrawlOptions options, CancellationToken token) {
            this.options = options;
            this.token = token;
            this.deadline = options.timeLimit() != null ? clock.instant().plus(options.timeLimit()) : null;
        }

        GraphCrawlResult execute() {
            String seedId = WorkRecordExtractor.shortId(options.seed());
            log.info("Graph crawl from {} (depth {}, max {} nodes)", seedId, options.depth(), options.maxNodes());

            Optional<WorkRecord> seed = client.fetchWork(seedId).flatMap(node -> extractor.extract(node, null));
            if (seed.isEmpty()) {
                log.warn("Seed work {} could not be fetched", seedId);
                return result(RunOutcome.INCOMPLETE, "seed unavailable");
            }
            visited.add(seedId);
            visited.add(seed.get().getShortId());
            store(List.of(seed.get()), extractor.referenceRelations(seed.get()));

            List<WorkRecord> frontier = List.of(seed.get());
            for (int layer = 1; layer <= options.depth() && !frontier.isEmpty(); layer++) {
                List<WorkRecord> next = new ArrayList<>();
                for (WorkRecord work : frontier) {
                    Optional<GraphCrawlResult> stop = expand(work, next);
                    if (stop.isPresent()) {
                        return stop.get();
                    }
                }
                log.info("Layer {} done: {} new works, {} stored in total", layer, next.size(), nodes);
                frontier = next;
            }
            return result(RunOutcome.COMPLETED, frontier.isEmpty() ? "graph exhausted" : "depth reached");
        }

        private Optional<GraphCrawlResult> expand(WorkRecord work, List<WorkRecord> next) {
            for (String ref : work.getReferenceIds()) {
                Optional<GraphCrawlResult> stop = checkLimits();
                if (stop.isPresent()) return stop;
                if (!visited.add(ref)) continue;

                client.fetchWork(ref)
                        .flatMap(node -> extractor.extract(node, null))
                        .ifPresent(referenced -> {
                            store(List.of(referenced), extractor.referenceRelations(referenced));
                            next.add(referenced);
                        });
            }

            Optional<GraphCrawlResult> stop = checkLimits();
            if (stop.isPresent()) return stop;

            PageResult citing = client.fetchPage(WorksQuery.citing(work.getShortId()), "*");
            if (!citing.isOk()) {
                log.warn("Citing works of {} unavailable ({})", work.getShortId(), citing.outcome());
                return Optional.empty();
            }
            for (JsonNode item : citing.items()) {
                stop = checkLimits();
                if (stop.isPresent()) return stop;

                Optional<WorkRecord> citer = extractor.extract(item, null);
                if (citer.isEmpty()) continue;
                Relation edge = new Relation(citer.get().getShortId(), work.getShortId(), RelationType.CITED_BY);
                if (visited.add(citer.get().getShortId())) {
                    List<Relation> edges = new ArrayList<>(extractor.referenceRelations(citer.get()));
                    edges.add(edge);
                    store(List.of(citer.get()), edges);
                    next.add(citer.get());
                } else {
                    storeRelations(List.of(edge));
                }
            }
            return Optional.empty();
        }

        private Optional<GraphCrawlResult> checkLimits() {
            if (token.isStopRequested()) {
                return Optional.of(result(RunOutcome.STOPPED_ON_SIGNAL, "stop requested"));
            }
            if (!governor.withinBudget()) {
                return Optional.of(result(RunOutcome.BUDGET_EXHAUSTED, "storage budget reached"));
            }
            if (nodes >= options.maxNodes()) {
                return Optional.of(result(RunOutcome.COMPLETED, "node limit reached"));
            }
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                return Optional.of(result(RunOutcome.COMPLETED, "time limit reached"));
            }
            return Optional.empty();
        }

        private void store(List<WorkRecord> works, List<Relation> edges) {
            try {
                store.upsertUnlabelled(works, edges);
                nodes += works.size();
                relations += edges.size();
            } catch (StorageWriteException e) {
                log.warn("Skipping {}: {}", works.get(0).getShortId(), e.getMessage());
            }
        }

        private void storeRelations(List<Relation> edges) {
            try {
                store.upsertRelations(edges);
                relations += edges.size();
            } catch (StorageWriteException e) {
                log.warn("Skipping {} relations: {}", edges.size(), e.getMessage());
            }
        }

        GraphCrawlResult result(RunOutcome outcome, String reason) {
            log.info("Graph crawl finished ({}): {} works, {} relations", reason, nodes, relations);
            return new GraphCrawlResult(outcome, nodes, relations, reason);
        }
    }
}
