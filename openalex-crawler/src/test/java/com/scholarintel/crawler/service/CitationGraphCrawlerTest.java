package com.scholarintel.crawler.service;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholarintel.crawler.config.CrawlerProperties;
import com.scholarintel.crawler.fixture.WorkFixtures;
import com.scholarintel.crawler.model.PageResult;
import com.scholarintel.crawler.model.Relation;
import com.scholarintel.crawler.model.RelationType;
import com.scholarintel.crawler.model.WorksQuery;
import com.scholarintel.crawler.store.WorkStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CitationGraphCrawlerTest {

    @TempDir
    Path tempDir;

    @Mock
    private OpenAlexClient client;

    private WorkStore store;
    private CitationGraphCrawler crawler;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = WorkFixtures.properties(tempDir);
        store = WorkFixtures.store(properties);
        Clock clock = Clock.systemUTC();
        SizeGovernor governor = new SizeGovernor(store, WorkFixtures.singleDomain(1_000), properties);
        crawler = new CitationGraphCrawler(client, new WorkRecordExtractor(clock), store, governor, clock);
    }

    private static ObjectNode work(String shortId, String... references) {
        ObjectNode node = WorkFixtures.work(shortId, "Work " + shortId, 1);
        ArrayNode refs = node.putArray("referenced_works");
        for (String ref : references) {
            refs.add(WorkFixtures.OPENALEX + ref);
        }
        return node;
    }

    private GraphCrawlOptions options(int depth, int maxNodes) {
        return new GraphCrawlOptions(WorkFixtures.OPENALEX + "W1", depth, maxNodes, null);
    }

    @Test
    void storesOneLayerInBothDirections() {
        when(client.fetchWork("W1")).thenReturn(Optional.of(work("W1", "W2", "W3")));
        when(client.fetchWork("W2")).thenReturn(Optional.of(work("W2")));
        when(client.fetchWork("W3")).thenReturn(Optional.empty());
        when(client.fetchPage(eq(WorksQuery.citing("W1")), eq("*")))
                .thenReturn(PageResult.ok("*", List.of(work("W4", "W1")), null));

        GraphCrawlResult result = crawler.crawl(options(1, 100), new CancellationToken());

        assertThat(result.outcome()).isEqualTo(RunOutcome.COMPLETED);
        assertThat(result.reason()).isEqualTo("depth reached");
        assertThat(result.nodes()).isEqualTo(3);
        assertThat(store.recordCount()).isEqualTo(3);
        assertThat(store.findById(WorkFixtures.OPENALEX + "W1"))
                .hasValueSatisfying(w -> assertThat(w.getDomain()).isNull());
        assertThat(store.relationsFrom("W1")).containsExactly(
                new Relation("W1", "W2", RelationType.REFERENCES),
                new Relation("W1", "W3", RelationType.REFERENCES));
        assertThat(store.relationsFrom("W4")).containsExactly(
                new Relation("W4", "W1", RelationType.CITED_BY),
                new Relation("W4", "W1", RelationType.REFERENCES));
        verify(client, never()).fetchPage(eq(WorksQuery.citing("W2")), anyString());
    }

    @Test
    void reachingAnIngestedWorkKeepsItsDomain() {
        store.upsertBatch(List.of(WorkFixtures.record("W1", "Work W1", "X")));
        when(client.fetchWork("W1")).thenReturn(Optional.of(work("W1", "W2")));
        when(client.fetchWork("W2")).thenReturn(Optional.of(work("W2")));
        when(client.fetchPage(eq(WorksQuery.citing("W1")), eq("*")))
                .thenReturn(PageResult.ok("*", List.of(), null));

        GraphCrawlResult result = crawler.crawl(options(1, 100), new CancellationToken());

        assertThat(result.outcome()).isEqualTo(RunOutcome.COMPLETED);
        assertThat(store.recordCount()).isEqualTo(2);
        assertThat(store.recordCount("X")).isEqualTo(1);
        assertThat(store.findById(WorkFixtures.OPENALEX + "W1"))
                .hasValueSatisfying(w -> assertThat(w.getDomain()).isEqualTo("X"));
        assertThat(store.findById(WorkFixtures.OPENALEX + "W2"))
                .hasValueSatisfying(w -> assertThat(w.getDomain()).isNull());
    }

    @Test
    void nodeLimitStopsExpansion() {
        when(client.fetchWork("W1")).thenReturn(Optional.of(work("W1", "W2", "W3")));
        when(client.fetchWork("W2")).thenReturn(Optional.of(work("W2")));

        GraphCrawlResult result = crawler.crawl(options(3, 2), new CancellationToken());

        assertThat(result.outcome()).isEqualTo(RunOutcome.COMPLETED);
        assertThat(result.reason()).isEqualTo("node limit reached");
        assertThat(result.nodes()).isEqualTo(2);
        verify(client, never()).fetchWork("W3");
        verify(client, never()).fetchPage(any(), any());
    }

    @Test
    void alreadyVisitedCiterOnlyGainsEdge() {
        when(client.fetchWork("W1")).thenReturn(Optional.of(work("W1", "W2")));
        when(client.fetchWork("W2")).thenReturn(Optional.of(work("W2")));
        when(client.fetchPage(eq(WorksQuery.citing("W1")), eq("*")))
                .thenReturn(PageResult.ok("*", List.of(work("W2")), null));

        GraphCrawlResult result = crawler.crawl(options(1, 100), new CancellationToken());

        assertThat(result.nodes()).isEqualTo(2);
        assertThat(store.relationsFrom("W2"))
                .containsExactly(new Relation("W2", "W1", RelationType.CITED_BY));
    }

    @Test
    void unavailableSeedLeavesRunIncomplete() {
        when(client.fetchWork("W1")).thenReturn(Optional.empty());

        GraphCrawlResult result = crawler.crawl(options(2, 100), new CancellationToken());

        assertThat(result.outcome()).isEqualTo(RunOutcome.INCOMPLETE);
        assertThat(result.nodes()).isZero();
        assertThat(store.recordCount()).isZero();
    }

    @Test
    void stopRequestHaltsAfterSeed() {
        when(client.fetchWork("W1")).thenReturn(Optional.of(work("W1", "W2")));
        CancellationToken token = new CancellationToken();
        token.requestStop();

        GraphCrawlResult result = crawler.crawl(options(2, 100), token);

        assertThat(result.outcome()).isEqualTo(RunOutcome.STOPPED_ON_SIGNAL);
        assertThat(result.nodes()).isEqualTo(1);
        verify(client, never()).fetchWork("W2");
    }

    @Test
    void rejectsInvalidOptions() {
        assertThatThrownBy(() -> new GraphCrawlOptions("W1", 0, 10, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GraphCrawlOptions(" ", 1, 10, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
