package com.scholarintel.crawler.service;

import com.scholarintel.crawler.fixture.WorkFixtures;
import com.scholarintel.crawler.model.CrawlStatus;
import com.scholarintel.crawler.model.CrawlTask;
import com.scholarintel.crawler.model.DomainTable;
import com.scholarintel.crawler.model.RunStats;
import com.scholarintel.crawler.output.CsvExporter;
import com.scholarintel.crawler.store.WorkStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlOperationsServiceTest {

    private static final DomainTable TABLE = WorkFixtures.singleDomain(200);

    @Mock
    private CrawlRunController runController;
    @Mock
    private CitationGraphCrawler graphCrawler;
    @Mock
    private FilteredWorksCrawler filteredCrawler;
    @Mock
    private CheckpointTracker checkpoint;
    @Mock
    private WorkStore store;
    @Mock
    private SizeGovernor governor;
    @Mock
    private CsvExporter csvExporter;

    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);

    private CrawlOperationsService operations;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
        operations = new CrawlOperationsService(runController, graphCrawler, filteredCrawler, checkpoint, store,
                governor, TABLE, csvExporter, clock);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        operations.shutdown();
    }

    /** The mocked run blocks until the test releases it */
    private void blockingRun() {
        when(runController.run(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return RunOutcome.COMPLETED;
        });
    }

    @Test
    void secondStartIsRejectedWhileRunIsActive() throws InterruptedException {
        blockingRun();
        operations.startIngestion(new RunOptions(1, null));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(operations.isRunning()).isTrue();
        assertThatThrownBy(() -> operations.startIngestion(new RunOptions(1, null)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> operations.startGraphCrawl(new GraphCrawlOptions("W1", 1, 10, null)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> operations.startFilteredCrawl(FilteredCrawlOptions.byAuthor("A1", 10, null)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(operations.runIngestionNow(new RunOptions(1, null))).isEmpty();
    }

    @Test
    void resetIsRefusedWhileRunIsActive() throws InterruptedException {
        blockingRun();
        operations.startIngestion(new RunOptions(1, null));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> operations.reset()).isInstanceOf(IllegalStateException.class);
        verify(store, never()).truncate();
    }

    @Test
    void stopIsForwardedToActiveRun() throws InterruptedException {
        when(runController.run(any(), any())).thenAnswer(invocation -> {
            CancellationToken token = invocation.getArgument(1);
            started.countDown();
            while (!token.isStopRequested()) {
                Thread.sleep(5);
            }
            return RunOutcome.STOPPED_ON_SIGNAL;
        });
        operations.startIngestion(new RunOptions(1, null));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(operations.requestStop()).isTrue();
        operations.shutdown();

        assertThat(operations.isRunning()).isFalse();
    }

    @Test
    void filteredCrawlRunsInBackgroundUnderItsLabel() throws InterruptedException {
        FilteredCrawlOptions options = FilteredCrawlOptions.publishedIn(2019, 2020, 50, null);
        when(filteredCrawler.crawl(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new FilteredCrawlResult(RunOutcome.COMPLETED, 50, 1, "work limit reached");
        });

        operations.startFilteredCrawl(options);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(operations.isRunning()).isTrue();

        release.countDown();
        operations.shutdown();

        assertThat(operations.isRunning()).isFalse();
        verify(filteredCrawler).crawl(eq(options), any());
        verify(runController, never()).run(any(), any());
    }

    @Test
    void stopWhileIdleReportsNothingToStop() {
        assertThat(operations.requestStop()).isFalse();
    }

    @Test
    void runIngestionNowReturnsOutcome() {
        RunOptions options = new RunOptions(2, 10L);
        when(runController.run(any(), any())).thenReturn(RunOutcome.BUDGET_EXHAUSTED);

        assertThat(operations.runIngestionNow(options)).contains(RunOutcome.BUDGET_EXHAUSTED);
        assertThat(operations.isRunning()).isFalse();
    }

    @Test
    void resetTruncatesStoreAndCheckpoint() {
        operations.reset();

        verify(store).truncate();
        verify(checkpoint).reset();
    }

    @Test
    void exportRejectsUnknownDomain() {
        assertThatThrownBy(() -> operations.export("Astrology"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Astrology");
        verify(csvExporter, never()).export(any());
    }

    @Test
    void exportDelegatesForKnownDomain() {
        CsvExporter.Export export = new CsvExporter.Export(Path.of("works_X.csv"), 3);
        when(csvExporter.export("X")).thenReturn(export);

        assertThat(operations.export("X")).isEqualTo(export);
    }

    @Test
    void statusReportsDomainProgress() {
        CrawlTask done = CrawlTask.builder().domain("X").keyword("k").fromYear(2020).toYear(2024)
                .cursor("c9").recordsFetched(50).completed(true).build();
        when(checkpoint.snapshot()).thenReturn(List.of(done));
        when(checkpoint.stats()).thenReturn(RunStats.builder().totalRecords(50).pagesFetched(1).build());
        when(runController.getState()).thenReturn(RunState.IDLE);
        when(store.recordCount()).thenReturn(50L);
        when(store.recordCount("X")).thenReturn(50L);
        when(store.footprintBytes()).thenReturn(4096L);
        when(governor.budgetBytes()).thenReturn(1_000_000L);

        CrawlStatus status = operations.status();

        assertThat(status.running()).isFalse();
        assertThat(status.totalRecords()).isEqualTo(50);
        assertThat(status.footprintBytes()).isEqualTo(4096);
        assertThat(status.stats().getPagesFetched()).isEqualTo(1);
        assertThat(status.domains()).singleElement().satisfies(domain -> {
            assertThat(domain.name()).isEqualTo("X");
            assertThat(domain.percent()).isEqualTo(25.0);
            assertThat(domain.tasksCompleted()).isEqualTo(1);
            assertThat(domain.tasksTotal()).isEqualTo(1);
        });
        assertThat(status.tasks()).singleElement()
                .satisfies(task -> assertThat(task.cursor()).isEqualTo("c9"));
    }
}
