package com.scholarintel.crawler.service;

import com.scholarintel.crawler.model.CrawlStatus;
import com.scholarintel.crawler.model.CrawlTask;
import com.scholarintel.crawler.model.DomainSpec;
import com.scholarintel.crawler.model.DomainTable;
import com.scholarintel.crawler.model.RunStats;
import com.scholarintel.crawler.output.CsvExporter;
import com.scholarintel.crawler.store.WorkStore;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Operational surface over the crawler: start, stop, status, reset and export.
 *
 * At most one run (ingestion, graph crawl or filtered crawl) is active at a time. Background runs go on
 * a dedicated thread; scheduled runs execute on the caller's thread.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CrawlOperationsService {

    private static final long SHUTDOWN_WAIT_MS = 120_000;

    private final CrawlRunController runController;
    private final CitationGraphCrawler graphCrawler;
    private final FilteredWorksCrawler filteredCrawler;
    private final CheckpointTracker checkpoint;
    private final WorkStore store;
    private final SizeGovernor governor;
    private final DomainTable domainTable;
    private final CsvExporter csvExporter;
    private final Clock clock;

    private final Object lock = new Object();
    private ActiveRun active;
    private volatile String lastOutcome;
    private volatile Instant lastFinishedAt;

    // ── Runs ─────────────────────────────────────────────────────────────────

    /**
     * Start an ingestion run in the background.
     *
     * @throws IllegalStateException another run is active
     */
    public void startIngestion(RunOptions options) {
        launch("ingestion", token -> runController.run(options, token).name());
    }

    /**
     * Start a citation-graph crawl in the background.
     *
     * @throws IllegalStateException another run is active
     */
    public void startGraphCrawl(GraphCrawlOptions options) {
        launch("graph:" + options.seed(), token -> {
            GraphCrawlResult result = graphCrawler.crawl(options, token);
            return result.outcome().name() + " (" + result.reason() + ", " + result.nodes() + " works)";
        });
    }

    /**
     * Start an author or year-range crawl in the background.
     *
     * @throws IllegalStateException another run is active
     */
    public void startFilteredCrawl(FilteredCrawlOptions options) {
        launch(options.label(), token -> {
            FilteredCrawlResult result = filteredCrawler.crawl(options, token);
            return result.outcome().name() + " (" + result.reason() + ", " + result.works() + " works)";
        });
    }

    /**
     * Run an ingestion on the calling thread, or skip it when another run is active.
     */
    public Optional<RunOutcome> runIngestionNow(RunOptions options) {
        CancellationToken token = new CancellationToken();
        synchronized (lock) {
            if (active != null) {
                log.info("Skipping ingestion: {} run already active", active.name());
                return Optional.empty();
            }
            active = new ActiveRun("ingestion", token, Thread.currentThread());
        }
        try {
            RunOutcome outcome = runController.run(options, token);
            lastOutcome = outcome.name();
            return Optional.of(outcome);
        } finally {
            release();
        }
    }

    /**
     * Ask the active run to stop after its in-flight pages are flushed.
     *
     * @return false when nothing is running
     */
    public boolean requestStop() {
        synchronized (lock) {
            if (active == null) {
                return false;
            }
            log.info("Stop requested for {} run", active.name());
            active.token().requestStop();
            return true;
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return active != null;
        }
    }

    // ── Status / maintenance ─────────────────────────────────────────────────

    public CrawlStatus status() {
        List<CrawlTask> tasks = checkpoint.snapshot();

        List<CrawlStatus.DomainProgress> domains = domainTable.all().stream()
                .map(spec -> domainProgress(spec, tasks))
                .toList();
        List<CrawlStatus.TaskProgress> taskProgress = tasks.stream()
                .map(t -> new CrawlStatus.TaskProgress(t.getId(), t.getCursor(), t.getRecordsFetched(), t.isCompleted()))
                .toList();

        String activeName;
        synchronized (lock) {
            activeName = active != null ? active.name() : null;
        }
        return new CrawlStatus(
                activeName != null,
                activeName,
                runController.getState().name(),
                lastOutcome,
                lastFinishedAt,
                store.recordCount(),
                store.footprintBytes(),
                governor.budgetBytes(),
                copyOf(checkpoint.stats()),
                domains,
                taskProgress);
    }

    /**
     * Delete all works, relations and progress.
     *
     * @throws IllegalStateException a run is active
     */
    public void reset() {
        synchronized (lock) {
            if (active != null) {
                throw new IllegalStateException("Cannot reset while " + active.name() + " run is active");
            }
            log.warn("Resetting store and checkpoint");
            store.truncate();
            checkpoint.reset();
        }
    }

    /**
     * @throws IllegalArgumentException the domain is not configured
     */
    public CsvExporter.Export export(String domain) {
        if (domainTable.find(domain).isEmpty()) {
            throw new IllegalArgumentException("Unknown domain: " + domain);
        }
        return csvExporter.export(domain);
    }

    /**
     * Application shutdown: stop the active run and wait for it to flush.
     */
    @PreDestroy
    public void shutdown() {
        Thread runner;
        synchronized (lock) {
            if (active == null) return;
            active.token().requestStop();
            runner = active.thread();
        }
        if (runner == Thread.currentThread()) return;
        log.info("Waiting up to {}s for the active run to stop", SHUTDOWN_WAIT_MS / 1000);
        try {
            runner.join(SHUTDOWN_WAIT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (runner.isAlive()) {
            log.warn("Active run did not stop within {}s", SHUTDOWN_WAIT_MS / 1000);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void launch(String name, Function<CancellationToken, String> body) {
        CancellationToken token = new CancellationToken();
        synchronized (lock) {
            if (active != null) {
                throw new IllegalStateException("A " + active.name() + " run is already active");
            }
            Thread thread = new Thread(() -> {
                try {
                    lastOutcome = body.apply(token);
                } catch (Exception e) {
                    log.error("{} run failed: {}", name, e.getMessage(), e);
                    lastOutcome = RunOutcome.FAILED.name();
                } finally {
                    release();
                }
            }, "crawl-" + name.replace(':', '-'));
            active = new ActiveRun(name, token, thread);
            thread.start();
        }
        log.info("Started {} run", name);
    }

    private void release() {
        synchronized (lock) {
            active = null;
            lastFinishedAt = clock.instant();
        }
    }

    private CrawlStatus.DomainProgress domainProgress(DomainSpec spec, List<CrawlTask> tasks) {
        long committed = store.recordCount(spec.name());
        long total = tasks.stream().filter(t -> t.getDomain().equals(spec.name())).count();
        long completed = tasks.stream()
                .filter(t -> t.getDomain().equals(spec.name()) && t.isCompleted())
                .count();
        double percent = Math.round(1000.0 * committed / spec.maxPapers()) / 10.0;
        return new CrawlStatus.DomainProgress(spec.name(), committed, spec.maxPapers(), percent, completed, total);
    }

    private RunStats copyOf(RunStats stats) {
        synchronized (checkpoint) {
            return RunStats.builder()
                    .totalRecords(stats.getTotalRecords())
                    .footprintBytes(stats.getFootprintBytes())
                    .startedAt(stats.getStartedAt())
                    .lastCheckpointAt(stats.getLastCheckpointAt())
                    .pagesFetched(stats.getPagesFetched())
                    .pagesAbandoned(stats.getPagesAbandoned())
                    .batchesRolledBack(stats.getBatchesRolledBack())
                    .tasksYielded(stats.getTasksYielded())
                    .build();
        }
    }

    private record ActiveRun(String name, CancellationToken token, Thread thread) {
    }
}
