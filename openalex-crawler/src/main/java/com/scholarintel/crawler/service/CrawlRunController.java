package com.scholarintel.crawler.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholarintel.crawler.config.CrawlerProperties;
import com.scholarintel.crawler.model.CrawlTask;
import com.scholarintel.crawler.model.DomainSpec;
import com.scholarintel.crawler.model.DomainTable;
import com.scholarintel.crawler.model.PageOutcome;
import com.scholarintel.crawler.model.PageResult;
import com.scholarintel.crawler.model.Relation;
import com.scholarintel.crawler.model.RunStats;
import com.scholarintel.crawler.model.WorkRecord;
import com.scholarintel.crawler.model.WorksQuery;
import com.scholarintel.crawler.store.WorkStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The ingestion loop.
 *
 * One coordinating thread selects tasks, hands page fetches to a fixed pool of
 * {@code concurrency} workers and takes completed pages back from a queue. Extraction,
 * store writes and checkpoint updates all happen on the coordinating thread, so the
 * task map has a single writer. A task has at most one page in flight, which keeps its
 * pages in cursor order.
 *
 * Per page the records are written in batches; each committed batch is followed by a
 * checkpoint update, never preceded by one. A task whose page was abandoned, malformed,
 * rolled back or failed unexpectedly is paused for the rest of the run and stays
 * incomplete. A task that used up its session allowance yields and may be picked again
 * straight away.
 */
@Service
@Slf4j
public class CrawlRunController {

    private static final long POLL_MS = 200;
    private static final long MB = 1024L * 1024L;

    private final OpenAlexClient client;
    private final WorkRecordExtractor extractor;
    private final WorkStore store;
    private final CheckpointTracker checkpoint;
    private final DomainScheduler scheduler;
    private final SizeGovernor governor;
    private final DomainTable domainTable;
    private final CrawlerProperties properties;
    private final Clock clock;

    private volatile RunState state = RunState.IDLE;

    public CrawlRunController(OpenAlexClient client,
                              WorkRecordExtractor extractor,
                              WorkStore store,
                              CheckpointTracker checkpoint,
                              DomainScheduler scheduler,
                              SizeGovernor governor,
                              DomainTable domainTable,
                              CrawlerProperties properties,
                              Clock clock) {
        this.client = client;
        this.extractor = extractor;
        this.store = store;
        this.checkpoint = checkpoint;
        this.scheduler = scheduler;
        this.governor = governor;
        this.domainTable = domainTable;
        this.properties = properties;
        this.clock = clock;
    }

    public RunState getState() {
        return state;
    }

    /**
     * Run until every task is completed or paused, the storage budget is reached, a stop
     * is requested on the token, or persisted state turns out to be corrupted.
     */
    public RunOutcome run(RunOptions options, CancellationToken token) {
        Run run = new Run(options, token);
        try {
            return run.execute();
        } finally {
            state = RunState.IDLE;
        }
    }

    // ── One run ──────────────────────────────────────────────────────────────

    private final class Run {

        private final RunOptions options;
        private final CancellationToken token;
        private final BlockingQueue<FetchCompletion> completions = new LinkedBlockingQueue<>();
        private final Map<String, Session> active = new LinkedHashMap<>();
        private final Set<String> paused = new HashSet<>();

        private ExecutorService pool;
        private RunStats stats;
        private boolean budgetReached;
        private long committedThisRun;
        private long lastReportMillis;

        Run(RunOptions options, CancellationToken token) {
            this.options = options;
            this.token = token;
        }

        RunOutcome execute() {
            state = RunState.SELECTING;
            RunOutcome outcome;
            try {
                checkpoint.load();
                stats = checkpoint.stats();
                resetRunCounters();
                client.setConcurrency(options.concurrency());
                governor.setRunCeiling(options.maxStorageMb());
                pool = Executors.newFixedThreadPool(options.concurrency(), fetchThreadFactory());
                lastReportMillis = clock.millis();

                log.info("Crawl run started: {} tasks, concurrency {}, budget {} MB, {} records stored",
                        checkpoint.snapshot().size(), options.concurrency(),
                        governor.budgetBytes() / MB, stats.getTotalRecords());
                loop();
                outcome = finish();
            } catch (FatalCrawlException e) {
                log.error("Crawl run aborted: {}", e.getMessage(), e);
                state = RunState.STOPPING;
                if (pool != null) {
                    pool.shutdownNow();
                }
                outcome = RunOutcome.FAILED;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Crawl coordinator interrupted, stopping");
                token.requestStop();
                outcome = finish();
            } finally {
                shutdownPool();
                governor.clearRunCeiling();
            }
            state = RunState.STOPPED;
            report(outcome);
            return outcome;
        }

        private void loop() throws InterruptedException {
            while (true) {
                admit();
                if (active.isEmpty()) {
                    return;
                }
                FetchCompletion completion = completions.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (completion != null) {
                    handle(completion);
                }
                maybeReportProgress();
            }
        }

        /** Fill free fetch slots with newly selected tasks */
        private void admit() {
            while (!stopping() && active.size() < options.concurrency()) {
                state = RunState.SELECTING;
                if (!governor.withinBudget()) {
                    budgetReached = true;
                    return;
                }
                Set<String> excluded = new HashSet<>(active.keySet());
                excluded.addAll(paused);
                Optional<CrawlTask> next = scheduler.nextTask(excluded);
                if (next.isEmpty()) {
                    return;
                }
                CrawlTask task = next.get();
                if (retireIfCapped(task)) {
                    continue;
                }
                Session session = new Session(task);
                active.put(task.getId(), session);
                log.info("Task {} started at cursor {} ({} fetched)",
                        task.getId(), task.getCursor(), task.getRecordsFetched());
                submit(session);
            }
        }

        private void submit(Session session) {
            state = RunState.FETCHING;
            WorksQuery query = session.query;
            String cursor = session.cursor;
            String taskId = session.taskId;
            pool.execute(() -> {
                try {
                    completions.add(new FetchCompletion(taskId, client.fetchPage(query, cursor), null));
                } catch (RuntimeException e) {
                    completions.add(new FetchCompletion(taskId, null, e));
                }
            });
        }

        private void handle(FetchCompletion completion) {
            Session session = active.get(completion.taskId());
            if (session == null) {
                log.warn("Dropping page for inactive task {}", completion.taskId());
                return;
            }
            try {
                if (completion.error() != null) {
                    throw completion.error();
                }
                processPage(session, completion.page());
            } catch (FatalCrawlException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Task {} failed: {}", session.taskId, e.getMessage(), e);
                pause(session, "unexpected failure");
            }
        }

        private void processPage(Session session, PageResult page) {
            state = RunState.EXTRACTING;
            if (!page.isOk()) {
                stats.setPagesAbandoned(stats.getPagesAbandoned() + 1);
                pause(session, page.outcome() == PageOutcome.MALFORMED
                        ? "malformed page" : "page abandoned");
                return;
            }
            stats.setPagesFetched(stats.getPagesFetched() + 1);

            List<JsonNode> items = page.items();
            int batchSize = Math.max(1, properties.getIngest().getBatchSize());
            int position = Math.min(session.skip, items.size());
            boolean lastPage = page.isLastPage();

            do {
                int end = Math.min(items.size(), position + batchSize);
                long room = remainingAllowance(session);
                end = (int) Math.min(end, position + Math.max(0, room));

                List<WorkRecord> records = new ArrayList<>(end - position);
                for (JsonNode item : items.subList(position, end)) {
                    extractor.extract(item, session.domain).ifPresent(records::add);
                }

                if (!persist(session, records)) {
                    pause(session, "batch rolled back");
                    return;
                }
                position = end;

                boolean pageDone = position >= items.size();
                session.recordsThisSession += records.size();
                session.recordsFetched += records.size();
                committedThisRun += records.size();
                // saved with the checkpoint below
                stats.setTotalRecords(stats.getTotalRecords() + records.size());
                stats.setFootprintBytes(store.footprintBytes());

                state = RunState.CHECKPOINTING;
                if (pageDone && lastPage) {
                    checkpoint.update(session.taskId, session.cursor, 0, records.size(), true);
                } else if (pageDone) {
                    checkpoint.update(session.taskId, page.nextCursor(), 0, records.size(), false);
                } else {
                    checkpoint.update(session.taskId, session.cursor, position, records.size(), false);
                }

                if (pageDone && lastPage) {
                    finishSession(session, "sequence exhausted");
                    return;
                }
                if (taskCapReached(session)) {
                    checkpoint.complete(session.taskId);
                    finishSession(session, "task cap reached");
                    return;
                }
                if (remainingAllowance(session) <= 0) {
                    yieldSession(session);
                    return;
                }
                if (pageDone) {
                    session.cursor = page.nextCursor();
                    session.skip = 0;
                }
            } while (position < items.size());

            continueOrRelease(session);
        }

        /** Next page for the same task, unless the run or the domain says otherwise */
        private void continueOrRelease(Session session) {
            if (stopping()) {
                release(session, "stop requested");
                return;
            }
            if (!governor.withinBudget()) {
                budgetReached = true;
                release(session, "storage budget reached");
                return;
            }
            if (!governor.withinDomainQuota(session.domain)) {
                int flipped = checkpoint.completeDomain(session.domain);
                log.info("Domain {} reached its quota, {} tasks marked completed", session.domain, flipped);
                release(session, "domain quota reached");
                return;
            }
            submit(session);
        }

        private boolean persist(Session session, List<WorkRecord> records) {
            if (records.isEmpty()) {
                return true;
            }
            state = RunState.PERSISTING;
            List<Relation> relations = List.of();
            if (properties.getIngest().isRecordRelations()) {
                relations = new ArrayList<>();
                for (WorkRecord record : records) {
                    relations.addAll(extractor.referenceRelations(record));
                }
            }
            try {
                store.upsertBatch(records, relations);
                return true;
            } catch (StorageWriteException e) {
                stats.setBatchesRolledBack(stats.getBatchesRolledBack() + 1);
                log.warn("Batch of {} records for {} rolled back: {}",
                        records.size(), session.taskId, e.getMessage());
                return false;
            }
        }

        /**
         * Completes tasks that already hit the task cap or whose domain is full, so the
         * scheduler does not keep returning them.
         */
        private boolean retireIfCapped(CrawlTask task) {
            if (!governor.withinDomainQuota(task.getDomain())) {
                int flipped = checkpoint.completeDomain(task.getDomain());
                log.info("Domain {} reached its quota, {} tasks marked completed", task.getDomain(), flipped);
                return true;
            }
            DomainSpec spec = domainTable.find(task.getDomain()).orElse(null);
            if (spec != null && spec.hasTaskCap() && task.getRecordsFetched() >= spec.maxRecordsPerTask()) {
                checkpoint.complete(task.getId());
                log.info("Task {} reached its cap of {} records", task.getId(), spec.maxRecordsPerTask());
                return true;
            }
            return false;
        }

        /** Records the session may still commit before yielding or hitting the task cap */
        private long remainingAllowance(Session session) {
            long room = Math.max(1, properties.getIngest().getMaxRecordsPerSession()) - session.recordsThisSession;
            DomainSpec spec = domainTable.find(session.domain).orElse(null);
            if (spec != null && spec.hasTaskCap()) {
                room = Math.min(room, spec.maxRecordsPerTask() - session.recordsFetched);
            }
            return room;
        }

        private boolean taskCapReached(Session session) {
            DomainSpec spec = domainTable.find(session.domain).orElse(null);
            return spec != null && spec.hasTaskCap() && session.recordsFetched >= spec.maxRecordsPerTask();
        }

        private void finishSession(Session session, String reason) {
            active.remove(session.taskId);
            log.info("Task {} completed ({}), {} records in total", session.taskId, reason, session.recordsFetched);
        }

        private void yieldSession(Session session) {
            active.remove(session.taskId);
            stats.setTasksYielded(stats.getTasksYielded() + 1);
            log.info("Task {} yields after {} records this session", session.taskId, session.recordsThisSession);
        }

        private void pause(Session session, String reason) {
            active.remove(session.taskId);
            paused.add(session.taskId);
            log.warn("Task {} paused for this run: {} (cursor {})", session.taskId, reason, session.cursor);
        }

        private void release(Session session, String reason) {
            active.remove(session.taskId);
            log.info("Task {} released: {}", session.taskId, reason);
        }

        private boolean stopping() {
            return token.isStopRequested() || budgetReached;
        }

        private RunOutcome finish() {
            state = RunState.STOPPING;
            stats.setTotalRecords(store.recordCount());
            stats.setFootprintBytes(store.footprintBytes());
            checkpoint.save();

            if (token.isStopRequested()) {
                return RunOutcome.STOPPED_ON_SIGNAL;
            }
            if (budgetReached) {
                return RunOutcome.BUDGET_EXHAUSTED;
            }
            boolean allDone = checkpoint.snapshot().stream().allMatch(CrawlTask::isCompleted);
            return allDone ? RunOutcome.COMPLETED : RunOutcome.INCOMPLETE;
        }

        private void shutdownPool() {
            if (pool == null) return;
            pool.shutdown();
            try {
                if (!pool.awaitTermination(properties.getApi().getRequestTimeoutMs() * 2L, TimeUnit.MILLISECONDS)) {
                    log.warn("Fetch workers did not finish in time, interrupting");
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        private void resetRunCounters() {
            stats.setStartedAt(clock.instant());
            stats.setTotalRecords(store.recordCount());
            stats.setFootprintBytes(store.footprintBytes());
            stats.setPagesFetched(0);
            stats.setPagesAbandoned(0);
            stats.setBatchesRolledBack(0);
            stats.setTasksYielded(0);
        }

        private void maybeReportProgress() {
            long now = clock.millis();
            if (now - lastReportMillis >= properties.getIngest().getProgressIntervalMs()) {
                lastReportMillis = now;
                logProgress("Progress");
            }
        }

        private void report(RunOutcome outcome) {
            if (outcome == RunOutcome.FAILED) {
                log.error("{}. Store and checkpoint were left as of the last committed batch.", outcome.message());
                return;
            }
            logProgress(outcome.message());
        }

        private void logProgress(String headline) {
            Duration elapsed = Duration.between(stats.getStartedAt(), clock.instant());
            double minutes = Math.max(elapsed.toMillis() / 60_000.0, 1.0 / 60);
            List<CrawlTask> tasks = checkpoint.snapshot();
            long done = tasks.stream().filter(CrawlTask::isCompleted).count();

            log.info("{}: {} records, {} MB, elapsed {}, {} records/min this run, tasks {}/{} completed, {} paused",
                    headline, stats.getTotalRecords(), stats.getFootprintBytes() / MB,
                    formatDuration(elapsed), Math.round(committedThisRun / minutes),
                    done, tasks.size(), paused.size());

            for (DomainSpec spec : domainTable.all()) {
                long count = store.recordCount(spec.name());
                log.info("  {}: {}/{} ({}%)", spec.name(), count, spec.maxPapers(),
                        String.format("%.1f", 100.0 * count / spec.maxPapers()));
            }
        }

    }

    // ── Types ────────────────────────────────────────────────────────────────

    /** Mutable per-admission state of one task, touched only by the coordinating thread */
    private static final class Session {
        final String taskId;
        final String domain;
        final WorksQuery query;
        String cursor;
        int skip;
        long recordsFetched;
        long recordsThisSession;

        Session(CrawlTask task) {
            this.taskId = task.getId();
            this.domain = task.getDomain();
            this.query = WorksQuery.forTask(task);
            this.cursor = task.getCursor();
            this.skip = task.getPageOffset();
            this.recordsFetched = task.getRecordsFetched();
        }
    }

    private record FetchCompletion(String taskId, PageResult page, RuntimeException error) {
    }

    private static ThreadFactory fetchThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "openalex-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    static String formatDuration(Duration d) {
        long seconds = d.getSeconds();
        return String.format("%dh%02dm%02ds", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
