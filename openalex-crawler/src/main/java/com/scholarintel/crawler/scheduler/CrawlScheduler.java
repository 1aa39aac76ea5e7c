package com.scholarintel.crawler.scheduler;

import com.scholarintel.crawler.config.CrawlerProperties;
import com.scholarintel.crawler.service.CheckpointTracker;
import com.scholarintel.crawler.service.CrawlOperationsService;
import com.scholarintel.crawler.service.FatalCrawlException;
import com.scholarintel.crawler.service.RunOptions;
import com.scholarintel.crawler.store.WorkStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup crawling.
 *
 * The cron trigger is off by default ("-"). Set crawler.scheduling.cron, e.g.
 * "0 0 1 * * *" for a nightly run at 01:00 UTC. A trigger that fires while another run
 * is active is skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CrawlScheduler {

    private final CrawlOperationsService operations;
    private final WorkStore store;
    private final CheckpointTracker checkpoint;
    private final CrawlerProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the database schema exists and the checkpoint is loaded
     *  2. Optionally start an ingestion run if crawler.scheduling.run-on-startup=true
     */
    @PostConstruct
    public void onStartup() {
        store.ensureSchema();
        try {
            checkpoint.load();
        } catch (FatalCrawlException e) {
            log.error("Checkpoint unusable, runs will fail until it is reset: {}", e.getMessage());
            return;
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("run-on-startup=true, starting ingestion");
            try {
                operations.startIngestion(RunOptions.defaults(properties));
            } catch (Exception e) {
                log.error("Startup crawl failed to start: {}", e.getMessage(), e);
            }
        } else {
            log.info("Crawler ready. Scheduled runs: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${crawler.scheduling.cron:-}", zone = "UTC")
    public void scheduledCrawl() {
        log.info("Scheduled crawl triggered");
        try {
            operations.runIngestionNow(RunOptions.defaults(properties))
                    .ifPresent(outcome -> log.info("Scheduled crawl finished: {}", outcome));
        } catch (Exception e) {
            log.error("Scheduled crawl failed: {}", e.getMessage(), e);
        }
    }
}
