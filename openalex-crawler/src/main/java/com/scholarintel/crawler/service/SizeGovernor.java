package com.scholarintel.crawler.service;

import com.scholarintel.crawler.config.CrawlerProperties;
import com.scholarintel.crawler.model.DomainTable;
import com.scholarintel.crawler.store.WorkStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps the store under its size ceiling and every domain under its paper quota.
 *
 * The usable budget is the ceiling minus the safety margin; a footprint at or above it
 * means no new page may be fetched and no new task admitted.
 */
@Service
@Slf4j
public class SizeGovernor {

    private static final long MB = 1024L * 1024L;

    private final WorkStore store;
    private final DomainTable domainTable;
    private final CrawlerProperties properties;

    /** Ceiling for the current run only; null falls back to storage.max-storage-mb */
    private volatile Long runCeilingBytes;

    public SizeGovernor(WorkStore store, DomainTable domainTable, CrawlerProperties properties) {
        this.store = store;
        this.domainTable = domainTable;
        this.properties = properties;
    }

    public boolean withinBudget() {
        long footprint = store.footprintBytes();
        long limit = budgetBytes();
        boolean within = footprint < limit;
        if (!within) {
            log.info("Storage budget reached: {} MB used, limit {} MB",
                    footprint / MB, limit / MB);
        }
        return within;
    }

    /**
     * @param maxStorageMb ceiling for the next run, or null to use the configured one
     */
    public void setRunCeiling(Long maxStorageMb) {
        if (maxStorageMb != null && maxStorageMb <= 0) {
            throw new IllegalArgumentException("maxStorageMb must be positive, got " + maxStorageMb);
        }
        this.runCeilingBytes = maxStorageMb == null ? null : maxStorageMb * MB;
    }

    public void clearRunCeiling() {
        this.runCeilingBytes = null;
    }

    public long ceilingBytes() {
        Long override = runCeilingBytes;
        return override != null ? override : properties.getStorage().getMaxStorageMb() * MB;
    }

    /** Ceiling minus safety margin, never negative */
    public long budgetBytes() {
        return Math.max(0L, ceilingBytes() - properties.getStorage().getSafetyMarginMb() * MB);
    }

    /**
     * True while the domain holds fewer rows than its max-papers quota.
     * Unknown domains have no quota.
     */
    public boolean withinDomainQuota(String domain) {
        return domainTable.find(domain)
                .map(spec -> store.recordCount(domain) < spec.maxPapers())
                .orElse(true);
    }
}
