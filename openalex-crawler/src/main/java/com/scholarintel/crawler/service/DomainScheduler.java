package com.scholarintel.crawler.service;

import com.scholarintel.crawler.model.CrawlTask;
import com.scholarintel.crawler.model.DomainSpec;
import com.scholarintel.crawler.model.DomainTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;

/**
 * Picks the next task to advance: highest domain weight first, then the task with the
 * fewest records fetched. Ties keep enumeration order. Read-only over task state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DomainScheduler {

    private final CheckpointTracker checkpoint;
    private final DomainTable domainTable;
    private final SizeGovernor governor;

    public Optional<CrawlTask> nextTask() {
        return nextTask(Set.of());
    }

    /**
     * @param excluded task ids that must not be returned (in flight, or paused for this run)
     * @return empty when the storage budget is spent or no eligible incomplete task remains
     */
    public Optional<CrawlTask> nextTask(Set<String> excluded) {
        if (!governor.withinBudget()) {
            return Optional.empty();
        }

        CrawlTask best = null;
        double bestWeight = 0;
        for (CrawlTask task : checkpoint.snapshot()) {
            if (task.isCompleted() || excluded.contains(task.getId())) continue;

            double weight = domainTable.find(task.getDomain()).map(DomainSpec::weight).orElse(0.0);
            if (best == null
                    || weight > bestWeight
                    || (weight == bestWeight && task.getRecordsFetched() < best.getRecordsFetched())) {
                best = task;
                bestWeight = weight;
            }
        }
        if (best != null) {
            log.debug("Selected {} (weight {}, {} fetched)", best.getId(), bestWeight, best.getRecordsFetched());
        }
        return Optional.ofNullable(best);
    }
}
