package com.scholarintel.crawler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Aggregate counters mirrored into the checkpoint file.
 * On restart totalRecords and footprintBytes are recomputed from the store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunStats {

    private long totalRecords;
    private long footprintBytes;
    private Instant startedAt;
    private Instant lastCheckpointAt;

    // ── Current run only ────────────────────────────────────────────────────
    private long pagesFetched;
    private long pagesAbandoned;
    private long batchesRolledBack;
    private long tasksYielded;
}
