package com.scholarintel.crawler.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop flag shared between whoever requests a stop and the run loop that polls it.
 * Once set it stays set.
 */
public class CancellationToken {

    private final AtomicBoolean stopRequested = new AtomicBoolean();

    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }
}
