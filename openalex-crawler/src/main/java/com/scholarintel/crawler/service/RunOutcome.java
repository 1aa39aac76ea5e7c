package com.scholarintel.crawler.service;

/**
 * How a run ended.
 */
public enum RunOutcome {
    /** Every task is completed */
    COMPLETED("All work completed"),
    /** The storage footprint reached its budget */
    BUDGET_EXHAUSTED("Stopped early due to size ceiling"),
    /** A stop was requested */
    STOPPED_ON_SIGNAL("Stopped on signal"),
    /** Nothing left to run this time, but paused tasks remain for a later run */
    INCOMPLETE("Run finished, paused tasks remain for the next run"),
    /** Store or checkpoint corruption; no further writes were made */
    FAILED("Aborted on fatal error");

    private final String message;

    RunOutcome(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
