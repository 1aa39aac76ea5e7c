package com.scholarintel.crawler.service;

public enum RunState {
    IDLE,
    SELECTING,
    FETCHING,
    EXTRACTING,
    PERSISTING,
    CHECKPOINTING,
    STOPPING,
    STOPPED
}
