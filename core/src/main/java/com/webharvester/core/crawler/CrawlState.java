package com.webharvester.core.crawler;

/** 엔진 상태: IDLE → RUNNING → {COMPLETED, ABORTED}. 종료 상태는 되돌릴 수 없다. */
public enum CrawlState {
    IDLE,
    RUNNING,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
