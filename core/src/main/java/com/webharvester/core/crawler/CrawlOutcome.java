package com.webharvester.core.crawler;

import com.webharvester.core.model.CrawlStats;

import java.time.Duration;
import java.time.Instant;

/**
 * 한 번의 run() 결과.
 * @param fatalError ABORTED 일 때만 non-null (일반 fetch 오류는 여기 들어오지 않는다)
 */
public record CrawlOutcome(CrawlState state,
                           CrawlStats.Snapshot stats,
                           Throwable fatalError,
                           Instant startedAt,
                           Instant finishedAt) {

    public boolean isCompleted() { return state == CrawlState.COMPLETED; }

    public Duration elapsed() { return Duration.between(startedAt, finishedAt); }
}
