package com.webharvester.core.api;

import com.webharvester.core.crawler.CrawlOutcome;

/** 크롤 엔진 최소 계약: 한 번 실행하고 종료 상태를 돌려준다. */
public interface ICrawlEngine extends AutoCloseable {
    CrawlOutcome run();
    /** 실행 후 자원 정리(fetcher 등). 여러 번 불려도 안전해야 한다 */
    @Override default void close() {}
}
