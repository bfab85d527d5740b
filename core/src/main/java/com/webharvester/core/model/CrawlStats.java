package com.webharvester.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 크롤 카운터 (스레드 세이프). 엔진만 갱신하고 외부에는 Snapshot 만 노출.
 * fetchAttempts 는 maxPages 예산 카운터를 겸한다: 시작된 fetch 수 기준.
 */
public final class CrawlStats {
    private final AtomicInteger fetchAttempts = new AtomicInteger(0); // 시작된 fetch(성공+실패)
    private final AtomicLong pagesFetched = new AtomicLong(0);        // 2xx 로 끝난 fetch
    private final AtomicLong pagesMatched = new AtomicLong(0);        // 저장+기록까지 끝난 매치
    private final AtomicLong pagesSkipped = new AtomicLong(0);        // 범위 밖 링크(발견 횟수)
    private final AtomicLong fetchErrors  = new AtomicLong(0);        // timeout/network/http 실패

    /**
     * 예산 안에서 fetch 한 건을 예약한다. maxPages <= 0 이면 무제한.
     * compare-and-set 루프라 동시 워커가 있어도 상한을 넘지 않는다.
     */
    public boolean tryReserveFetch(int maxPages) {
        if (maxPages <= 0) {
            fetchAttempts.incrementAndGet();
            return true;
        }
        for (;;) {
            int cur = fetchAttempts.get();
            if (cur >= maxPages) return false;
            if (fetchAttempts.compareAndSet(cur, cur + 1)) return true;
        }
    }

    /** 예산 소진 여부(무제한이면 항상 false) */
    public boolean budgetExhausted(int maxPages) {
        return maxPages > 0 && fetchAttempts.get() >= maxPages;
    }

    public void recordFetched() { pagesFetched.incrementAndGet(); }
    public void recordMatched() { pagesMatched.incrementAndGet(); }
    public void recordSkipped() { pagesSkipped.incrementAndGet(); }
    public void recordError()   { fetchErrors.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(fetchAttempts.get(), pagesFetched.get(), pagesMatched.get(),
                pagesSkipped.get(), fetchErrors.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final int  fetchAttempts;
        public final long pagesFetched;
        public final long pagesMatched;
        public final long pagesSkipped;
        public final long fetchErrors;

        public Snapshot(int attempts, long fetched, long matched, long skipped, long errors) {
            this.fetchAttempts = attempts;
            this.pagesFetched = fetched;
            this.pagesMatched = matched;
            this.pagesSkipped = skipped;
            this.fetchErrors = errors;
        }

        @Override
        public String toString() {
            return "fetched=" + pagesFetched
                    + ", matched=" + pagesMatched
                    + ", skipped=" + pagesSkipped
                    + ", errors=" + fetchErrors
                    + ", attempts=" + fetchAttempts;
        }
    }
}
