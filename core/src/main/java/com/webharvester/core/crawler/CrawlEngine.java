package com.webharvester.core.crawler;

import com.webharvester.core.api.ICrawlEngine;
import com.webharvester.core.api.IPageFetcher;
import com.webharvester.core.config.CrawlConfig;
import com.webharvester.core.http.FetchException;
import com.webharvester.core.http.HttpPageFetcher;
import com.webharvester.core.model.CrawlStats;
import com.webharvester.core.model.FetchResult;
import com.webharvester.core.persist.MatchRecord;
import com.webharvester.core.persist.PersistenceException;
import com.webharvester.core.persist.PersistenceWriter;
import com.webharvester.core.util.StructuredLog;
import com.webharvester.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 크롤 오케스트레이터:
 *  - Frontier pop → fetch → (매치면) 저장+기록 → (HTML 이면) 링크 추출 → 범위 안 링크 push
 *  - 상태: IDLE → RUNNING → {COMPLETED, ABORTED}, run() 은 엔진당 한 번
 *  - fetch 실패는 카운트 후 계속, 저장 실패는 즉시 ABORTED
 *  - maxPages &gt; 0 이면 시작된 fetch 수가 상한. 도달하면 남은 큐는 fetch 없이 버린다
 *
 * 동시성:
 *  - concurrency == 1: 단일 루프, 결정적 BFS
 *  - concurrency &gt; 1: fetch 만 고정 스레드풀에서, pop/예산/추출/push/저장은 코디네이터 스레드 하나
 */
public final class CrawlEngine implements ICrawlEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlEngine.class);

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final LinkExtractor extractor;
    private final AdmissionFilter filter;
    private final PersistenceWriter writer;
    private final Frontier frontier;
    private final CrawlStats stats = new CrawlStats();
    private final AtomicReference<CrawlState> state = new AtomicReference<>(CrawlState.IDLE);

    /** 기본 구현(HTTP fetcher + JSoup 추출기 + outputDir 쓰기) */
    public CrawlEngine(CrawlConfig config) {
        this(config,
             new HttpPageFetcher(config),
             new JsoupLinkExtractor(),
             new PersistenceWriter(config.getOutputDir()),
             new Frontier());
    }

    /** DI/테스트용. writer 는 run() 이 끝날 때 엔진이 닫는다 */
    public CrawlEngine(CrawlConfig config,
                       IPageFetcher fetcher,
                       LinkExtractor extractor,
                       PersistenceWriter writer,
                       Frontier frontier) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.frontier = Objects.requireNonNull(frontier, "frontier");
        this.filter = AdmissionFilter.of(config);
    }

    public CrawlState getState() { return state.get(); }
    public CrawlStats.Snapshot getStats() { return stats.snapshot(); }
    public Frontier getFrontier() { return frontier; }

    /** fetcher 정리. writer 는 run() 끝에서 이미 닫혔다 */
    @Override
    public void close() {
        try {
            fetcher.close();
        } catch (Exception e) {
            LOG.warn("Fetcher close failed: {}", e.toString());
        }
    }

    @Override
    public CrawlOutcome run() {
        if (!state.compareAndSet(CrawlState.IDLE, CrawlState.RUNNING)) {
            throw new IllegalStateException("engine already ran: " + state.get());
        }
        final Instant startedAt = Instant.now();
        LOG.info("Crawl start: prefix={}, regex={}, maxPages={}, timeout={}s, cc={}",
                config.getUrlPrefix(), config.getMatchPattern().pattern(),
                config.isBounded() ? config.getMaxPages() : "unbounded",
                config.getRequestTimeout().toSeconds(), config.getConcurrency());
        SLOG.info("crawl-start",
                "prefix", config.getUrlPrefix(),
                "regex", config.getMatchPattern().pattern(),
                "maxPages", config.getMaxPages(),
                "cc", config.getConcurrency());

        frontier.push(config.getSeedUrl());

        Throwable fatal = null;
        try {
            if (config.getConcurrency() <= 1) {
                runSequential();
            } else {
                runPooled(config.getConcurrency());
            }
        } catch (PersistenceException e) {
            fatal = e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fatal = e;
        } catch (RuntimeException e) {
            fatal = e;
        } finally {
            try {
                writer.close();
            } catch (PersistenceException e) {
                if (fatal == null) fatal = e;
                else fatal.addSuppressed(e);
            }
        }

        CrawlState end = (fatal == null) ? CrawlState.COMPLETED : CrawlState.ABORTED;
        state.set(end);
        CrawlOutcome outcome = new CrawlOutcome(end, stats.snapshot(), fatal, startedAt, Instant.now());
        logSummary(outcome);
        return outcome;
    }

    /* =========================
       실행 루프
       ========================= */

    private void runSequential() {
        final int max = config.getMaxPages();
        for (;;) {
            if (stats.budgetExhausted(max)) {
                drainAfterBudget();
                return;
            }
            Optional<FrontierEntry> next = frontier.pop();
            if (next.isEmpty()) return;
            if (!stats.tryReserveFetch(max)) {
                drainAfterBudget();
                return;
            }
            handle(fetchOne(next.get()));
        }
    }

    private void runPooled(int cc) throws InterruptedException {
        final int max = config.getMaxPages();
        ExecutorService exec = Executors.newFixedThreadPool(cc, new NamedThreadFactory("crawl-fetch"));
        CompletionService<Fetched> completion = new ExecutorCompletionService<>(exec);
        int inFlight = 0;
        try {
            for (;;) {
                // 빈 슬롯만큼 제출. 예약은 이 스레드만 하므로 pop 한 항목은 항상 예약된다
                while (inFlight < cc && !stats.budgetExhausted(max)) {
                    Optional<FrontierEntry> next = frontier.pop();
                    if (next.isEmpty()) break;
                    if (!stats.tryReserveFetch(max)) break;
                    final FrontierEntry entry = next.get();
                    completion.submit(() -> fetchOne(entry));
                    inFlight++;
                }
                if (inFlight == 0) break;

                Future<Fetched> done = completion.take();
                inFlight--;
                handle(unwrap(done));
            }
        } finally {
            exec.shutdownNow();
            if (!exec.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Fetch workers did not stop within 30s");
            }
        }
        if (stats.budgetExhausted(max)) drainAfterBudget();
    }

    private static Fetched unwrap(Future<Fetched> f) throws InterruptedException {
        try {
            return f.get();
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null) ? e.getCause() : e;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("fetch task failed", cause);
        }
    }

    private void drainAfterBudget() {
        int dropped = frontier.drain();
        LOG.info("Stopped because CRAWL_MAX_PAGES={} was reached ({} queued URLs dropped)",
                config.getMaxPages(), dropped);
        SLOG.info("budget-reached", "maxPages", config.getMaxPages(), "dropped", dropped);
    }

    /* =========================
       한 페이지 처리
       ========================= */

    /** fetch 결과 또는 실패. 워커 스레드에서도 불린다(공유 상태를 건드리지 않음) */
    private record Fetched(FrontierEntry entry, FetchResult result, FetchException error, Instant fetchedAt) {}

    private Fetched fetchOne(FrontierEntry entry) {
        LOG.debug("Fetching #{} {}", entry.sequence(), entry.url());
        try {
            FetchResult r = fetcher.fetch(entry.url(), config.getRequestTimeout());
            return new Fetched(entry, r, null, Instant.now());
        } catch (FetchException e) {
            return new Fetched(entry, null, e, Instant.now());
        }
    }

    private void handle(Fetched f) {
        final URI url = f.entry().url();
        if (f.error() != null) {
            stats.recordError();
            LOG.warn("Skipping {}: {}", url, f.error().getMessage());
            SLOG.warn("fetch-failed",
                    "url", url,
                    "kind", f.error().kind(),
                    "message", f.error().getMessage());
            return;
        }

        FetchResult res = f.result();
        stats.recordFetched();
        SLOG.debug("page-fetched",
                "url", url,
                "status", res.getStatusCode(),
                "bytes", res.getContentLength(),
                "kind", res.getContentKind(),
                "ms", res.getElapsedMs());

        // URL 만 매치한다(본문은 보지 않음)
        List<String> matches = filter.matches(url);
        if (!matches.isEmpty()) persistMatch(url, res, matches, f.fetchedAt());

        if (!res.isHtml()) return;
        if (stats.budgetExhausted(config.getMaxPages())) {
            LOG.debug("Budget reached; links on {} are not enqueued", url);
            return;
        }
        discover(url, res);
    }

    private void persistMatch(URI url, FetchResult res, List<String> matches, Instant fetchedAt) {
        if (res.getContentLength() == 0) {
            LOG.info("Matched {} but the body is empty; nothing persisted", url);
            return;
        }
        String host = UrlUtils.host(url);
        Path saved = writer.save(host, url, res.getBody(), res.getContentKind());
        writer.appendRecord(new MatchRecord(
                url.toString(), host, fetchedAt, res.getStatusCode(),
                res.getContentLength(), saved.toString(), matches));
        stats.recordMatched();

        LOG.info("Saved {} -> {} ({} matches)", url, saved, matches.size());
        SLOG.info("page-matched",
                "url", url,
                "savedPath", saved,
                "bytes", res.getContentLength(),
                "matches", matches.size());
    }

    private void discover(URI url, FetchResult res) {
        // 리다이렉트 됐으면 최종 URL 기준으로 상대 링크를 푼다
        Iterable<URI> links = extractor.extractLinks(res.bodyText(), res.getFinalUrl());
        int pushed = 0;
        for (URI raw : links) {
            URI link = UrlUtils.normalize(raw);
            if (link == null) continue;
            if (config.isLogDiscovered()) LOG.debug("Discovered {} on {}", link, url);

            if (!filter.inScope(link)) {
                // 이미 방문한 URL(예: 시드 /blog 를 가리키는 /blog/)은 건너뜀으로 세지 않는다
                if (!frontier.isVisited(link)) stats.recordSkipped();
                continue;
            }
            if (frontier.push(link)) pushed++;
        }
        LOG.debug("{} new in-scope links from {} (queue={})", pushed, url, frontier.size());
    }

    /* =========================
       요약 / 유틸
       ========================= */

    private void logSummary(CrawlOutcome o) {
        CrawlStats.Snapshot s = o.stats();
        if (o.isCompleted()) {
            LOG.info("Crawl completed in {} ms: {}", o.elapsed().toMillis(), s);
            SLOG.info("crawl-done",
                    "state", o.state(),
                    "fetched", s.pagesFetched,
                    "matched", s.pagesMatched,
                    "skipped", s.pagesSkipped,
                    "errors", s.fetchErrors,
                    "attempts", s.fetchAttempts);
        } else {
            LOG.error("Crawl aborted after {} ms: {}", o.elapsed().toMillis(), s);
            LOG.error("Fatal error: {}", String.valueOf(o.fatalError()), o.fatalError());
            SLOG.error("crawl-aborted", o.fatalError(),
                    "state", o.state(),
                    "fetched", s.pagesFetched,
                    "matched", s.pagesMatched,
                    "errors", s.fetchErrors);
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
