package com.webharvester.core.http;

import com.webharvester.core.api.IPageFetcher;
import com.webharvester.core.config.CrawlConfig;
import com.webharvester.core.model.FetchResult;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/** java.net.http 기반 fetcher: 요청 전송 후 FetchResult 로 매핑, 실패는 타입별 예외 */
public class HttpPageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final String userAgent;
    private final HttpSender sender;

    public HttpPageFetcher(CrawlConfig config) {
        Objects.requireNonNull(config, "config");
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getRequestTimeout())
                .build();
        this.userAgent = config.getUserAgent();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray());
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(String userAgent, HttpSender testSender) {
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? CrawlConfig.DEFAULT_USER_AGENT : userAgent;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchResult fetch(URI url, Duration timeout) throws FetchException {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(timeout, "timeout");
        long start = System.nanoTime();

        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(url)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml,*/*;q=0.8")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            // 스킴/호스트가 HttpClient 기준으로 유효하지 않음
            throw new NetworkFetchException(url, "invalid request URI: " + e.getMessage(), e);
        }

        HttpResponse<byte[]> resp;
        try {
            resp = sender.send(req);
        } catch (HttpTimeoutException e) {
            // HttpConnectTimeoutException 포함
            throw new FetchTimeoutException(url, timeout, e);
        } catch (IOException e) {
            throw new NetworkFetchException(url, String.valueOf(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkFetchException(url, "interrupted", e);
        }

        int status = resp.statusCode();
        if (status < 200 || status > 299) {
            throw new HttpStatusException(url, status);
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        return FetchResult.builder()
                .url(url)
                .finalUrl(resp.uri() != null ? resp.uri() : url)
                .statusCode(status)
                .headers(resp.headers().map())
                .body(resp.body())
                .contentType(resp.headers().firstValue("Content-Type").orElse(null))
                .elapsedMs(elapsedMs)
                .build();
    }
}
