package com.webharvester.core.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.webharvester.core.config.CrawlConfig;
import com.webharvester.core.model.ContentKind;
import com.webharvester.core.model.FetchResult;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HttpPageFetcherTest {

    static HttpServer s;
    static ExecutorService exec;
    static String base;

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        exec = Executors.newCachedThreadPool();
        s.setExecutor(exec); // /slow 가 다른 요청을 막지 않도록
        base = "http://127.0.0.1:" + s.getAddress().getPort();

        s.createContext("/ok", ex -> respond(ex, 200, "text/html; charset=utf-8", "<html><a href='/next'>n</a></html>"));
        s.createContext("/ua", ex -> respond(ex, 200, "text/plain",
                String.valueOf(ex.getRequestHeaders().getFirst("User-Agent"))));
        s.createContext("/data.json", ex -> respond(ex, 200, "application/json", "{\"a\":1}"));
        s.createContext("/missing", ex -> respond(ex, 404, "text/plain", "nope"));
        s.createContext("/boom", ex -> respond(ex, 503, "text/plain", "down"));
        s.createContext("/moved", ex -> {
            ex.getResponseHeaders().add("Location", "/ok");
            ex.sendResponseHeaders(302, -1);
            ex.close();
        });
        s.createContext("/slow", ex -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(ex, 200, "text/plain", "late");
        });
        s.start();
    }

    @AfterAll
    static void down() {
        if (s != null) s.stop(0);
        if (exec != null) exec.shutdownNow();
    }

    static void respond(HttpExchange ex, int code, String ctype, String body) throws IOException {
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", ctype);
        ex.sendResponseHeaders(code, b.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(b);
        }
    }

    private static HttpPageFetcher fetcher(boolean followRedirects) {
        return new HttpPageFetcher(CrawlConfig.builder()
                .urlPrefix(base + "/")
                .matchRegex("x")
                .userAgent("HarvestTest/0.1")
                .requestTimeout(Duration.ofSeconds(5))
                .followRedirects(followRedirects)
                .build());
    }

    @Test
    void ok_html_page() throws Exception {
        FetchResult r = fetcher(true).fetch(URI.create(base + "/ok"), Duration.ofSeconds(5));

        assertEquals(200, r.getStatusCode());
        assertTrue(r.isHtml());
        assertThat(r.bodyText()).contains("href='/next'");
        assertEquals(r.getBody().length, r.getContentLength());
        assertThat(r.getElapsedMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void sends_configured_user_agent() throws Exception {
        FetchResult r = fetcher(true).fetch(URI.create(base + "/ua"), Duration.ofSeconds(5));
        assertEquals("HarvestTest/0.1", r.bodyText());
    }

    @Test
    void non_html_is_flagged() throws Exception {
        FetchResult r = fetcher(true).fetch(URI.create(base + "/data.json"), Duration.ofSeconds(5));
        assertEquals(ContentKind.OTHER, r.getContentKind());
    }

    @Test
    void non_2xx_is_http_status_error() {
        HttpStatusException e404 = assertThrows(HttpStatusException.class,
                () -> fetcher(true).fetch(URI.create(base + "/missing"), Duration.ofSeconds(5)));
        assertEquals(404, e404.getStatus());
        assertEquals("HTTP_STATUS", e404.kind());

        HttpStatusException e503 = assertThrows(HttpStatusException.class,
                () -> fetcher(true).fetch(URI.create(base + "/boom"), Duration.ofSeconds(5)));
        assertEquals(503, e503.getStatus());
    }

    @Test
    void redirect_followed_and_final_url_reported() throws Exception {
        FetchResult r = fetcher(true).fetch(URI.create(base + "/moved"), Duration.ofSeconds(5));
        assertEquals(URI.create(base + "/moved"), r.getUrl());
        assertEquals(URI.create(base + "/ok"), r.getFinalUrl());
    }

    @Test
    void redirect_not_followed_is_status_error() {
        HttpStatusException e = assertThrows(HttpStatusException.class,
                () -> fetcher(false).fetch(URI.create(base + "/moved"), Duration.ofSeconds(5)));
        assertEquals(302, e.getStatus());
    }

    @Test
    void slow_response_times_out() {
        FetchTimeoutException e = assertThrows(FetchTimeoutException.class,
                () -> fetcher(true).fetch(URI.create(base + "/slow"), Duration.ofMillis(300)));
        assertEquals("TIMEOUT", e.kind());
        assertEquals(URI.create(base + "/slow"), e.getUrl());
    }

    @Test
    void refused_connection_is_network_error() throws Exception {
        int closedPort;
        try (ServerSocket ss = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = ss.getLocalPort();
        }
        NetworkFetchException e = assertThrows(NetworkFetchException.class,
                () -> fetcher(true).fetch(URI.create("http://127.0.0.1:" + closedPort + "/"), Duration.ofSeconds(5)));
        assertEquals("NETWORK", e.kind());
    }

    @Test
    void sender_failures_are_mapped() {
        URI u = URI.create("https://a.test/x");
        HttpPageFetcher timeout = new HttpPageFetcher("ua", req -> { throw new HttpTimeoutException("t"); });
        assertThrows(FetchTimeoutException.class, () -> timeout.fetch(u, Duration.ofSeconds(1)));

        HttpPageFetcher io = new HttpPageFetcher("ua", req -> { throw new IOException("reset"); });
        NetworkFetchException ne = assertThrows(NetworkFetchException.class, () -> io.fetch(u, Duration.ofSeconds(1)));
        assertInstanceOf(IOException.class, ne.getCause());
    }

    @Test
    void interrupt_is_restored() {
        URI u = URI.create("https://a.test/x");
        HttpPageFetcher f = new HttpPageFetcher("ua", req -> { throw new InterruptedException(); });
        try {
            assertThrows(NetworkFetchException.class, () -> f.fetch(u, Duration.ofSeconds(1)));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted(); // 다음 테스트로 새지 않게
        }
    }
}
