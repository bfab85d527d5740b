package com.webharvester.core.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.webharvester.core.config.CrawlConfig;
import com.webharvester.core.persist.PersistenceException;
import com.webharvester.core.persist.PersistenceWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlEngineTest {

    private static final String SITE = "https://site.test";
    private static final ObjectMapper OM = new ObjectMapper();

    @TempDir Path tmp;

    private static CrawlConfig config(Path out, String prefix, int maxPages, int cc) {
        return CrawlConfig.builder()
                .urlPrefix(prefix)
                .matchRegex("post-\\d+")
                .maxPages(maxPages)
                .concurrency(cc)
                .outputDir(out)
                .build();
    }

    private static CrawlEngine engine(CrawlConfig cfg, FakePageFetcher site) {
        return new CrawlEngine(cfg, site, new JsoupLinkExtractor(),
                new PersistenceWriter(cfg.getOutputDir()), new Frontier());
    }

    /** /, post-1, post-2, about 는 200, post-3 은 404, 외부 링크 하나 */
    private static FakePageFetcher blogSite() {
        return new FakePageFetcher()
                .links(SITE + "/", "/blog/post-1", "/blog/post-2", "/about",
                        "https://other.test/post-9", "mailto:hi@site.test")
                .links(SITE + "/blog/post-1", "/", "post-2", "/blog/post-3")
                .html(SITE + "/blog/post-2", "<html><body><p>no links</p></body></html>")
                .links(SITE + "/about", "/blog/post-1#comments");
    }

    private static List<JsonNode> records(Path out) throws Exception {
        Path f = out.resolve(PersistenceWriter.RECORDS_FILE);
        List<JsonNode> out2 = new ArrayList<>();
        if (!Files.exists(f)) return out2;
        for (String line : Files.readAllLines(f, StandardCharsets.UTF_8)) out2.add(OM.readTree(line));
        return out2;
    }

    private static URI u(String path) { return URI.create(SITE + path); }

    @Test
    void bfs_crawl_fetches_in_scope_pages_once_and_records_matches() throws Exception {
        FakePageFetcher site = blogSite();
        CrawlEngine e = engine(config(tmp, SITE + "/", 0, 1), site);

        CrawlOutcome o = e.run();

        assertThat(o.state()).isEqualTo(CrawlState.COMPLETED);
        assertThat(o.fatalError()).isNull();
        assertThat(site.calls()).containsExactly(
                u("/"), u("/blog/post-1"), u("/blog/post-2"), u("/about"), u("/blog/post-3"));

        assertThat(o.stats().fetchAttempts).isEqualTo(5);
        assertThat(o.stats().pagesFetched).isEqualTo(4);
        assertThat(o.stats().pagesMatched).isEqualTo(2);
        assertThat(o.stats().fetchErrors).isEqualTo(1);
        assertThat(o.stats().pagesSkipped).isEqualTo(1);

        List<JsonNode> recs = records(tmp);
        assertThat(recs).hasSize(2);
        JsonNode first = recs.get(0);
        assertThat(first.get("url").asText()).isEqualTo(SITE + "/blog/post-1");
        assertThat(first.get("host").asText()).isEqualTo("site.test");
        assertThat(first.get("httpStatus").asInt()).isEqualTo(200);
        assertThat(first.get("matches").get(0).asText()).isEqualTo("post-1");
        assertThat(first.get("fetchedAt").asText()).endsWith("Z");

        Path saved = Path.of(first.get("savedPath").asText());
        assertThat(saved).isEqualTo(tmp.resolve("site.test").resolve("blog_post-1.html"));
        assertThat(Files.size(saved)).isEqualTo(first.get("contentLength").asLong());
        assertThat(Files.readString(saved)).contains("/blog/post-3");
    }

    @Test
    void out_of_scope_links_are_never_fetched() {
        FakePageFetcher site = new FakePageFetcher()
                .links(SITE + "/blog", "/blog/post-1", "/blog2/post-2", "/about/post-3");
        CrawlEngine e = engine(config(tmp, SITE + "/blog/", 0, 1), site);

        CrawlOutcome o = e.run();

        assertThat(site.calls()).containsExactly(u("/blog"), u("/blog/post-1"));
        assertThat(o.stats().pagesSkipped).isEqualTo(2);
        assertThat(o.stats().pagesMatched).isZero(); // post-1 은 404
    }

    @Test
    void link_back_to_visited_seed_is_not_counted_as_skipped() {
        FakePageFetcher site = new FakePageFetcher()
                .links(SITE + "/blog", "/blog/", "/blog2/x");
        CrawlEngine e = engine(config(tmp, SITE + "/blog/", 0, 1), site);

        CrawlOutcome o = e.run();

        assertThat(site.calls()).containsExactly(u("/blog"));
        assertThat(o.stats().pagesSkipped).isEqualTo(1); // /blog2/x 만
    }

    @Test
    void max_pages_caps_fetch_attempts_and_drops_the_queue() throws Exception {
        FakePageFetcher site = blogSite();
        Frontier frontier = new Frontier();
        CrawlConfig cfg = config(tmp, SITE + "/", 2, 1);
        CrawlEngine e = new CrawlEngine(cfg, site, new JsoupLinkExtractor(), new PersistenceWriter(tmp), frontier);

        CrawlOutcome o = e.run();

        assertThat(o.state()).isEqualTo(CrawlState.COMPLETED);
        assertThat(site.calls()).containsExactly(u("/"), u("/blog/post-1"));
        assertThat(o.stats().fetchAttempts).isEqualTo(2);
        assertThat(frontier.isEmpty()).isTrue();
        assertThat(records(tmp)).hasSize(1);
    }

    @Test
    void max_pages_holds_with_parallel_fetches() throws Exception {
        FakePageFetcher site = new FakePageFetcher();
        String[] hrefs = new String[60];
        for (int i = 0; i < hrefs.length; i++) {
            hrefs[i] = "/p/post-" + i;
            site.html(SITE + hrefs[i], "<html><body>page " + i + "</body></html>");
        }
        site.links(SITE + "/", hrefs);

        CrawlEngine e = engine(config(tmp, SITE + "/", 10, 4), site);
        CrawlOutcome o = e.run();

        assertThat(o.state()).isEqualTo(CrawlState.COMPLETED);
        assertThat(site.calls()).hasSize(10).doesNotHaveDuplicates();
        assertThat(o.stats().fetchAttempts).isEqualTo(10);
        assertThat(o.stats().pagesMatched).isEqualTo(9);
        assertThat(records(tmp)).hasSize(9)
                .allSatisfy(r -> assertThat(r.get("url").asText()).contains("/p/post-"));
    }

    @Test
    void same_site_same_config_gives_same_records() throws Exception {
        Path outA = Files.createDirectories(tmp.resolve("a"));
        Path outB = Files.createDirectories(tmp.resolve("b"));
        FakePageFetcher siteA = blogSite();
        FakePageFetcher siteB = blogSite();

        engine(config(outA, SITE + "/", 0, 1), siteA).run();
        engine(config(outB, SITE + "/", 0, 1), siteB).run();

        assertThat(siteA.calls()).isEqualTo(siteB.calls());
        assertThat(comparable(outA)).isEqualTo(comparable(outB));
    }

    // fetchedAt 은 실행마다 다르고 savedPath 는 출력 디렉터리에 따라 다르다
    private static List<String> comparable(Path out) throws Exception {
        List<String> out2 = new ArrayList<>();
        for (JsonNode r : records(out)) {
            ObjectNode n = ((ObjectNode) r).deepCopy();
            n.remove("fetchedAt");
            n.put("savedPath", out.relativize(Path.of(r.get("savedPath").asText())).toString());
            out2.add(n.toString());
        }
        return out2;
    }

    @Test
    void cycles_terminate() {
        FakePageFetcher site = new FakePageFetcher()
                .links(SITE + "/", "/a")
                .links(SITE + "/a", "/b", "/")
                .links(SITE + "/b", "/a", "/", "/b/");
        CrawlOutcome o = engine(config(tmp, SITE + "/", 0, 1), site).run();

        assertThat(o.isCompleted()).isTrue();
        assertThat(site.calls()).containsExactly(u("/"), u("/a"), u("/b"));
    }

    @Test
    void fetch_failures_are_counted_and_crawl_continues() {
        FakePageFetcher site = blogSite().timeout(SITE + "/blog/post-2");
        CrawlOutcome o = engine(config(tmp, SITE + "/", 0, 1), site).run();

        assertThat(o.state()).isEqualTo(CrawlState.COMPLETED);
        assertThat(o.stats().fetchErrors).isEqualTo(2); // timeout + 404
        assertThat(o.stats().pagesMatched).isEqualTo(1);
    }

    @Test
    void unreachable_seed_completes_with_error() {
        FakePageFetcher site = new FakePageFetcher();
        CrawlOutcome o = engine(config(tmp, SITE + "/", 0, 1), site).run();

        assertThat(o.state()).isEqualTo(CrawlState.COMPLETED);
        assertThat(o.stats().pagesFetched).isZero();
        assertThat(o.stats().fetchErrors).isEqualTo(1);
        assertThat(site.calls()).containsExactly(u("/"));
    }

    @Test
    void non_html_match_is_saved_but_not_parsed() throws Exception {
        FakePageFetcher site = new FakePageFetcher()
                .links(SITE + "/", "/files/post-1.pdf")
                .page(SITE + "/files/post-1.pdf", "application/pdf",
                        "%PDF <a href=\"/post-2\">".getBytes(StandardCharsets.UTF_8));
        CrawlOutcome o = engine(config(tmp, SITE + "/", 0, 1), site).run();

        assertThat(site.calls()).containsExactly(u("/"), u("/files/post-1.pdf"));
        assertThat(o.stats().pagesMatched).isEqualTo(1);
        assertThat(tmp.resolve("site.test").resolve("files_post-1.pdf")).exists();
    }

    @Test
    void empty_body_is_not_persisted() throws Exception {
        FakePageFetcher site = new FakePageFetcher()
                .links(SITE + "/", "/blog/post-5")
                .html(SITE + "/blog/post-5", "");
        CrawlOutcome o = engine(config(tmp, SITE + "/", 0, 1), site).run();

        assertThat(o.stats().pagesFetched).isEqualTo(2);
        assertThat(o.stats().pagesMatched).isZero();
        assertThat(records(tmp)).isEmpty();
    }

    @Test
    void persistence_failure_aborts() throws Exception {
        Path blocked = Files.writeString(tmp.resolve("blocked"), "not a directory");
        FakePageFetcher site = blogSite();
        CrawlEngine e = engine(config(blocked, SITE + "/", 0, 1), site);

        CrawlOutcome o = e.run();

        assertThat(o.state()).isEqualTo(CrawlState.ABORTED);
        assertThat(e.getState()).isEqualTo(CrawlState.ABORTED);
        assertThat(o.fatalError()).isInstanceOf(PersistenceException.class);
        assertThat(o.stats().pagesMatched).isZero();
        // 첫 매치(post-1)에서 멈춘다
        assertThat(site.calls()).containsExactly(u("/"), u("/blog/post-1"));
    }

    @Test
    void unexpected_fetcher_bug_aborts() {
        FakePageFetcher site = blogSite().crash(SITE + "/blog/post-2");
        CrawlOutcome o = engine(config(tmp, SITE + "/", 0, 1), site).run();

        assertThat(o.state()).isEqualTo(CrawlState.ABORTED);
        assertThat(o.fatalError()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void engine_runs_only_once() {
        CrawlEngine e = engine(config(tmp, SITE + "/", 0, 1), new FakePageFetcher());
        assertThat(e.getState()).isEqualTo(CrawlState.IDLE);
        e.run();
        assertThat(e.getState().isTerminal()).isTrue();
        assertThatThrownBy(e::run).isInstanceOf(IllegalStateException.class);
    }
}
