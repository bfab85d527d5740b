package com.webharvester.core.config;

import com.webharvester.core.util.UrlUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 크롤 실행 설정 (crawl.yml + CRAWL_* 환경변수 매핑 대상).
 * 한 번 build() 되면 실행 내내 불변. 검증은 build() 에서 끝낸다.
 */
public final class CrawlConfig {

    public static final int DEFAULT_MAX_PAGES = 0;                       // 0 = 무제한
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(100);
    public static final Path DEFAULT_OUTPUT_DIR = Path.of("out");
    public static final String DEFAULT_USER_AGENT = "WebHarvester/1.0 (+crawler)";
    public static final int DEFAULT_CONCURRENCY = 1;

    private final String urlPrefix;       // 정규화된 리터럴 프리픽스(scope 판정 기준)
    private final URI seedUrl;            // normalize(prefix): 첫 프런티어 항목
    private final Pattern matchPattern;
    private final int maxPages;
    private final Duration requestTimeout;
    private final CrawlLogLevel logLevel;
    private final Path outputDir;
    private final String userAgent;
    private final int concurrency;
    private final boolean followRedirects;
    private final boolean logDiscovered;

    private CrawlConfig(Builder b, String urlPrefix, URI seedUrl, Pattern matchPattern) {
        this.urlPrefix = urlPrefix;
        this.seedUrl = seedUrl;
        this.matchPattern = matchPattern;
        this.maxPages = b.maxPages;
        this.requestTimeout = b.requestTimeout;
        this.logLevel = b.logLevel;
        this.outputDir = b.outputDir;
        this.userAgent = b.userAgent;
        this.concurrency = b.concurrency;
        this.followRedirects = b.followRedirects;
        this.logDiscovered = b.logDiscovered;
    }

    // ---------- getters ----------
    public String getUrlPrefix() { return urlPrefix; }
    public URI getSeedUrl() { return seedUrl; }
    public Pattern getMatchPattern() { return matchPattern; }
    public int getMaxPages() { return maxPages; }
    public boolean isBounded() { return maxPages > 0; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public CrawlLogLevel getLogLevel() { return logLevel; }
    public Path getOutputDir() { return outputDir; }
    public String getUserAgent() { return userAgent; }
    public int getConcurrency() { return concurrency; }
    public boolean isFollowRedirects() { return followRedirects; }
    public boolean isLogDiscovered() { return logDiscovered; }

    public static Builder builder() { return new Builder(); }

    @Override
    public String toString() {
        return "CrawlConfig{prefix=" + urlPrefix
                + ", regex=" + matchPattern.pattern()
                + ", maxPages=" + (maxPages == 0 ? "unbounded" : String.valueOf(maxPages))
                + ", timeout=" + requestTimeout.toSeconds() + "s"
                + ", concurrency=" + concurrency
                + ", outputDir=" + outputDir + "}";
    }

    // ---------- builder ----------
    public static final class Builder {
        private String urlPrefix;
        private String matchRegex;
        private int maxPages = DEFAULT_MAX_PAGES;
        private Duration requestTimeout = DEFAULT_TIMEOUT;
        private CrawlLogLevel logLevel = CrawlLogLevel.INFO;
        private Path outputDir = DEFAULT_OUTPUT_DIR;
        private String userAgent = DEFAULT_USER_AGENT;
        private int concurrency = DEFAULT_CONCURRENCY;
        private boolean followRedirects = true;
        private boolean logDiscovered = false;

        private Builder() {}

        public Builder urlPrefix(String v) { this.urlPrefix = v; return this; }
        public Builder matchRegex(String v) { this.matchRegex = v; return this; }
        public Builder maxPages(int v) { this.maxPages = v; return this; }
        public Builder requestTimeout(Duration v) { this.requestTimeout = v; return this; }
        public Builder logLevel(CrawlLogLevel v) { this.logLevel = v; return this; }
        public Builder outputDir(Path v) { this.outputDir = v; return this; }
        public Builder userAgent(String v) { this.userAgent = v; return this; }
        public Builder concurrency(int v) { this.concurrency = v; return this; }
        public Builder followRedirects(boolean v) { this.followRedirects = v; return this; }
        public Builder logDiscovered(boolean v) { this.logDiscovered = v; return this; }

        /** 검증 + 프리픽스 정규화 + 정규식 컴파일. 실패는 모두 ConfigException */
        public CrawlConfig build() {
            if (urlPrefix == null || urlPrefix.isBlank())
                throw new ConfigException("CRAWL_URL_PREFIX must be set");
            if (matchRegex == null || matchRegex.isEmpty())
                throw new ConfigException("CRAWL_MATCH_REGEX must be set");
            if (maxPages < 0)
                throw new ConfigException("maxPages must be >= 0");
            if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero())
                throw new ConfigException("requestTimeout must be > 0");
            if (concurrency < 1)
                throw new ConfigException("concurrency must be >= 1");
            Objects.requireNonNull(logLevel, "logLevel");
            Objects.requireNonNull(outputDir, "outputDir");
            if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;

            URI raw;
            try {
                raw = new URI(urlPrefix.trim());
            } catch (URISyntaxException e) {
                throw new ConfigException("CRAWL_URL_PREFIX is not a valid URL: " + urlPrefix, e);
            }
            if (raw.getScheme() == null
                    || !(raw.getScheme().equalsIgnoreCase("http") || raw.getScheme().equalsIgnoreCase("https"))) {
                throw new ConfigException("CRAWL_URL_PREFIX must start with http:// or https://");
            }
            if (UrlUtils.host(raw).isEmpty()) {
                throw new ConfigException("CRAWL_URL_PREFIX must include a hostname");
            }
            URI prefix = UrlUtils.normalizePrefix(raw);
            URI seed = UrlUtils.normalize(raw);
            if (prefix == null || seed == null) {
                throw new ConfigException("CRAWL_URL_PREFIX cannot be normalized: " + urlPrefix);
            }

            Pattern pattern;
            try {
                pattern = Pattern.compile(matchRegex, Pattern.MULTILINE);
            } catch (PatternSyntaxException e) {
                throw new ConfigException("CRAWL_MATCH_REGEX is not a valid regular expression: " + e.getDescription(), e);
            }
            return new CrawlConfig(this, prefix.toString(), seed, pattern);
        }
    }
}
