package com.webharvester.core.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import io.github.cdimascio.dotenv.DotenvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * crawl.yml(선택) + .env(선택) + CRAWL_* 환경변수를 읽어 CrawlConfig 로 변환.
 * 우선순위: 프로세스 환경변수 > .env > YAML > 기본값.
 * .env 는 KEY=VALUE 줄 형식이며 CRAWL_* 키만 본다.
 *
 * 예상 YAML 키:
 * urlPrefix: "https://example.com/blog/"
 * matchRegex: "post-\\d+"
 * maxPages: 0
 * timeoutSeconds: 100
 * logLevel: INFO
 * userAgent: "WebHarvester/1.0 (+crawler)"
 * concurrency: 1
 * followRedirects: true
 * logDiscovered: false
 * output:
 *   dir: "out"
 *
 * 선택 값(숫자/열거형)이 잘못되면 기본값으로 돌리고 WARNING 만 남긴다.
 * 필수 값 누락, 잘못된 프리픽스/정규식은 ConfigException.
 */
public final class CrawlConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlConfigLoader.class);

    public static final String ENV_URL_PREFIX = "CRAWL_URL_PREFIX";
    public static final String ENV_MATCH_REGEX = "CRAWL_MATCH_REGEX";
    public static final String ENV_MAX_PAGES = "CRAWL_MAX_PAGES";
    public static final String ENV_TIMEOUT = "CRAWL_TIMEOUT";
    public static final String ENV_LOG_LEVEL = "CRAWL_LOG_LEVEL";
    public static final String ENV_OUTPUT_DIR = "CRAWL_OUTPUT_DIR";
    public static final String ENV_USER_AGENT = "CRAWL_USER_AGENT";
    public static final String ENV_CONCURRENCY = "CRAWL_CONCURRENCY";
    public static final String ENV_FOLLOW_REDIRECTS = "CRAWL_FOLLOW_REDIRECTS";
    public static final String ENV_LOG_DISCOVERED = "CRAWL_LOG_DISCOVERED";

    /** -Dcrawl.config=<path> 로 YAML 위치 지정 */
    public static final String CONFIG_PROPERTY = "crawl.config";
    public static final Path DEFAULT_YAML = Path.of("crawl.yml");
    public static final Path DEFAULT_DOTENV = Path.of(".env");

    private CrawlConfigLoader() {}

    /** 프로세스 환경 + (있으면) 작업 디렉터리의 .env, crawl.yml */
    public static CrawlConfig loadDefault() {
        String explicit = System.getProperty(CONFIG_PROPERTY);
        if (explicit != null && !explicit.isBlank()) {
            return load(System.getenv(), DEFAULT_DOTENV, Path.of(explicit.trim()), true);
        }
        return load(System.getenv(), DEFAULT_DOTENV, DEFAULT_YAML, false);
    }

    /** .env 없이 env + YAML 만 */
    public static CrawlConfig load(Map<String, String> env, Path yamlPath, boolean required) {
        return load(env, null, yamlPath, required);
    }

    /**
     * @param env        환경변수 맵(테스트에서는 임의 맵 주입)
     * @param dotenvPath .env 경로. null 이거나 파일이 없으면 건너뜀
     * @param yamlPath   YAML 경로. null 이면 YAML 없이 사용
     * @param required   true 면 YAML 파일이 없을 때 ConfigException, false 면 조용히 건너뜀
     */
    public static CrawlConfig load(Map<String, String> env, Path dotenvPath, Path yamlPath, boolean required) {
        Objects.requireNonNull(env, "env");
        Map<String, String> merged = new HashMap<>(readYaml(yamlPath, required));
        merged.putAll(readDotenv(dotenvPath));

        // 프로세스 env 가 .env, YAML 을 덮어쓴다
        for (Map.Entry<String, String> e : env.entrySet()) {
            if (e.getKey() != null && e.getKey().startsWith("CRAWL_") && e.getValue() != null) {
                merged.put(e.getKey(), e.getValue());
            }
        }
        return fromSettings(merged);
    }

    /** 평탄화된 CRAWL_* 키 맵 → CrawlConfig */
    static CrawlConfig fromSettings(Map<String, String> s) {
        CrawlConfig.Builder b = CrawlConfig.builder()
                .urlPrefix(s.get(ENV_URL_PREFIX))
                .matchRegex(s.get(ENV_MATCH_REGEX));

        b.maxPages(intOr(s, ENV_MAX_PAGES, CrawlConfig.DEFAULT_MAX_PAGES, 0));
        b.requestTimeout(Duration.ofSeconds(
                intOr(s, ENV_TIMEOUT, (int) CrawlConfig.DEFAULT_TIMEOUT.toSeconds(), 1)));
        b.concurrency(intOr(s, ENV_CONCURRENCY, CrawlConfig.DEFAULT_CONCURRENCY, 1));

        String lvl = s.get(ENV_LOG_LEVEL);
        b.logLevel(CrawlLogLevel.parse(lvl).orElseGet(() -> {
            if (lvl != null && !lvl.isBlank()) {
                LOG.warn("Ignoring invalid {}={}, using INFO", ENV_LOG_LEVEL, lvl);
            }
            return CrawlLogLevel.INFO;
        }));

        String dir = s.get(ENV_OUTPUT_DIR);
        if (dir != null && !dir.isBlank()) b.outputDir(Path.of(dir.trim()));

        String ua = s.get(ENV_USER_AGENT);
        if (ua != null && !ua.isBlank()) b.userAgent(ua.trim());

        b.followRedirects(boolOr(s, ENV_FOLLOW_REDIRECTS, true));
        b.logDiscovered(boolOr(s, ENV_LOG_DISCOVERED, false));

        return b.build();
    }

    // ------------ .env ------------
    private static Map<String, String> readDotenv(Path dotenvPath) {
        Map<String, String> out = new HashMap<>();
        if (dotenvPath == null || !Files.isRegularFile(dotenvPath)) return out;

        Path abs = dotenvPath.toAbsolutePath();
        Dotenv dotenv;
        try {
            dotenv = Dotenv.configure()
                    .directory(abs.getParent().toString())
                    .filename(abs.getFileName().toString())
                    .load();
        } catch (DotenvException e) {
            throw new ConfigException("cannot read " + dotenvPath + ": " + e.getMessage(), e);
        }
        // 프로세스 환경은 load() 가 합쳐 주지만 여기서는 파일에 적힌 키만 쓴다(env 맵이 따로 덮어씀)
        for (DotenvEntry e : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            if (e.getKey().startsWith("CRAWL_") && e.getValue() != null) {
                out.put(e.getKey(), e.getValue());
            }
        }
        LOG.debug("Read {} CRAWL_* keys from {}", out.size(), abs);
        return out;
    }

    // ------------ YAML ------------
    private static Map<String, String> readYaml(Path yamlPath, boolean required) {
        Map<String, String> out = new HashMap<>();
        if (yamlPath == null) return out;
        if (!Files.exists(yamlPath)) {
            if (required) throw new ConfigException("config file not found at: " + yamlPath.toAbsolutePath());
            return out;
        }

        Object root;
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (IOException | YAMLException e) {
            throw new ConfigException("cannot read config file " + yamlPath + ": " + e.getMessage(), e);
        }
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 env/기본값만 사용
            return out;
        }

        put(out, map, "urlPrefix", ENV_URL_PREFIX);
        put(out, map, "matchRegex", ENV_MATCH_REGEX);
        put(out, map, "maxPages", ENV_MAX_PAGES);
        put(out, map, "timeoutSeconds", ENV_TIMEOUT);
        put(out, map, "logLevel", ENV_LOG_LEVEL);
        put(out, map, "userAgent", ENV_USER_AGENT);
        put(out, map, "concurrency", ENV_CONCURRENCY);
        put(out, map, "followRedirects", ENV_FOLLOW_REDIRECTS);
        put(out, map, "logDiscovered", ENV_LOG_DISCOVERED);

        Object output = map.get("output");
        if (output instanceof Map<?, ?> o) {
            put(out, o, "dir", ENV_OUTPUT_DIR);
        }
        return out;
    }

    private static void put(Map<String, String> out, Map<?, ?> map, String yamlKey, String envKey) {
        Object v = map.get(yamlKey);
        if (v != null) out.put(envKey, String.valueOf(v));
    }

    // ------------ helpers ------------
    private static int intOr(Map<String, String> s, String key, int def, int min) {
        String v = s.get(key);
        if (v == null || v.isBlank()) return def;
        try {
            int n = Integer.parseInt(v.trim());
            if (n >= min) return n;
        } catch (NumberFormatException ignore) {
            // 아래 경고로 처리
        }
        LOG.warn("Ignoring invalid {}={}, using default {}", key, v, def);
        return def;
    }

    private static boolean boolOr(Map<String, String> s, String key, boolean def) {
        String v = s.get(key);
        if (v == null || v.isBlank()) return def;
        switch (v.trim().toLowerCase(Locale.ROOT)) {
            case "1": case "true": case "yes": case "on":
                return true;
            case "0": case "false": case "no": case "off":
                return false;
            default:
                LOG.warn("Ignoring invalid {}={}, using default {}", key, v, def);
                return def;
        }
    }
}
