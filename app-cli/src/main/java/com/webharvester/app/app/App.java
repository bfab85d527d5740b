package com.webharvester.app.app;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.webharvester.app.logging.LogSetup;
import com.webharvester.core.config.ConfigException;
import com.webharvester.core.config.CrawlConfig;
import com.webharvester.core.config.CrawlConfigLoader;
import com.webharvester.core.crawler.CrawlEngine;
import com.webharvester.core.crawler.CrawlOutcome;

/**
 * CLI 진입점. 인자는 쓰지 않고 CRAWL_* 환경변수(+ .env, crawl.yml)로만 설정한다.
 * 종료 코드: 0 = 완료, 1 = 중단(치명 오류), 2 = 설정 오류
 */
public final class App {
    private static final Logger LOG = Logger.getLogger(App.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_ABORTED = 1;
    public static final int EXIT_CONFIG = 2;

    private App() {}

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "\n==== Uncaught: " + t.getName() + " ====", e));
        System.exit(run(args, CrawlConfigLoader::loadDefault));
    }

    /** 테스트용: 임의 env 맵 + YAML 경로 */
    static int run(String[] args, Map<String, String> env, Path yaml) {
        return run(args, () -> CrawlConfigLoader.load(env, yaml, yaml != null));
    }

    static int run(String[] args, Supplier<CrawlConfig> configSource) {
        final CrawlConfig config;
        try {
            config = configSource.get();
        } catch (ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        Path logDir = config.getOutputDir().resolve("logs");
        LogSetup.init(logDir, config.getLogLevel().toJulLevel());
        if (args != null && args.length > 0) {
            LOG.warning(() -> "Ignoring command-line arguments " + Arrays.toString(args)
                    + "; configure with CRAWL_* environment variables");
        }
        LOG.fine(() -> "Effective config: " + config);

        try (CrawlEngine engine = new CrawlEngine(config)) {
            CrawlOutcome outcome = engine.run();
            return outcome.isCompleted() ? EXIT_OK : EXIT_ABORTED;
        }
    }
}
