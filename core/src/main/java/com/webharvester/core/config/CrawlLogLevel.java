package com.webharvester.core.config;

import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;

/** CRAWL_LOG_LEVEL 허용 값. JUL 이름(FINE, SEVERE 등)도 별칭으로 받는다. */
public enum CrawlLogLevel {
    DEBUG(Level.FINE),
    INFO(Level.INFO),
    WARNING(Level.WARNING),
    ERROR(Level.SEVERE);

    private final Level julLevel;

    CrawlLogLevel(Level julLevel) {
        this.julLevel = julLevel;
    }

    public Level toJulLevel() { return julLevel; }

    /** 대소문자 무시 파싱. 모르는 값이면 empty */
    public static Optional<CrawlLogLevel> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String s = raw.trim().toUpperCase(Locale.ROOT);
        switch (s) {
            case "DEBUG": case "FINE": case "FINER": case "FINEST": case "TRACE": case "ALL":
                return Optional.of(DEBUG);
            case "INFO": case "CONFIG":
                return Optional.of(INFO);
            case "WARN": case "WARNING":
                return Optional.of(WARNING);
            case "ERROR": case "SEVERE": case "CRITICAL":
                return Optional.of(ERROR);
            default:
                return Optional.empty();
        }
    }
}
