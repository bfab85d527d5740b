package com.webharvester.core.model;

import java.util.Locale;

/** 응답 본문 종류. 링크 추출은 HTML 에만 적용한다. */
public enum ContentKind {
    HTML,
    OTHER;

    /**
     * Content-Type 헤더 → 종류.
     * 헤더가 없으면 HTML 로 간주(최선 노력 파싱).
     */
    public static ContentKind fromContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) return HTML;
        String mime = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        if (mime.equals("text/html") || mime.equals("application/xhtml+xml")) return HTML;
        return OTHER;
    }
}
