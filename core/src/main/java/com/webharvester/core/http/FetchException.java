package com.webharvester.core.http;

import java.net.URI;

/**
 * fetch 한 건의 실패. 실행 전체에는 치명적이지 않다:
 * 엔진이 로그를 남기고 오류 카운터를 올린 뒤 다음 항목으로 넘어간다.
 */
public abstract class FetchException extends Exception {
    private final URI url;

    protected FetchException(URI url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public URI getUrl() { return url; }

    /** 로그/이벤트용 짧은 분류명 */
    public abstract String kind();
}
