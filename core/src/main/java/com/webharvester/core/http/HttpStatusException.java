package com.webharvester.core.http;

import java.net.URI;

/** 2xx 가 아닌 응답 */
public class HttpStatusException extends FetchException {
    private final int status;

    public HttpStatusException(URI url, int status) {
        super(url, "HTTP " + status, null);
        this.status = status;
    }

    public int getStatus() { return status; }

    @Override public String kind() { return "HTTP_STATUS"; }
}
