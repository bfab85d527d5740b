package com.webharvester.core.http;

import java.net.URI;

/** 연결 실패, DNS 실패, 끊긴 응답 등 */
public class NetworkFetchException extends FetchException {

    public NetworkFetchException(URI url, String message, Throwable cause) {
        super(url, message, cause);
    }

    @Override public String kind() { return "NETWORK"; }
}
