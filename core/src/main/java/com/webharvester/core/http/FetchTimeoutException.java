package com.webharvester.core.http;

import java.net.URI;
import java.time.Duration;

/** requestTimeout 안에 응답이 오지 않음 */
public class FetchTimeoutException extends FetchException {

    public FetchTimeoutException(URI url, Duration timeout, Throwable cause) {
        super(url, "no response within " + timeout.toMillis() + "ms", cause);
    }

    @Override public String kind() { return "TIMEOUT"; }
}
