package com.webharvester.core.api;

import com.webharvester.core.http.FetchException;
import com.webharvester.core.model.FetchResult;

import java.net.URI;
import java.time.Duration;

/** fetch 최소 계약: URL 하나를 timeout 안에 GET 하고 2xx 결과를 돌려준다. 재시도 없음. */
public interface IPageFetcher extends AutoCloseable {
    FetchResult fetch(URI url, Duration timeout) throws FetchException;
    @Override default void close() throws Exception {}
}
