package com.webharvester.core.crawler;

import java.net.URI;

/** HTML 본문에서 절대 URL 을 뽑는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * html 의 href/src 참조를 baseUrl 기준 절대 URI 로 풀어 돌려준다.
     * 결과는 유한하고 다시 순회할 수 있어야 하며(iterator() 마다 처음부터),
     * 깨진 마크업에서도 예외 없이 가능한 만큼만 돌려준다.
     */
    Iterable<URI> extractLinks(String html, URI baseUrl);
}
