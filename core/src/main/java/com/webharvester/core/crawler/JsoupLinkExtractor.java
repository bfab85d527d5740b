package com.webharvester.core.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * 기본 JSoup 기반 링크 추출기: [href], [src] → abs:href / abs:src.
 * 파싱은 한 번, URI 변환은 iterator 가 진행할 때 한 건씩.
 */
public class JsoupLinkExtractor implements LinkExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(JsoupLinkExtractor.class);

    private static final String SELECTOR = "[href], [src]";
    private static final String[] ATTRS = {"href", "src"};

    @Override
    public Iterable<URI> extractLinks(String html, URI baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (html == null || html.isBlank()) return List.of();

        final Elements refs;
        try {
            Document doc = Jsoup.parse(html, baseUrl.toString());
            refs = doc.select(SELECTOR);
        } catch (RuntimeException e) {
            // 파싱 실패는 흡수: 링크 0개로 취급
            LOG.debug("Link extraction failed on {}: {}", baseUrl, e.toString());
            return List.of();
        }
        return () -> new LinkIterator(refs);
    }

    /** 요소 하나에서 href, src 순으로 최대 두 개를 만든다 */
    private static final class LinkIterator implements Iterator<URI> {
        private final Elements refs;
        private final Deque<URI> pending = new ArrayDeque<>(2);
        private int pos = 0;

        LinkIterator(Elements refs) { this.refs = refs; }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && pos < refs.size()) {
                Element el = refs.get(pos++);
                for (String attr : ATTRS) {
                    URI u = toUri(el, attr);
                    if (u != null) pending.addLast(u);
                }
            }
            return !pending.isEmpty();
        }

        @Override
        public URI next() {
            if (!hasNext()) throw new NoSuchElementException();
            return pending.pollFirst();
        }
    }

    private static URI toUri(Element el, String attr) {
        if (!el.hasAttr(attr)) return null;
        if (el.attr(attr).isBlank()) return null;

        String abs = el.absUrl(attr);
        if (abs == null || abs.isBlank()) return null;
        try {
            URI u = new URI(abs.trim().replace(" ", "%20"));
            String s = u.getScheme();
            if (s == null) return null;
            s = s.toLowerCase(Locale.ROOT);
            if (!s.equals("http") && !s.equals("https")) return null; // mailto:, javascript: 등
            return u;
        } catch (URISyntaxException e) {
            // 잘못된 URL은 무시
            return null;
        }
    }
}
