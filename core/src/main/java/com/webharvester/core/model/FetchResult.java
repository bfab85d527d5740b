package com.webharvester.core.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** 성공한 GET 한 건의 캡처(본문은 원본 바이트 그대로) */
public final class FetchResult {
    private final URI url;          // 요청 URL(정규화된 프런티어 값)
    private final URI finalUrl;     // 리다이렉트 후 최종 URL
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final String contentType;
    private final ContentKind contentKind;
    private final long elapsedMs;

    private FetchResult(Builder b) {
        this.url = b.url;
        this.finalUrl = (b.finalUrl == null) ? b.url : b.finalUrl;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? new byte[0] : b.body;
        this.contentType = b.contentType;
        this.contentKind = ContentKind.fromContentType(b.contentType);
        this.elapsedMs = b.elapsedMs;
    }

    public URI getUrl() { return url; }
    public URI getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    /** 내부 배열을 그대로 준다(복사 비용 회피). 수정 금지 */
    public byte[] getBody() { return body; }
    public int getContentLength() { return body.length; }
    public String getContentType() { return contentType; }
    public ContentKind getContentKind() { return contentKind; }
    public long getElapsedMs() { return elapsedMs; }

    public boolean isHtml() { return contentKind == ContentKind.HTML; }

    /** Content-Type 의 charset 파라미터, 없거나 모르면 UTF-8 */
    public Charset charset() {
        if (contentType == null) return StandardCharsets.UTF_8;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring("charset=".length()).trim().replace("\"", "");
                try {
                    return Charset.forName(name);
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    /** 본문을 charset 으로 디코드한 텍스트 */
    public String bodyText() {
        return new String(body, charset());
    }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private URI finalUrl;
        private int statusCode;
        private Map<String, List<String>> headers;
        private byte[] body;
        private String contentType;
        private long elapsedMs;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder finalUrl(URI finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder elapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; return this; }

        public FetchResult build() {
            Objects.requireNonNull(url, "url");
            return new FetchResult(this);
        }
    }
}
