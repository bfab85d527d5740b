package com.webharvester.core.persist;

import com.webharvester.core.model.ContentKind;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 저장 경로 규칙: out/&lt;hostDir&gt;/&lt;stem&gt;[_&lt;hash&gt;].&lt;ext&gt;
 * URL 만으로 결정되므로 같은 URL 은 항상 같은 이름이 된다.
 */
public final class PageNaming {
    private PageNaming() {}

    static final int MAX_STEM_BYTES = 200;
    static final int HASH_CHARS = 10;

    private static final Pattern EXT = Pattern.compile("^(.+)\\.([A-Za-z0-9]{1,8})$");

    /** 호스트 디렉터리: 소문자 host(+_port), [a-z0-9._-] 외 문자는 '_' */
    public static String hostDir(String host, int port) {
        String h = (host == null || host.isBlank()) ? "unknown-host" : host.toLowerCase(Locale.ROOT);
        if (port > 0) h = h + "_" + port;
        h = h.replaceAll("[^a-z0-9._-]", "_").replaceAll("^\\.+", "_");
        return h.isEmpty() ? "unknown-host" : h;
    }

    /** 경로 세그먼트를 '_' 로 이은 파일 stem. 루트는 index, query 가 있으면 해시를 붙인다 */
    public static String stem(URI url) {
        List<String> parts = new ArrayList<>();
        String raw = (url.getRawPath() == null) ? "" : url.getRawPath();
        String[] segs = raw.split("/");
        for (int i = 0; i < segs.length; i++) {
            String seg = segs[i];
            if (seg.isEmpty()) continue;
            if (i == segs.length - 1) {
                Matcher m = EXT.matcher(seg);
                if (m.matches()) seg = m.group(1); // 확장자는 ext() 가 따로 붙인다
            }
            String clean = sanitize(seg);
            if (!clean.isEmpty()) parts.add(clean);
        }
        String stem = parts.isEmpty() ? "index" : String.join("_", parts);
        if (url.getRawQuery() == null) return truncate(stem, MAX_STEM_BYTES);
        return truncate(stem, MAX_STEM_BYTES - HASH_CHARS - 1) + "_" + shortHash(url);
    }

    /** HTML 이면 .html, 아니면 마지막 세그먼트 확장자, 그것도 없으면 .bin */
    public static String ext(URI url, ContentKind kind) {
        if (kind == ContentKind.HTML) return ".html";
        String raw = (url.getRawPath() == null) ? "" : url.getRawPath();
        String last = raw.substring(raw.lastIndexOf('/') + 1);
        Matcher m = EXT.matcher(last);
        if (m.matches()) return "." + m.group(2).toLowerCase(Locale.ROOT);
        return ".bin";
    }

    /** 충돌 해소용 짧은 해시: SHA-256(url) 앞 10 hex */
    public static String shortHash(URI url) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] d = md.digest(url.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(d).substring(0, HASH_CHARS);
        } catch (NoSuchAlgorithmException e) {
            // 모든 JRE 는 SHA-256 을 제공해야 한다
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    static String sanitize(String s) {
        return s.replaceAll("[^A-Za-z0-9_-]", "_")
                .replaceAll("_{2,}", "_")
                .replaceAll("^_+|_+$", "");
    }

    // sanitize 후에는 ASCII 뿐이라 문자 수 == 바이트 수
    private static String truncate(String s, int maxBytes) {
        return (s.length() <= maxBytes) ? s : s.substring(0, maxBytes);
    }
}
