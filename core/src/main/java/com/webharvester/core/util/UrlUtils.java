package com.webharvester.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + 프리픽스/호스트 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙 (방문 집합의 동일성 기준):
     * - http/https 외 스킴은 null (크롤 대상 아님)
     * - scheme/host 소문자, userinfo 제거
     * - 기본 포트 제거(http:80, https:443)
     * - fragment 제거(#... 제거)
     * - 빈 경로는 "/", 중복 슬래시 축소
     * - 루트("/")가 아닌 경로의 끝 슬래시 제거: /blog/ == /blog
     * - query 는 그대로 유지
     */
    public static URI normalize(URI u) {
        if (u == null || u.getScheme() == null) return null;

        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return null;

        Authority a = authority(u);
        if (a == null) return null;
        String host = a.host;
        int port = effectivePort(scheme, a.port);

        // raw 경로/쿼리 기준: 디코드 후 재인코딩하면 %2F 같은 값이 바뀐다
        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        path = path.replaceAll("/{2,}", "/");
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.replaceAll("/+$", "");
            if (path.isEmpty()) path = "/";
        }

        return build(scheme, host, port, path, u.getRawQuery());
    }

    /** 문자열 버전: 파싱 실패 시 null */
    public static URI normalize(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return normalize(new URI(raw.trim()));
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * 설정 프리픽스 정규화: scheme/host/포트/fragment 만 정리하고 경로는 그대로 둔다.
     * 끝 슬래시는 경계 매칭을 원하는 사용자의 의도이므로 보존한다. query 는 버린다.
     */
    public static URI normalizePrefix(URI u) {
        if (u == null || u.getScheme() == null) return null;
        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return null;
        Authority a = authority(u);
        if (a == null) return null;

        String path = (u.getRawPath() == null) ? "" : u.getRawPath();
        return build(scheme, a.host, effectivePort(scheme, a.port), path, null);
    }

    /** 소문자 호스트(없으면 빈 문자열) */
    public static String host(URI u) {
        if (u == null) return "";
        Authority a = authority(u);
        return (a == null) ? "" : a.host;
    }

    /** 소문자 host + 포트(-1 = 없음). host 를 못 찾으면 null */
    private static final class Authority {
        final String host;
        final int port;
        Authority(String host, int port) { this.host = host; this.port = port; }
    }

    /**
     * URI.getHost() 는 '_' 가 들어간 호스트(my_blog.example.com)에서 null 을 준다.
     * 그럴 때는 raw authority 에서 userinfo/포트를 떼어 직접 꺼낸다.
     */
    private static Authority authority(URI u) {
        String host = u.getHost();
        if (host != null && !host.isEmpty()) {
            return new Authority(host.toLowerCase(Locale.ROOT), u.getPort());
        }
        String auth = u.getRawAuthority();
        if (auth == null || auth.isEmpty()) return null;

        int at = auth.lastIndexOf('@');
        if (at >= 0) auth = auth.substring(at + 1);

        int port = -1;
        int colon = auth.lastIndexOf(':');
        if (colon >= 0 && auth.indexOf(']') < colon) {
            String p = auth.substring(colon + 1);
            auth = auth.substring(0, colon);
            if (!p.isEmpty()) {
                if (!p.chars().allMatch(Character::isDigit) || p.length() > 5) return null;
                port = Integer.parseInt(p);
            }
        }
        if (auth.isEmpty()) return null;
        return new Authority(auth.toLowerCase(Locale.ROOT), port);
    }

    private static URI build(String scheme, String host, int port, String rawPath, String rawQuery) {
        StringBuilder sb = new StringBuilder(64)
                .append(scheme).append("://").append(host);
        if (port >= 0) sb.append(':').append(port);
        sb.append(rawPath);
        if (rawQuery != null) sb.append('?').append(rawQuery);
        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static int effectivePort(String scheme, int port) {
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            return -1; // 기본 포트 제거
        }
        return port;
    }
}
