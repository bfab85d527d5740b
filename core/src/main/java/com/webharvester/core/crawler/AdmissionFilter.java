package com.webharvester.core.crawler;

import com.webharvester.core.config.CrawlConfig;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 범위/매치 판정. 모두 부수효과 없는 순수 함수.
 * <ul>
 *   <li>범위(in-scope): 정규화된 URL 문자열이 프리픽스로 <b>문자 그대로</b> 시작하는가.
 *       경로 경계는 보지 않는다: {@code https://a.com/blog} 는 {@code https://a.com/blog2/x} 도 받는다.
 *       경계가 필요하면 프리픽스 끝에 {@code /} 를 붙인다.</li>
 *   <li>매치: 패턴이 URL 문자열 어디에서든 find() 되는가(패턴이 직접 앵커하지 않는 한 비앵커).</li>
 * </ul>
 */
public final class AdmissionFilter {

    private final String prefix;
    private final Pattern pattern;

    public AdmissionFilter(String prefix, Pattern pattern) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    public static AdmissionFilter of(CrawlConfig config) {
        return new AdmissionFilter(config.getUrlPrefix(), config.getMatchPattern());
    }

    public boolean inScope(URI url) { return inScope(url, prefix); }
    public boolean isMatch(URI url) { return isMatch(url, pattern); }
    public List<String> matches(URI url) { return matches(url, pattern); }

    public String prefix() { return prefix; }
    public Pattern pattern() { return pattern; }

    // ---------- 순수 함수 ----------

    public static boolean inScope(URI url, String prefix) {
        if (url == null || prefix == null) return false;
        return url.toString().startsWith(prefix);
    }

    public static boolean isMatch(URI url, Pattern pattern) {
        if (url == null || pattern == null) return false;
        return pattern.matcher(url.toString()).find();
    }

    /** 매치된 부분 문자열 전부(없으면 빈 리스트). 기록의 matches 필드용 */
    public static List<String> matches(URI url, Pattern pattern) {
        if (url == null || pattern == null) return List.of();
        List<String> out = new ArrayList<>(2);
        Matcher m = pattern.matcher(url.toString());
        while (m.find()) out.add(m.group());
        return List.copyOf(out);
    }
}
