package com.webharvester.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 이벤트 로거.
 * LogSetup(콘솔/파일 핸들러) 세팅 후 여기서 호출하면 한 줄 JSON 으로 찍힘.
 * 사람이 읽는 로그는 SLF4J, 기계가 읽는 이벤트는 여기.
 */
public final class StructuredLog {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,   event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,   event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING,event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = render(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    /** 테스트에서도 쓰는 순수 렌더러 */
    String render(Level lvl, String event, Throwable t, Object... kvs) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ts", Instant.now().toString());
        m.put("lvl", lvl.getName());
        m.put("comp", comp);
        m.put("thread", Thread.currentThread().getName());
        m.put("event", event);

        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                m.put(String.valueOf(kvs[i]), scalar(kvs[i + 1]));
            }
            if (kvs.length % 2 == 1) m.put("_kv_mismatch", true);
        }
        if (t != null) {
            m.put("error", t.getClass().getSimpleName());
            m.put("message", t.getMessage());
        }
        try {
            return JSON.writeValueAsString(m);
        } catch (JsonProcessingException e) {
            // Map<String, scalar> 직렬화는 실패하지 않지만 로그 한 줄은 남긴다
            return fallbackLine(event);
        }
    }

    /** 직렬화 실패 시 최소 한 줄. event 는 JSON 문자열로 이스케이프 */
    static String fallbackLine(String event) {
        String quoted = new String(JsonStringEncoder.getInstance().quoteAsString(String.valueOf(event)));
        return "{\"event\":\"" + quoted + "\",\"_render_error\":true}";
    }

    // 숫자/불리언은 그대로, 나머지는 문자열로
    private static Object scalar(Object v) {
        if (v == null || v instanceof Number || v instanceof Boolean) return v;
        return String.valueOf(v);
    }
}
