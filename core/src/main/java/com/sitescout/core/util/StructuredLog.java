package com.sitescout.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거 (java.util.logging 위).
 * 필드 순서: ts, lvl, comp, thread, event, 이후 key/value 쌍.
 * 핸들러/포맷 구성은 LogSetup(app-cli) 담당.
 */
public final class StructuredLog {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Logger jul;
    private final String comp;

    private StructuredLog(String loggerName, String comp) {
        this.jul = Logger.getLogger(loggerName);
        this.comp = comp;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls.getName(), cls.getSimpleName());
    }

    /** 이름 기반 로거 (예: 진단 채널 "sitescout.diagnostics") */
    public static StructuredLog named(String loggerName) {
        int dot = loggerName.lastIndexOf('.');
        return new StructuredLog(loggerName, dot < 0 ? loggerName : loggerName.substring(dot + 1));
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ts", Instant.now().toString());
        m.put("lvl", lvl.getName());
        m.put("comp", comp);
        m.put("thread", Thread.currentThread().getName());
        m.put("event", event);
        if (kvs != null) {
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
            // 스칼라만 넣으므로 사실상 발생하지 않음
            return "{\"event\":\"" + event + "\",\"_encode_error\":true}";
        }
    }

    private static Object scalar(Object v) {
        if (v == null || v instanceof Number || v instanceof Boolean) return v;
        return String.valueOf(v);
    }
}
