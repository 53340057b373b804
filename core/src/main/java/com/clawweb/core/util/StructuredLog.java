package com.clawweb.core.util;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 이벤트 단위 JSON 한 줄 로거 (java.util.logging 위에 얹음).
 * 사람이 읽는 진단 메시지는 SLF4J, 집계/기계 처리용 이벤트는 여기로.
 *
 * <pre>{@code
 * SLOG.info("crawl.done", "followed", 12, "found", 40);
 * // {"ts":"...","lvl":"INFO","comp":"Crawler","event":"crawl.done","followed":12,"found":40}
 * }</pre>
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
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

    /** 패키지 내부 테스트용으로 노출 */
    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        StringBuilder sb = new StringBuilder(128).append('{');
        JsonUtil.kv(sb, "ts", Instant.now().toString());
        JsonUtil.kv(sb, "lvl", lvl.getName());
        JsonUtil.kv(sb, "comp", comp);
        JsonUtil.kv(sb, "event", event);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                JsonUtil.kv(sb, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) JsonUtil.kv(sb, "_kv_mismatch", true);
        }
        if (t != null) {
            JsonUtil.kv(sb, "error", t.getClass().getSimpleName());
            JsonUtil.kv(sb, "message", t.getMessage());
        }
        sb.setLength(sb.length() - 1); // 마지막 콤마
        return sb.append('}').toString();
    }
}
