package com.clawweb.core.util;

final class JsonUtil {
    private JsonUtil() {}

    /** "k":v, 형태로 덧붙임(끝 콤마 포함). 숫자/불리언은 그대로, 나머지는 문자열. */
    static void kv(StringBuilder sb, String k, Object v) {
        str(sb, k);
        sb.append(':');
        if (v == null) sb.append("null");
        else if (v instanceof Number || v instanceof Boolean) sb.append(v);
        else str(sb, String.valueOf(v));
        sb.append(',');
    }

    static void str(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
            }
        }
        sb.append('"');
    }
}
