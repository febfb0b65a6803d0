package io.steamwebchat.core;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Encodes request parameters as {@code application/x-www-form-urlencoded} text.
 *
 * <p>Parameters keep their insertion order. A {@code null} value is sent as an empty string.
 */
public final class FormBody {
    private FormBody() {}

    public static String encode(Map<String, String> params) {
        if (params == null || params.isEmpty()) return "";

        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (e.getKey() == null) continue;
            if (sb.length() > 0) sb.append('&');
            String value = e.getValue() == null ? "" : e.getValue();
            sb.append(encode(e.getKey())).append('=').append(encode(value));
        }
        return sb.toString();
    }

    public static byte[] encodeBytes(Map<String, String> params) {
        return encode(params).getBytes(StandardCharsets.UTF_8);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
