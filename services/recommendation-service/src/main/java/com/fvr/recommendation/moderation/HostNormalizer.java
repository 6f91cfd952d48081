package com.fvr.recommendation.moderation;

import java.util.Locale;

public final class HostNormalizer {
    private HostNormalizer() {
    }

    /**
     * Lowercased bare host with scheme, credentials, port and path removed and
     * surrounding dots trimmed; null when nothing usable remains.
     */
    public static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String raw = value.trim().toLowerCase(Locale.ROOT);
        if (raw.isEmpty()) {
            return null;
        }
        int scheme = raw.indexOf("://");
        String host = scheme >= 0 ? raw.substring(scheme + 3) : raw;
        host = cutAt(host, '/');
        host = cutAt(host, '?');
        host = cutAt(host, '#');
        int at = host.lastIndexOf('@');
        if (at >= 0) {
            host = host.substring(at + 1);
        }
        if (host.startsWith("[")) {
            int close = host.indexOf(']');
            host = close > 0 ? host.substring(1, close) : host.substring(1);
        } else {
            host = cutAt(host, ':');
        }
        host = trimDots(host.trim());
        if (host.isEmpty()) {
            return null;
        }
        for (int i = 0; i < host.length(); i++) {
            if (Character.isWhitespace(host.charAt(i))) {
                return null;
            }
        }
        return host;
    }

    private static String cutAt(String value, char marker) {
        int index = value.indexOf(marker);
        return index >= 0 ? value.substring(0, index) : value;
    }

    private static String trimDots(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '.') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '.') {
            end--;
        }
        return value.substring(start, end);
    }
}
