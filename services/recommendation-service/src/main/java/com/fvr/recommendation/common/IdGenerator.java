package com.fvr.recommendation.common;

import java.security.SecureRandom;
import java.util.Locale;

public final class IdGenerator {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int TRACE_ID_BYTES = 16;
    private static final int REQUEST_ID_BYTES = 3;

    private IdGenerator() {
    }

    public static String resolveRequestId(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue.trim();
        }
        return randomHex(REQUEST_ID_BYTES);
    }

    public static String resolveTraceId(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            String trimmed = headerValue.trim();
            if (trimmed.length() == 32 && trimmed.chars().allMatch(ch -> Character.digit(ch, 16) >= 0)) {
                return trimmed.toLowerCase(Locale.ROOT);
            }
        }
        return randomHex(TRACE_ID_BYTES);
    }

    private static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : buffer) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
