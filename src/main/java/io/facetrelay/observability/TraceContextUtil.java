package io.facetrelay.observability;

import java.security.SecureRandom;

/**
 * W3C-sized trace identifiers for audit correlation of one external invocation.
 */
public final class TraceContextUtil {
    private static final SecureRandom RANDOM = new SecureRandom();

    private TraceContextUtil() {
    }

    public static String newTraceId() {
        return randomHex(16);
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
