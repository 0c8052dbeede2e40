package io.facetrelay.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Account identifiers: {@code 0x} followed by 40 hex digits, compared case-insensitively.
 */
public final class Addresses {
    public static final String ZERO = "0x0000000000000000000000000000000000000000";
    private static final Pattern FORMAT = Pattern.compile("^0[xX][0-9a-fA-F]{40}$");

    private Addresses() {
    }

    public static boolean isValid(String raw) {
        return raw != null && FORMAT.matcher(raw.trim()).matches();
    }

    public static String normalize(String raw) {
        if (!isValid(raw)) {
            throw new IllegalArgumentException("Invalid address: " + raw);
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isZero(String raw) {
        return ZERO.equals(normalize(raw));
    }

    public static boolean same(String left, String right) {
        if (!isValid(left) || !isValid(right)) {
            return false;
        }
        return normalize(left).equals(normalize(right));
    }

    public static String fromSeed(String seed) {
        return "0x" + Hashing.sha256Hex(seed).substring(0, 40);
    }
}
