package io.facetrelay.model;

/**
 * Chain selectors are unsigned 64-bit values carried in a {@code long}.
 */
public final class ChainSelectors {
    private ChainSelectors() {
    }

    public static long parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("chain selector must not be blank");
        }
        try {
            return Long.parseUnsignedLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid chain selector: " + raw, e);
        }
    }

    public static String format(long selector) {
        return Long.toUnsignedString(selector);
    }
}
