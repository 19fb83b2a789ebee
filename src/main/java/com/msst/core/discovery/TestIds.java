package com.msst.core.discovery;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Parsing and normalization of test identifiers.
 * <p>
 * The leading digit run of a name is the numeric ID; the catalog key is that number
 * zero-padded to three digits, so "16", "016", "0016" and "16.ext" all map to "016".
 */
public final class TestIds {

    private TestIds() {}

    /** Parses the leading ASCII digit run of {@code raw}; empty when it does not start with one. */
    public static OptionalInt parse(String raw) {
        if (raw == null) {
            return OptionalInt.empty();
        }
        String s = raw.trim();
        int end = 0;
        while (end < s.length() && isAsciiDigit(s.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(s.substring(0, end)));
        } catch (NumberFormatException e) {
            // digit run too long for an int
            return OptionalInt.empty();
        }
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static String pad(int id) {
        return String.format(Locale.ROOT, "%03d", id);
    }

    /** Normalized catalog key for {@code raw}, if it carries a numeric ID. */
    public static Optional<String> normalize(String raw) {
        OptionalInt id = parse(raw);
        return id.isPresent() ? Optional.of(pad(id.getAsInt())) : Optional.empty();
    }
}
