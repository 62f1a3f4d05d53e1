package com.amannmalik.finmoney.api.currency;

import com.amannmalik.finmoney.util.Ensure;

import java.util.Locale;
import java.util.Optional;

/**
 * Bounded printable-ASCII string used for currency codes and names. The capacity is part of
 * the key so a {@link Currency} can tell a code key from a name key without re-parsing.
 */
public record AsciiKey(String value, int capacity) {
    public static final int CODE_CAPACITY = 16;
    public static final int NAME_CAPACITY = 52;

    public AsciiKey {
        Ensure.positiveInt("ascii_key.capacity", capacity);
        var problem = problem(Ensure.notNull("ascii_key.value", value), capacity);
        if (problem != null) {
            throw new IllegalArgumentException("ascii_key " + problem);
        }
    }

    /**
     * Parses a currency code key: upper-cased, no whitespace. The raw input is checked before
     * case mapping, so non-ASCII letters that upper-case to ASCII ({@code ß}, {@code ı}) are
     * rejected.
     */
    public static AsciiKey code(String raw) {
        var problem = codeProblem(Ensure.notNull("code", raw));
        if (problem != null) {
            throw new IllegalArgumentException("code " + problem);
        }
        return new AsciiKey(raw.toUpperCase(Locale.ROOT), CODE_CAPACITY);
    }

    public static AsciiKey name(String raw) {
        return new AsciiKey(Ensure.notNull("name", raw), NAME_CAPACITY);
    }

    public static Optional<AsciiKey> tryCode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return codeProblem(raw) == null
                ? Optional.of(new AsciiKey(raw.toUpperCase(Locale.ROOT), CODE_CAPACITY))
                : Optional.empty();
    }

    public static Optional<AsciiKey> tryName(String raw) {
        if (raw == null || problem(raw, NAME_CAPACITY) != null) {
            return Optional.empty();
        }
        return Optional.of(new AsciiKey(raw, NAME_CAPACITY));
    }

    /**
     * Replaces anything outside printable ASCII with {@code _} and cuts the input at
     * {@code capacity} characters.
     */
    static String sanitize(String raw, int capacity) {
        var out = new StringBuilder(Math.min(raw.length(), capacity));
        for (int i = 0; i < raw.length() && out.length() < capacity; i++) {
            char ch = raw.charAt(i);
            out.append(isPrintableAscii(ch) ? ch : '_');
        }
        return out.toString();
    }

    /// Returns a description of why {@code value} is not a code, or null when it is one.
    static String codeProblem(String value) {
        var problem = problem(value, CODE_CAPACITY);
        if (problem != null) {
            return problem;
        }
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == ' ') {
                return "MUST NOT contain spaces";
            }
        }
        return null;
    }

    static String problem(String value, int capacity) {
        if (value.isEmpty()) {
            return "MUST be non-empty";
        }
        if (value.length() > capacity) {
            return "MUST be at most " + capacity + " characters";
        }
        for (int i = 0; i < value.length(); i++) {
            if (!isPrintableAscii(value.charAt(i))) {
                return "MUST contain printable ASCII only";
            }
        }
        return null;
    }

    private static boolean isPrintableAscii(char ch) {
        return ch >= 0x20 && ch <= 0x7E;
    }

    @Override
    public String toString() {
        return value;
    }
}
