package com.amannmalik.finmoney.api.currency;

import com.amannmalik.finmoney.api.shared.MoneyError;
import com.amannmalik.finmoney.api.shared.MoneyResult;
import com.amannmalik.finmoney.util.Ensure;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Currency identity plus the metadata needed for rounding. The normalized code is the identity
 * key: {@link #equals(Object)} and {@link #hashCode()} ignore the id and the display name, so
 * the same code built with different names still compares equal.
 */
public final class Currency {
    public static final int MAX_DECIMAL_PLACES = 28;

    public static final Currency UNDEFINED = constant(0, "UNDEFINED", null, 8);
    public static final Currency USD = constant(1, "USD", "US Dollar", 2);
    public static final Currency EUR = constant(2, "EUR", "Euro", 2);
    public static final Currency BTC = constant(3, "BTC", "Bitcoin", 8);
    public static final Currency ETH = constant(4, "ETH", "Ether", 18);
    public static final Currency GBP = constant(5, "GBP", "Pound Sterling", 2);
    public static final Currency JPY = constant(6, "JPY", "Japanese Yen", 0);
    public static final Currency CHF = constant(7, "CHF", "Swiss Franc", 2);
    public static final Currency USDT = constant(8, "USDT", "Tether USD", 6);

    private static final List<Currency> WELL_KNOWN = List.of(USD, EUR, BTC, ETH, GBP, JPY, CHF, USDT);
    private static final AsciiKey INVALID_CODE = AsciiKey.code("INVALID");

    private final int id;
    private final AsciiKey code;
    private final AsciiKey name;
    private final int decimalPlaces;

    private Currency(int id, AsciiKey code, AsciiKey name, int decimalPlaces) {
        this.id = id;
        this.code = code;
        this.name = name;
        this.decimalPlaces = decimalPlaces;
    }

    private static Currency constant(int id, String code, String name, int decimalPlaces) {
        return new Currency(id, AsciiKey.code(code), name == null ? null : AsciiKey.name(name), decimalPlaces);
    }

    /**
     * Validating constructor. The code MUST be printable ASCII without spaces and is
     * upper-cased afterwards; {@code name} may be null.
     *
     * @return the currency, or {@link MoneyError.InvalidCurrency} describing the first problem found
     */
    public static MoneyResult<Currency> of(int id, String code, String name, int decimalPlaces) {
        if (code == null) {
            return invalid("code MUST NOT be null");
        }
        var codeProblem = AsciiKey.codeProblem(code);
        if (codeProblem != null) {
            return invalid("code '" + code + "' " + codeProblem);
        }
        var normalized = code.toUpperCase(Locale.ROOT);
        AsciiKey nameKey = null;
        if (name != null) {
            var nameProblem = AsciiKey.problem(name, AsciiKey.NAME_CAPACITY);
            if (nameProblem != null) {
                return invalid("name '" + name + "' " + nameProblem);
            }
            nameKey = new AsciiKey(name, AsciiKey.NAME_CAPACITY);
        }
        if (!isSupportedPrecision(decimalPlaces)) {
            return invalid("decimal places " + decimalPlaces + " MUST be within 0.." + MAX_DECIMAL_PLACES);
        }
        return MoneyResult.ok(new Currency(id, new AsciiKey(normalized, AsciiKey.CODE_CAPACITY), nameKey, decimalPlaces));
    }

    /**
     * Same contract as {@link #of(int, String, String, int)} for callers that already hold
     * parsed keys; skips string parsing.
     */
    public static MoneyResult<Currency> fromPrecomputed(int id, AsciiKey code, AsciiKey name, int decimalPlaces) {
        if (code == null) {
            return invalid("code MUST NOT be null");
        }
        if (code.capacity() != AsciiKey.CODE_CAPACITY) {
            return invalid("code key MUST have capacity " + AsciiKey.CODE_CAPACITY);
        }
        var codeProblem = AsciiKey.codeProblem(code.value());
        if (codeProblem != null) {
            return invalid("code key '" + code + "' " + codeProblem);
        }
        if (!code.value().equals(code.value().toUpperCase(Locale.ROOT))) {
            return invalid("code key '" + code + "' MUST be upper-case");
        }
        if (name != null && name.capacity() != AsciiKey.NAME_CAPACITY) {
            return invalid("name key MUST have capacity " + AsciiKey.NAME_CAPACITY);
        }
        if (!isSupportedPrecision(decimalPlaces)) {
            return invalid("decimal places " + decimalPlaces + " MUST be within 0.." + MAX_DECIMAL_PLACES);
        }
        return MoneyResult.ok(new Currency(id, code, name, decimalPlaces));
    }

    /**
     * Lenient constructor that never fails. Characters outside printable ASCII become
     * {@code _}, long values are truncated, an unusable code becomes {@code INVALID}, an
     * unusable name is dropped and decimal places are clamped to 0..28.
     */
    public static Currency sanitized(int id, String code, String name, int decimalPlaces) {
        var clamped = Math.max(0, Math.min(decimalPlaces, MAX_DECIMAL_PLACES));
        var codeKey = code == null
                ? INVALID_CODE
                : AsciiKey.tryCode(AsciiKey.sanitize(code, AsciiKey.CODE_CAPACITY)).orElse(INVALID_CODE);
        var nameKey = name == null
                ? null
                : AsciiKey.tryName(AsciiKey.sanitize(name, AsciiKey.NAME_CAPACITY)).orElse(null);
        return new Currency(id, codeKey, nameKey, clamped);
    }

    /// Looks up one of the static constants by code, ignoring case.
    public static Optional<Currency> wellKnown(String code) {
        if (code == null || AsciiKey.codeProblem(code) != null) {
            return Optional.empty();
        }
        var normalized = code.toUpperCase(Locale.ROOT);
        return WELL_KNOWN.stream()
                .filter(currency -> currency.code().equals(normalized))
                .findFirst();
    }

    public static List<Currency> wellKnown() {
        return WELL_KNOWN;
    }

    public static boolean isSupportedPrecision(int decimalPlaces) {
        return decimalPlaces >= 0 && decimalPlaces <= MAX_DECIMAL_PLACES;
    }

    private static MoneyResult<Currency> invalid(String reason) {
        return MoneyResult.err(new MoneyError.InvalidCurrency(reason));
    }

    public int id() {
        return id;
    }

    public String code() {
        return code.value();
    }

    public AsciiKey codeKey() {
        return code;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name).map(AsciiKey::value);
    }

    public Optional<AsciiKey> nameKey() {
        return Optional.ofNullable(name);
    }

    public int decimalPlaces() {
        return decimalPlaces;
    }

    /**
     * Copy with a different precision; id, code and name are kept.
     */
    public MoneyResult<Currency> withDecimalPlaces(int decimalPlaces) {
        if (!isSupportedPrecision(decimalPlaces)) {
            return MoneyResult.err(new MoneyError.PrecisionOverflow(decimalPlaces, MAX_DECIMAL_PLACES));
        }
        return MoneyResult.ok(new Currency(id, code, name, decimalPlaces));
    }

    public boolean isSameCurrency(Currency other) {
        return code.equals(Ensure.notNull("other", other).code);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Currency other && code.equals(other.code);
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }

    @Override
    public String toString() {
        return code.value();
    }
}
