package com.amannmalik.finmoney.api.money;

import com.amannmalik.finmoney.api.currency.Currency;
import com.amannmalik.finmoney.api.rounding.RoundingStrategy;
import com.amannmalik.finmoney.api.shared.MoneyError;
import com.amannmalik.finmoney.api.shared.MoneyResult;
import com.amannmalik.finmoney.util.Ensure;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.OptionalInt;

/**
 * An exact decimal amount bound to a {@link Currency}.
 *
 * <p>Instances are immutable. Operations between two values check that both share the same
 * currency code before computing and report {@link MoneyError.CurrencyMismatch} otherwise.
 * Nothing rounds implicitly except division, which rounds to the currency's decimal places
 * with the caller's strategy.
 *
 * <p>Equality is numeric: {@code 10.5 USD} equals {@code 10.50 USD}.
 */
public final class Money {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final MathContext QUOTIENT_CONTEXT = MathContext.DECIMAL128;

    private final BigDecimal amount;
    private final Currency currency;

    private Money(BigDecimal amount, Currency currency) {
        this.amount = amount;
        this.currency = currency;
    }

    public static Money of(BigDecimal amount, Currency currency) {
        return new Money(Ensure.notNull("amount", amount), Ensure.notNull("currency", currency));
    }

    /**
     * @throws NumberFormatException if {@code amount} is not a decimal literal
     */
    public static Money of(String amount, Currency currency) {
        return of(new BigDecimal(Ensure.nonBlank("amount", amount).trim()), currency);
    }

    public static Money zero(Currency currency) {
        return of(BigDecimal.ZERO, currency);
    }

    /// Rounds {@code amount} to the currency's decimal places before binding it.
    public static Money ofRounded(BigDecimal amount, Currency currency, RoundingStrategy strategy) {
        Ensure.notNull("currency", currency);
        return of(Ensure.notNull("strategy", strategy).round(amount, currency.decimalPlaces()), currency);
    }

    public static MoneyResult<BigDecimal> percentChange(Money initial, Money current) {
        return Ensure.notNull("current", current).percentChangeFrom(initial);
    }

    public static MoneyResult<BigDecimal> negativePercentChange(Money initial, Money current) {
        return Ensure.notNull("current", current).negativePercentChangeFrom(initial);
    }

    /// See {@link #toTick(BigDecimal, RoundingStrategy)} for the fast path this detects.
    public static OptionalInt tickPowerOfTenPlaces(BigDecimal tick) {
        return Ticks.powerOfTenPlaces(Ensure.notNull("tick", tick));
    }

    public BigDecimal amount() {
        return amount;
    }

    public Currency currency() {
        return currency;
    }

    public String currencyCode() {
        return currency.code();
    }

    public int currencyId() {
        return currency.id();
    }

    public int decimalPlaces() {
        return currency.decimalPlaces();
    }

    private MoneyResult<Money> withAmount(BigDecimal value) {
        return MoneyResult.ok(new Money(value, currency));
    }

    private MoneyError mismatch(Money other) {
        Ensure.notNull("other", other);
        if (currency.isSameCurrency(other.currency)) {
            return null;
        }
        return new MoneyError.CurrencyMismatch(currency, other.currency);
    }

    // arithmetic

    public MoneyResult<Money> add(Money other) {
        var error = mismatch(other);
        return error != null ? MoneyResult.err(error) : withAmount(amount.add(other.amount));
    }

    public MoneyResult<Money> subtract(Money other) {
        var error = mismatch(other);
        return error != null ? MoneyResult.err(error) : withAmount(amount.subtract(other.amount));
    }

    public Money addDecimal(BigDecimal value) {
        return new Money(amount.add(Ensure.notNull("value", value)), currency);
    }

    public Money subtractDecimal(BigDecimal value) {
        return new Money(amount.subtract(Ensure.notNull("value", value)), currency);
    }

    public Money multiplyByDecimal(BigDecimal scalar) {
        return new Money(amount.multiply(Ensure.notNull("scalar", scalar)), currency);
    }

    public MoneyResult<Money> multiplyByMoney(Money other) {
        var error = mismatch(other);
        return error != null ? MoneyResult.err(error) : withAmount(amount.multiply(other.amount));
    }

    /**
     * Divides by {@code scalar} and rounds the quotient to the currency's decimal places.
     */
    public MoneyResult<Money> divideByDecimal(BigDecimal scalar, RoundingStrategy strategy) {
        Ensure.notNull("strategy", strategy);
        if (Ensure.notNull("scalar", scalar).signum() == 0) {
            return MoneyResult.err(new MoneyError.DivisionByZero());
        }
        return withAmount(strategy.divide(amount, scalar, currency.decimalPlaces()));
    }

    public MoneyResult<Money> divideByMoney(Money other, RoundingStrategy strategy) {
        var error = mismatch(other);
        if (error != null) {
            return MoneyResult.err(error);
        }
        return divideByDecimal(other.amount, strategy);
    }

    // comparison

    public MoneyResult<Integer> compareTo(Money other) {
        var error = mismatch(other);
        return error != null ? MoneyResult.err(error) : MoneyResult.ok(amount.compareTo(other.amount));
    }

    public MoneyResult<Boolean> isGreaterThan(Money other) {
        return compareTo(other).map(c -> c > 0);
    }

    public MoneyResult<Boolean> isGreaterThanOrEqual(Money other) {
        return compareTo(other).map(c -> c >= 0);
    }

    public MoneyResult<Boolean> isLessThan(Money other) {
        return compareTo(other).map(c -> c < 0);
    }

    public MoneyResult<Boolean> isLessThanOrEqual(Money other) {
        return compareTo(other).map(c -> c <= 0);
    }

    public boolean isGreaterThanDecimal(BigDecimal value) {
        return amount.compareTo(Ensure.notNull("value", value)) > 0;
    }

    public boolean isGreaterThanOrEqualDecimal(BigDecimal value) {
        return amount.compareTo(Ensure.notNull("value", value)) >= 0;
    }

    public boolean isLessThanDecimal(BigDecimal value) {
        return amount.compareTo(Ensure.notNull("value", value)) < 0;
    }

    public boolean isLessThanOrEqualDecimal(BigDecimal value) {
        return amount.compareTo(Ensure.notNull("value", value)) <= 0;
    }

    /// The smaller of the two; the receiver wins a tie.
    public MoneyResult<Money> min(Money other) {
        return compareTo(other).map(c -> c <= 0 ? this : other);
    }

    /// The larger of the two; the receiver wins a tie.
    public MoneyResult<Money> max(Money other) {
        return compareTo(other).map(c -> c >= 0 ? this : other);
    }

    public boolean isSameCurrency(Money other) {
        return currency.isSameCurrency(Ensure.notNull("other", other).currency);
    }

    public boolean isEqualTo(Money other) {
        return equals(other);
    }

    // percentages

    /**
     * {@code (this - initial) * 100 / initial}. A terminating quotient is returned exactly,
     * whatever its length; only a non-terminating one is cut to 34 significant digits.
     */
    public MoneyResult<BigDecimal> percentChangeFrom(Money initial) {
        var error = mismatch(initial);
        if (error != null) {
            return MoneyResult.err(error);
        }
        if (initial.amount.signum() == 0) {
            return MoneyResult.err(new MoneyError.DivisionByZero());
        }
        var delta = amount.subtract(initial.amount).multiply(HUNDRED);
        try {
            return MoneyResult.ok(delta.divide(initial.amount));
        } catch (ArithmeticException nonTerminating) {
            return MoneyResult.ok(delta.divide(initial.amount, QUOTIENT_CONTEXT));
        }
    }

    /// {@code (initial - this) * 100 / initial}: a drop reads as a positive number.
    public MoneyResult<BigDecimal> negativePercentChangeFrom(Money initial) {
        return percentChangeFrom(initial).map(BigDecimal::negate);
    }

    // predicates

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    public boolean isPositiveOrZero() {
        return amount.signum() >= 0;
    }

    public boolean isNegativeOrZero() {
        return amount.signum() <= 0;
    }

    public boolean isInteger() {
        return amount.signum() == 0 || amount.stripTrailingZeros().scale() <= 0;
    }

    public boolean hasFraction() {
        return !isInteger();
    }

    // unary transforms

    public Money abs() {
        return new Money(amount.abs(), currency);
    }

    public Money negated() {
        return new Money(amount.negate(), currency);
    }

    /// Rounds toward negative infinity at the currency's smallest unit, not to an integer.
    public Money floor() {
        return rounded(RoundingStrategy.FLOOR);
    }

    /// Rounds toward positive infinity at the currency's smallest unit, not to an integer.
    public Money ceil() {
        return rounded(RoundingStrategy.CEILING);
    }

    /// Drops digits below the currency's smallest unit.
    public Money trunc() {
        return rounded(RoundingStrategy.TOWARD_ZERO);
    }

    /// Same value without trailing zeros.
    public Money normalize() {
        return new Money(amount.signum() == 0 ? BigDecimal.ZERO : amount.stripTrailingZeros(), currency);
    }

    /**
     * Square root rounded to the currency's decimal places with banker's rounding.
     */
    public MoneyResult<Money> sqrt() {
        if (amount.signum() < 0) {
            return MoneyResult.err(new MoneyError.InvalidAmount("square root of negative amount " + amount.toPlainString()));
        }
        var root = amount.sqrt(QUOTIENT_CONTEXT);
        return withAmount(RoundingStrategy.defaultStrategy().round(root, currency.decimalPlaces()));
    }

    // precision

    public Money rounded(RoundingStrategy strategy) {
        return round(currency.decimalPlaces(), strategy);
    }

    public Money round(int places) {
        return round(places, RoundingStrategy.defaultStrategy());
    }

    public Money round(int places, RoundingStrategy strategy) {
        return new Money(Ensure.notNull("strategy", strategy).round(amount, places), currency);
    }

    /**
     * Moves this value to a currency with {@code places} decimal places, rounding the amount
     * with banker's rounding.
     */
    public MoneyResult<Money> rescale(int places) {
        return currency.withDecimalPlaces(places)
                .map(scaled -> new Money(RoundingStrategy.defaultStrategy().round(amount, places), scaled));
    }

    // ticks

    /**
     * Snaps the amount onto the lattice of multiples of {@code tick}: the quotient
     * {@code amount / tick} is rounded to an integer with {@code strategy} and multiplied back.
     * A tick written as {@code 10^-n} (0.01, 1) reduces to rounding at {@code n} places.
     * The result is not re-rounded to the currency's decimal places.
     */
    public MoneyResult<Money> toTick(BigDecimal tick, RoundingStrategy strategy) {
        Ensure.notNull("strategy", strategy);
        return Ticks.quantize(amount, tick, strategy).map(value -> new Money(value, currency));
    }

    public MoneyResult<Money> toTickNearest(BigDecimal tick) {
        return toTick(tick, RoundingStrategy.MIDPOINT_NEAREST_EVEN);
    }

    public MoneyResult<Money> toTickDown(BigDecimal tick) {
        return toTick(tick, RoundingStrategy.FLOOR);
    }

    public MoneyResult<Money> toTickUp(BigDecimal tick) {
        return toTick(tick, RoundingStrategy.CEILING);
    }

    /// Exact remainder check; a non-positive tick is never satisfied.
    public boolean isMultipleOfTick(BigDecimal tick) {
        return Ticks.isMultiple(amount, tick);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Money other
                && currency.equals(other.currency)
                && amount.compareTo(other.amount) == 0;
    }

    @Override
    public int hashCode() {
        var normalized = amount.signum() == 0 ? BigDecimal.ZERO : amount.stripTrailingZeros();
        return 31 * currency.hashCode() + normalized.hashCode();
    }

    /**
     * {@code "<amount> <code>"}, with the amount padded to the currency's decimal places.
     * Digits beyond the currency's precision are shown, never dropped.
     */
    @Override
    public String toString() {
        var shown = amount.scale() < currency.decimalPlaces()
                ? amount.setScale(currency.decimalPlaces())
                : amount;
        return shown.toPlainString() + " " + currency.code();
    }
}
