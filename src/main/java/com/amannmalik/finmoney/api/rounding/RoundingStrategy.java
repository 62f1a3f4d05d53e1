package com.amannmalik.finmoney.api.rounding;

import com.amannmalik.finmoney.util.Ensure;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding policies for reducing the number of fractional digits of a decimal.
 *
 * <p>The three midpoint strategies round to the nearest representable value and differ only
 * when the discarded part is exactly half a unit. The remaining strategies are directional and
 * ignore midpoints.
 */
public enum RoundingStrategy {
    /// Ties go to the neighbour with an even last digit: 6.5 to 6, 7.5 to 8, -6.5 to -6.
    MIDPOINT_NEAREST_EVEN(RoundingMode.HALF_EVEN),
    /// Ties go away from zero: 6.5 to 7, -6.5 to -7.
    MIDPOINT_AWAY_FROM_ZERO(RoundingMode.HALF_UP),
    /// Ties go toward zero: 6.5 to 6, -6.5 to -6.
    MIDPOINT_TOWARD_ZERO(RoundingMode.HALF_DOWN),
    /// Truncation: 6.8 to 6, -6.8 to -6.
    TOWARD_ZERO(RoundingMode.DOWN),
    /// 6.2 to 7, -6.2 to -7.
    AWAY_FROM_ZERO(RoundingMode.UP),
    /// Toward negative infinity: 6.8 to 6, -6.2 to -7.
    FLOOR(RoundingMode.FLOOR),
    /// Toward positive infinity: 6.2 to 7, -6.8 to -6.
    CEILING(RoundingMode.CEILING);

    private final RoundingMode roundingMode;

    RoundingStrategy(RoundingMode roundingMode) {
        this.roundingMode = roundingMode;
    }

    /**
     * Banker's rounding, the default for aggregated financial totals.
     */
    public static RoundingStrategy defaultStrategy() {
        return MIDPOINT_NEAREST_EVEN;
    }

    public RoundingMode roundingMode() {
        return roundingMode;
    }

    /**
     * Rounds {@code value} to at most {@code places} fractional digits. A value that already
     * fits is returned unchanged, so asking for more places than the value carries is a no-op.
     *
     * @throws IllegalArgumentException if {@code places} is negative
     */
    public BigDecimal round(BigDecimal value, int places) {
        Ensure.notNull("value", value);
        Ensure.nonNegative("places", places);
        if (value.scale() <= places) {
            return value;
        }
        return value.setScale(places, roundingMode);
    }

    /**
     * Quotient of {@code dividend / divisor} at exactly {@code places} fractional digits,
     * rounded once from the exact quotient.
     *
     * @throws ArithmeticException if {@code divisor} is zero
     */
    public BigDecimal divide(BigDecimal dividend, BigDecimal divisor, int places) {
        Ensure.notNull("dividend", dividend);
        Ensure.notNull("divisor", divisor);
        Ensure.nonNegative("places", places);
        return dividend.divide(divisor, places, roundingMode);
    }
}
