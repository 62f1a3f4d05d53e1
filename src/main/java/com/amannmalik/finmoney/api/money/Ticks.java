package com.amannmalik.finmoney.api.money;

import com.amannmalik.finmoney.api.rounding.RoundingStrategy;
import com.amannmalik.finmoney.api.shared.MoneyError;
import com.amannmalik.finmoney.api.shared.MoneyResult;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.OptionalInt;

/// Quantization of decimal amounts onto a tick lattice.
final class Ticks {
    private Ticks() {
    }

    static MoneyResult<BigDecimal> quantize(BigDecimal amount, BigDecimal tick, RoundingStrategy strategy) {
        if (tick == null || tick.signum() <= 0) {
            return MoneyResult.err(new MoneyError.InvalidTickSize("tick MUST be > 0, got " + tick));
        }
        var places = powerOfTenPlaces(tick);
        if (places.isPresent()) {
            return MoneyResult.ok(strategy.round(amount, places.getAsInt()));
        }
        var steps = amount.divide(tick, 0, strategy.roundingMode());
        return MoneyResult.ok(steps.multiply(tick));
    }

    static boolean isMultiple(BigDecimal amount, BigDecimal tick) {
        if (tick == null || tick.signum() <= 0) {
            return false;
        }
        return amount.remainder(tick).signum() == 0;
    }

    /**
     * Returns {@code n} when {@code tick} is written exactly as {@code 10^-n} (0.001, 0.1, 1),
     * which lets quantization reduce to rounding at {@code n} places.
     */
    static OptionalInt powerOfTenPlaces(BigDecimal tick) {
        if (tick.scale() >= 0 && BigInteger.ONE.equals(tick.unscaledValue())) {
            return OptionalInt.of(tick.scale());
        }
        return OptionalInt.empty();
    }
}
