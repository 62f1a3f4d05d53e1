package com.amannmalik.finmoney.api.money.tests;

import com.amannmalik.finmoney.api.currency.Currency;
import com.amannmalik.finmoney.api.money.Money;
import com.amannmalik.finmoney.api.rounding.RoundingStrategy;
import com.amannmalik.finmoney.api.shared.MoneyError;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class TickTest {
    private static BigDecimal dec(String value) {
        return new BigDecimal(value);
    }

    private static Money usd(String amount) {
        return Money.of(dec(amount), Currency.USD);
    }

    private static void assertAmount(String expected, Money actual) {
        assertEquals(0, dec(expected).compareTo(actual.amount()), () -> "expected " + expected + " but was " + actual);
    }

    @Test
    void nearestTick() {
        var price = usd("10.567");
        assertAmount("10.50", price.toTickNearest(dec("0.25")).orElseThrow());
        assertAmount("10.60", price.toTickNearest(dec("0.10")).orElseThrow());
        assertAmount("10.57", price.toTickNearest(dec("0.01")).orElseThrow());
        assertEquals(dec("10.50"), price.toTickNearest(dec("0.25")).orElseThrow().amount());
    }

    @Test
    void directionalTicks() {
        var price = usd("10.567");
        assertAmount("10.50", price.toTickDown(dec("0.25")).orElseThrow());
        assertAmount("10.75", price.toTickUp(dec("0.25")).orElseThrow());
    }

    @Test
    void directionalTicksOnNegativeAmounts() {
        var price = usd("-10.567");
        assertAmount("-10.75", price.toTickDown(dec("0.25")).orElseThrow());
        assertAmount("-10.50", price.toTickUp(dec("0.25")).orElseThrow());
        assertAmount("-10.50", price.toTickNearest(dec("0.25")).orElseThrow());
    }

    @Test
    void directionalTicksKeepExactMultiples() {
        var price = usd("10.50");
        assertAmount("10.50", price.toTickDown(dec("0.25")).orElseThrow());
        assertAmount("10.50", price.toTickUp(dec("0.25")).orElseThrow());
    }

    @Test
    void tiesFollowTheStrategy() {
        var midpoint = usd("10.625");
        assertAmount("10.50", midpoint.toTick(dec("0.25"), RoundingStrategy.MIDPOINT_NEAREST_EVEN).orElseThrow());
        assertAmount("10.75", midpoint.toTick(dec("0.25"), RoundingStrategy.MIDPOINT_AWAY_FROM_ZERO).orElseThrow());
        assertAmount("10.50", midpoint.toTick(dec("0.25"), RoundingStrategy.MIDPOINT_TOWARD_ZERO).orElseThrow());
        assertAmount("10.50", midpoint.toTickNearest(dec("0.25")).orElseThrow());

        var upperTie = usd("10.875");
        assertAmount("11.00", upperTie.toTickNearest(dec("0.25")).orElseThrow());
    }

    @Test
    void powerOfTenTicks() {
        var price = usd("10.567");
        assertAmount("10.567", price.toTickNearest(dec("0.001")).orElseThrow());
        assertAmount("10.57", price.toTickNearest(dec("0.01")).orElseThrow());
        assertAmount("11", price.toTickNearest(dec("1")).orElseThrow());
        assertAmount("10.5", price.toTickDown(dec("0.1")).orElseThrow());
        assertAmount("10.6", price.toTickUp(dec("0.1")).orElseThrow());
    }

    @Test
    void powerOfTenDetection() {
        assertEquals(OptionalInt.of(3), Money.tickPowerOfTenPlaces(dec("0.001")));
        assertEquals(OptionalInt.of(2), Money.tickPowerOfTenPlaces(dec("0.01")));
        assertEquals(OptionalInt.of(1), Money.tickPowerOfTenPlaces(dec("0.1")));
        assertEquals(OptionalInt.of(0), Money.tickPowerOfTenPlaces(dec("1")));
        assertEquals(OptionalInt.empty(), Money.tickPowerOfTenPlaces(dec("0.25")));
        assertEquals(OptionalInt.empty(), Money.tickPowerOfTenPlaces(dec("0.33")));
        assertEquals(OptionalInt.empty(), Money.tickPowerOfTenPlaces(dec("5")));
        assertEquals(OptionalInt.empty(), Money.tickPowerOfTenPlaces(dec("0.10")));
    }

    @Test
    void largeTicksAndAmounts() {
        assertAmount("1200", usd("1234.56").toTickNearest(dec("100")).orElseThrow());
        assertAmount("1235", usd("1234.56").toTickUp(dec("5")).orElseThrow());
        assertAmount("999999.99", usd("999999.99").toTickNearest(dec("0.01")).orElseThrow());
    }

    @Test
    void tinyTicks() {
        assertAmount("10.123456789", usd("10.123456789").toTickNearest(dec("0.000000001")).orElseThrow());
        var eth = Money.of(dec("1.0000000000000000015"), Currency.ETH);
        assertAmount("1.000000000000000002", eth.toTickNearest(dec("0.000000000000000001")).orElseThrow());
    }

    @Test
    void ticksDoNotReRoundToCurrencyPrecision() {
        var snapped = usd("10.1234").toTickNearest(dec("0.005")).orElseThrow();
        assertEquals(dec("10.125"), snapped.amount());
        assertEquals(Currency.USD, snapped.currency());
    }

    @Test
    void nonPositiveTicksAreRejected() {
        var price = usd("10.50");
        for (var tick : new String[]{"0", "-0.25", "0.000"}) {
            var nearest = price.toTickNearest(dec(tick));
            assertInstanceOf(MoneyError.InvalidTickSize.class, nearest.error().orElseThrow(), tick);
            assertTrue(price.toTickDown(dec(tick)).isErr());
            assertTrue(price.toTickUp(dec(tick)).isErr());
        }
        assertTrue(price.toTickNearest(null).isErr());
    }

    @Test
    void zeroAmountSnapsToZero() {
        assertAmount("0", Money.zero(Currency.USD).toTickNearest(dec("0.25")).orElseThrow());
    }

    @Test
    void multipleOfTick() {
        var valid = usd("10.50");
        assertTrue(valid.isMultipleOfTick(dec("0.25")));
        assertTrue(valid.isMultipleOfTick(dec("0.50")));
        assertTrue(valid.isMultipleOfTick(dec("0.01")));
        assertFalse(valid.isMultipleOfTick(dec("0.33")));

        var invalid = usd("10.567");
        assertFalse(invalid.isMultipleOfTick(dec("0.25")));
        assertFalse(invalid.isMultipleOfTick(dec("0.10")));
        assertFalse(invalid.isMultipleOfTick(dec("0.01")));
    }

    @Test
    void multipleOfNonPositiveTickIsFalse() {
        var price = usd("10.50");
        assertFalse(price.isMultipleOfTick(dec("0")));
        assertFalse(price.isMultipleOfTick(dec("-0.25")));
        assertFalse(price.isMultipleOfTick(null));
    }

    @Test
    void zeroIsAMultipleOfEveryPositiveTick() {
        var zero = Money.zero(Currency.USD);
        assertTrue(zero.isMultipleOfTick(dec("0.25")));
        assertTrue(zero.isMultipleOfTick(dec("1")));
        assertTrue(zero.isMultipleOfTick(dec("100")));
    }
}
