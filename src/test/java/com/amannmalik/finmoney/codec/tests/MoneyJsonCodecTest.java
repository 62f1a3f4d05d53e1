package com.amannmalik.finmoney.codec.tests;

import com.amannmalik.finmoney.api.currency.Currency;
import com.amannmalik.finmoney.api.money.Money;
import com.amannmalik.finmoney.api.shared.MoneyError;
import com.amannmalik.finmoney.codec.JsonDecodingException;
import com.amannmalik.finmoney.codec.MoneyJsonCodec;
import jakarta.json.Json;
import jakarta.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.io.*;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class MoneyJsonCodecTest {
    private static InputStream jsonBytes(JsonObject object) {
        return new ByteArrayInputStream(object.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static JsonObject readJson(String json) {
        try (var reader = Json.createReader(new StringReader(json))) {
            return reader.readObject();
        }
    }

    private static JsonObject currency(String code, int decimalPlaces) {
        return Json.createObjectBuilder()
                .add("id", 9)
                .add("code", code)
                .add("decimal_places", decimalPlaces)
                .build();
    }

    @Test
    void writeProducesStringAmountAndCurrencyRecord() {
        var codec = new MoneyJsonCodec();
        var json = codec.toJson(Money.of(new BigDecimal("10.50"), Currency.USD));
        assertEquals("10.50", json.getString("amount"));
        var currency = json.getJsonObject("currency");
        assertEquals(1, currency.getInt("id"));
        assertEquals("USD", currency.getString("code"));
        assertEquals("US Dollar", currency.getString("name"));
        assertEquals(2, currency.getInt("decimal_places"));
    }

    @Test
    void absentNameIsOmitted() {
        var custom = Currency.of(12, "XAU", null, 4).orElseThrow();
        var json = new MoneyJsonCodec().toJson(Money.of(BigDecimal.ONE, custom));
        assertFalse(json.getJsonObject("currency").containsKey("name"));
    }

    @Test
    void roundTripPreservesEveryDigit() {
        var codec = new MoneyJsonCodec();
        var amounts = new String[]{"0", "-0.000000000000000001", "123456789012345678901234567890.123456789", "1E+3", "10.50"};
        for (var amount : amounts) {
            var original = Money.of(new BigDecimal(amount), Currency.ETH);
            var out = new ByteArrayOutputStream();
            codec.writeMoney(out, original);
            var decoded = codec.readMoney(new ByteArrayInputStream(out.toByteArray()));
            assertEquals(original, decoded);
            assertEquals(0, original.amount().compareTo(decoded.amount()));
            assertEquals(original.currency().id(), decoded.currency().id());
            assertEquals(original.currency().name(), decoded.currency().name());
            assertEquals(original.decimalPlaces(), decoded.decimalPlaces());
        }
    }

    @Test
    void readAcceptsNumericAmountsWithoutFloatLoss() {
        var money = new MoneyJsonCodec().readMoney(
                "{\"amount\":0.1000000000000000055511151231257827,\"currency\":{\"id\":1,\"code\":\"usd\",\"decimal_places\":2}}");
        assertEquals(new BigDecimal("0.1000000000000000055511151231257827"), money.amount());
        assertEquals(Currency.USD, money.currency());
        assertEquals(Optional.empty(), money.currency().name());
    }

    @Test
    void readRejectsMissingOrMalformedAmount() {
        var codec = new MoneyJsonCodec();
        var missing = Json.createObjectBuilder().add("currency", currency("USD", 2)).build();
        assertThrows(JsonDecodingException.class, () -> codec.readMoney(jsonBytes(missing)));

        var garbage = Json.createObjectBuilder().add("amount", "ten").add("currency", currency("USD", 2)).build();
        assertThrows(JsonDecodingException.class, () -> codec.readMoney(jsonBytes(garbage)));

        var bool = Json.createObjectBuilder().add("amount", true).add("currency", currency("USD", 2)).build();
        assertThrows(JsonDecodingException.class, () -> codec.readMoney(jsonBytes(bool)));
    }

    @Test
    void readRejectsInvalidCurrencies() {
        var codec = new MoneyJsonCodec();
        var tooPrecise = Json.createObjectBuilder().add("amount", "1").add("currency", currency("USD", 29)).build();
        var error = assertThrows(JsonDecodingException.class, () -> codec.readMoney(jsonBytes(tooPrecise)));
        assertTrue(error.getMessage().startsWith("Invalid currency"));

        var longCode = Json.createObjectBuilder().add("amount", "1").add("currency", currency("VERYLONGCURRENCYCODE", 2)).build();
        assertThrows(JsonDecodingException.class, () -> codec.readMoney(jsonBytes(longCode)));

        var noCurrency = Json.createObjectBuilder().add("amount", "1").build();
        assertThrows(JsonDecodingException.class, () -> codec.readMoney(jsonBytes(noCurrency)));
    }

    @Test
    void readRejectsMalformedJson() {
        assertThrows(JsonDecodingException.class, () -> new MoneyJsonCodec().readMoney("{\"amount\":"));
    }

    @Test
    void mismatchErrorsCarryBothCodes() {
        var codec = new MoneyJsonCodec();
        var out = new ByteArrayOutputStream();
        codec.writeError(out, new MoneyError.CurrencyMismatch(Currency.USD, Currency.EUR));
        var json = readJson(out.toString(StandardCharsets.UTF_8));
        assertEquals("money_error", json.getString("type"));
        assertEquals("currency_mismatch", json.getString("code"));
        assertEquals("USD", json.getString("expected"));
        assertEquals("EUR", json.getString("actual"));
        assertEquals("Currency mismatch: expected USD, got EUR", json.getString("message"));
    }

    @Test
    void writingLeavesCallerStreamOpen() {
        var codec = new MoneyJsonCodec();
        var out = new CloseTrackingStream();
        codec.writeMoney(out, Money.of(new BigDecimal("1.25"), Currency.USD));
        codec.writeError(out, new MoneyError.DivisionByZero());
        assertFalse(out.closed);
        var text = out.toString(StandardCharsets.UTF_8);
        assertTrue(text.startsWith("{\"amount\":\"1.25\""));
        assertTrue(text.endsWith("\"code\":\"division_by_zero\",\"message\":\"Division by zero\"}"));
    }

    @Test
    void otherErrorsHaveFlatStructure() {
        var json = new MoneyJsonCodec().toJson(new MoneyError.InvalidTickSize("tick MUST be > 0, got 0"));
        assertEquals("invalid_tick_size", json.getString("code"));
        assertFalse(json.containsKey("expected"));
    }

    private static final class CloseTrackingStream extends ByteArrayOutputStream {
        private boolean closed;

        @Override
        public void close() {
            closed = true;
        }
    }
}
