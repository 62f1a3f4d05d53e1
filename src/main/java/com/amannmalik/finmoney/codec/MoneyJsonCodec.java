package com.amannmalik.finmoney.codec;

import com.amannmalik.finmoney.api.currency.Currency;
import com.amannmalik.finmoney.api.money.Money;
import com.amannmalik.finmoney.api.shared.MoneyError;
import jakarta.json.*;

import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringReader;

/// Wire form: {"amount":"10.50","currency":{"id":1,"code":"USD","name":"US Dollar","decimal_places":2}}
///
/// The amount always travels as a plain decimal string so that no reader parses it through a
/// binary float.
public final class MoneyJsonCodec {
    public MoneyJsonCodec() {
    }

    private static JsonObject readObject(JsonReader reader) {
        try (reader) {
            return reader.readObject();
        } catch (JsonException e) {
            throw new JsonDecodingException("Malformed JSON: " + e.getMessage(), e);
        }
    }

    private static Currency mapCurrency(JsonObject object) {
        var result = Currency.of(
                JsonSupport.requireInt(object, "id"),
                JsonSupport.requireString(object, "code"),
                JsonSupport.optionalString(object, "name"),
                JsonSupport.requireInt(object, "decimal_places"));
        var error = result.error();
        if (error.isPresent()) {
            throw new JsonDecodingException(error.get().message());
        }
        return result.orElseThrow();
    }

    private static JsonObjectBuilder writeCurrency(Currency currency) {
        var builder = Json.createObjectBuilder()
                .add("id", currency.id())
                .add("code", currency.code());
        currency.name().ifPresent(name -> builder.add("name", name));
        return builder.add("decimal_places", currency.decimalPlaces());
    }

    public Money readMoney(InputStream body) {
        return fromJson(readObject(Json.createReader(body)));
    }

    public Money readMoney(String json) {
        return fromJson(readObject(Json.createReader(new StringReader(json))));
    }

    public Money fromJson(JsonObject object) {
        var amount = JsonSupport.requireDecimal(object, "amount");
        var currency = mapCurrency(JsonSupport.requireObject(object, "currency"));
        return Money.of(amount, currency);
    }

    public JsonObject toJson(Money money) {
        return Json.createObjectBuilder()
                .add("amount", money.amount().toPlainString())
                .add("currency", writeCurrency(money.currency()))
                .build();
    }

    public JsonObject toJson(MoneyError error) {
        return ErrorJson.build(error).build();
    }

    public void writeMoney(OutputStream outputStream, Money money) {
        ErrorJson.writeObject(Json.createObjectBuilder(toJson(money)), outputStream);
    }

    public void writeError(OutputStream outputStream, MoneyError error) {
        ErrorJson.write(outputStream, error);
    }
}
