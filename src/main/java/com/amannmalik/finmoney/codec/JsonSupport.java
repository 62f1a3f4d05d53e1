package com.amannmalik.finmoney.codec;

import jakarta.json.*;

import java.math.BigDecimal;

final class JsonSupport {
    private JsonSupport() {
    }

    static JsonObject requireObject(JsonObject parent, String key) {
        if (!parent.containsKey(key) || parent.isNull(key)) {
            throw new JsonDecodingException("Missing object: " + key);
        }
        var value = parent.get(key);
        if (value.getValueType() != JsonValue.ValueType.OBJECT) {
            throw new JsonDecodingException("Expected object at: " + key);
        }
        return value.asJsonObject();
    }

    static String requireString(JsonObject parent, String key) {
        if (!parent.containsKey(key) || parent.isNull(key)) {
            throw new JsonDecodingException("Missing string: " + key);
        }
        var value = parent.get(key);
        if (value.getValueType() != JsonValue.ValueType.STRING) {
            throw new JsonDecodingException("Expected string at: " + key);
        }
        var string = ((JsonString) value).getString();
        if (string.isBlank()) {
            throw new JsonDecodingException("String MUST be non-blank: " + key);
        }
        return string;
    }

    static String optionalString(JsonObject parent, String key) {
        if (!parent.containsKey(key) || parent.isNull(key)) {
            return null;
        }
        var value = parent.get(key);
        if (value.getValueType() != JsonValue.ValueType.STRING) {
            throw new JsonDecodingException("Expected string at: " + key);
        }
        var string = ((JsonString) value).getString();
        if (string.isBlank()) {
            throw new JsonDecodingException("String MUST be non-blank: " + key);
        }
        return string;
    }

    static int requireInt(JsonObject parent, String key) {
        if (!parent.containsKey(key) || parent.isNull(key)) {
            throw new JsonDecodingException("Missing integer: " + key);
        }
        var value = parent.get(key);
        if (!(value instanceof JsonNumber number)) {
            throw new JsonDecodingException("Expected integer at: " + key);
        }
        try {
            return number.intValueExact();
        } catch (ArithmeticException e) {
            throw new JsonDecodingException("Expected integer at: " + key, e);
        }
    }

    /// Accepts a decimal string or a JSON number; both are read without a binary float step.
    static BigDecimal requireDecimal(JsonObject parent, String key) {
        if (!parent.containsKey(key) || parent.isNull(key)) {
            throw new JsonDecodingException("Missing decimal: " + key);
        }
        var value = parent.get(key);
        if (value instanceof JsonNumber number) {
            return number.bigDecimalValue();
        }
        if (value.getValueType() != JsonValue.ValueType.STRING) {
            throw new JsonDecodingException("Expected decimal at: " + key);
        }
        var text = ((JsonString) value).getString().trim();
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new JsonDecodingException("Expected decimal at: " + key + ", got '" + text + "'", e);
        }
    }
}
