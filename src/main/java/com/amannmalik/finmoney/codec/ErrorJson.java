package com.amannmalik.finmoney.codec;

import com.amannmalik.finmoney.api.shared.MoneyError;
import jakarta.json.Json;
import jakarta.json.JsonObjectBuilder;

import java.io.*;
import java.nio.charset.StandardCharsets;

final class ErrorJson {
    private ErrorJson() {
    }

    static void write(OutputStream outputStream, MoneyError error) {
        writeObject(build(error), outputStream);
    }

    static JsonObjectBuilder build(MoneyError error) {
        var builder = Json.createObjectBuilder()
                .add("type", "money_error")
                .add("code", error.code())
                .add("message", error.message());
        if (error instanceof MoneyError.CurrencyMismatch mismatch) {
            builder.add("expected", mismatch.expected().code())
                    .add("actual", mismatch.actual().code());
        }
        return builder;
    }

    /// Writes and flushes; the stream stays open for the caller.
    static void writeObject(JsonObjectBuilder builder, OutputStream stream) {
        Writer writer = new OutputStreamWriter(stream, StandardCharsets.UTF_8);
        Json.createWriter(writer).write(builder.build());
        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
