package com.amannmalik.finmoney.cli;

import com.amannmalik.finmoney.api.currency.Currency;
import com.amannmalik.finmoney.api.shared.MoneyError;
import com.amannmalik.finmoney.api.shared.MoneyResult;
import picocli.CommandLine;

/// Currency selection shared by every subcommand.
public final class CurrencyOptions {
    @CommandLine.Option(
            names = {"-c", "--currency"},
            defaultValue = "USD",
            description = "Currency code (default: ${DEFAULT-VALUE}). Codes other than the built-in ones need --decimal-places.")
    String code;
    @CommandLine.Option(
            names = "--decimal-places",
            description = "Override the currency precision, or define it for a custom code (0..28)")
    Integer decimalPlaces;

    public CurrencyOptions() {
    }

    MoneyResult<Currency> resolve() {
        var wellKnown = Currency.wellKnown(code);
        if (wellKnown.isPresent()) {
            return decimalPlaces == null
                    ? MoneyResult.ok(wellKnown.get())
                    : wellKnown.get().withDecimalPlaces(decimalPlaces);
        }
        if (decimalPlaces == null) {
            return MoneyResult.err(new MoneyError.InvalidCurrency(
                    "unknown code '" + code + "' requires --decimal-places"));
        }
        return Currency.of(0, code, null, decimalPlaces);
    }
}
