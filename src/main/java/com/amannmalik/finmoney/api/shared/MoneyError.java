package com.amannmalik.finmoney.api.shared;

import com.amannmalik.finmoney.api.currency.Currency;
import com.amannmalik.finmoney.util.Ensure;

/**
 * Failure value returned by fallible money operations. Errors are plain data: they carry
 * enough context to be reported or serialized and never escape as exceptions unless a caller
 * opts in through {@link MoneyResult#orElseThrow()}.
 */
public sealed interface MoneyError permits
        MoneyError.CurrencyMismatch,
        MoneyError.DivisionByZero,
        MoneyError.InvalidCurrency,
        MoneyError.InvalidTickSize,
        MoneyError.PrecisionOverflow,
        MoneyError.InvalidAmount {

    /// Stable snake_case identifier, used by the JSON codec and the CLI.
    String code();

    String message();

    record CurrencyMismatch(Currency expected, Currency actual) implements MoneyError {
        public CurrencyMismatch {
            expected = Ensure.notNull("currency_mismatch.expected", expected);
            actual = Ensure.notNull("currency_mismatch.actual", actual);
        }

        @Override
        public String code() {
            return "currency_mismatch";
        }

        @Override
        public String message() {
            return "Currency mismatch: expected " + expected.code() + ", got " + actual.code();
        }
    }

    record DivisionByZero() implements MoneyError {
        @Override
        public String code() {
            return "division_by_zero";
        }

        @Override
        public String message() {
            return "Division by zero";
        }
    }

    record InvalidCurrency(String reason) implements MoneyError {
        public InvalidCurrency {
            reason = Ensure.nonBlank("invalid_currency.reason", reason);
        }

        @Override
        public String code() {
            return "invalid_currency";
        }

        @Override
        public String message() {
            return "Invalid currency: " + reason;
        }
    }

    record InvalidTickSize(String reason) implements MoneyError {
        public InvalidTickSize {
            reason = Ensure.nonBlank("invalid_tick_size.reason", reason);
        }

        @Override
        public String code() {
            return "invalid_tick_size";
        }

        @Override
        public String message() {
            return "Invalid tick size: " + reason;
        }
    }

    record PrecisionOverflow(int requested, int maximum) implements MoneyError {
        @Override
        public String code() {
            return "precision_overflow";
        }

        @Override
        public String message() {
            return "Precision " + requested + " is outside 0.." + maximum;
        }
    }

    record InvalidAmount(String reason) implements MoneyError {
        public InvalidAmount {
            reason = Ensure.nonBlank("invalid_amount.reason", reason);
        }

        @Override
        public String code() {
            return "invalid_amount";
        }

        @Override
        public String message() {
            return "Invalid amount: " + reason;
        }
    }
}
