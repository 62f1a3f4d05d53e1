package com.amannmalik.finmoney.cli;

import com.amannmalik.finmoney.api.currency.Currency;
import com.amannmalik.finmoney.api.money.Money;
import com.amannmalik.finmoney.api.shared.MoneyError;
import com.amannmalik.finmoney.api.shared.MoneyResult;
import com.amannmalik.finmoney.codec.MoneyJsonCodec;
import jakarta.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;

import java.math.BigDecimal;
import java.util.concurrent.Callable;

/**
 * Base for subcommands that evaluate one money operation and print its outcome. Successful
 * results go to stdout, {@link MoneyError}s go to stderr with exit code {@value #EXIT_MONEY_ERROR}.
 */
abstract class MoneyCommand implements Callable<Integer> {
    static final int EXIT_MONEY_ERROR = 1;

    private static final Logger LOG = LoggerFactory.getLogger(MoneyCommand.class);

    @CommandLine.Mixin
    CurrencyOptions currencyOptions;
    @CommandLine.Option(names = "--json", defaultValue = "false", description = "Print results and errors as JSON")
    boolean json;
    @CommandLine.Spec
    CommandSpec spec;

    private final MoneyJsonCodec codec = new MoneyJsonCodec();

    /// Evaluates the command against the resolved currency.
    abstract MoneyResult<Output> evaluate(Currency currency);

    @Override
    public final Integer call() {
        var name = spec.name();
        var result = currencyOptions.resolve().flatMap(this::evaluate);
        if (result.isErr()) {
            var error = result.error().orElseThrow();
            LOG.debug("{} failed with {}: {}", name, error.code(), error.message());
            printError(error);
            return EXIT_MONEY_ERROR;
        }
        var output = result.orElseThrow();
        LOG.debug("{} produced {}", name, output.text());
        spec.commandLine().getOut().println(json ? output.json() : output.text());
        spec.commandLine().getOut().flush();
        return 0;
    }

    private void printError(MoneyError error) {
        var err = spec.commandLine().getErr();
        err.println(json ? codec.toJson(error).toString() : "error: " + error.message());
        err.flush();
    }

    Output render(Money money) {
        return new Output(money.toString(), codec.toJson(money).toString());
    }

    static Output flag(String field, boolean value) {
        return new Output(Boolean.toString(value), Json.createObjectBuilder().add(field, value).build().toString());
    }

    static Output decimal(String field, BigDecimal value) {
        var text = value.toPlainString();
        return new Output(text, Json.createObjectBuilder().add(field, text).build().toString());
    }

    /// Rendered outcome in both output formats.
    record Output(String text, String json) {
    }
}
