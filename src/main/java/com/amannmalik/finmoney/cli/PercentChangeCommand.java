package com.amannmalik.finmoney.cli;

import com.amannmalik.finmoney.api.currency.Currency;
import com.amannmalik.finmoney.api.money.Money;
import com.amannmalik.finmoney.api.shared.MoneyResult;
import picocli.CommandLine;

import java.math.BigDecimal;

@CommandLine.Command(
        name = "percent-change",
        mixinStandardHelpOptions = true,
        description = "Percentage change from an initial amount to a current amount")
public final class PercentChangeCommand extends MoneyCommand {
    @CommandLine.Parameters(index = "0", description = "Initial amount")
    BigDecimal initial;
    @CommandLine.Parameters(index = "1", description = "Current amount")
    BigDecimal current;
    @CommandLine.Option(names = "--negative", defaultValue = "false", description = "Report a drop as a positive number")
    boolean negative;

    public PercentChangeCommand() {
    }

    @Override
    MoneyResult<Output> evaluate(Currency currency) {
        var from = Money.of(initial, currency);
        var to = Money.of(current, currency);
        var change = negative
                ? Money.negativePercentChange(from, to)
                : Money.percentChange(from, to);
        return change.map(value -> decimal("percent_change", value));
    }
}
