package com.amannmalik.finmoney.cli;

import com.amannmalik.finmoney.api.currency.Currency;
import com.amannmalik.finmoney.api.money.Money;
import com.amannmalik.finmoney.api.rounding.RoundingStrategy;
import com.amannmalik.finmoney.api.shared.MoneyResult;
import picocli.CommandLine;

import java.math.BigDecimal;

@CommandLine.Command(
        name = "divide",
        mixinStandardHelpOptions = true,
        description = "Divide an amount by a scalar, rounding to the currency's decimal places")
public final class DivideCommand extends MoneyCommand {
    @CommandLine.Parameters(index = "0", description = "Dividend amount")
    BigDecimal amount;
    @CommandLine.Parameters(index = "1", description = "Divisor")
    BigDecimal divisor;
    @CommandLine.Option(
            names = {"-s", "--strategy"},
            defaultValue = "MIDPOINT_NEAREST_EVEN",
            description = "One of ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    RoundingStrategy strategy;

    public DivideCommand() {
    }

    @Override
    MoneyResult<Output> evaluate(Currency currency) {
        return Money.of(amount, currency)
                .divideByDecimal(divisor, strategy)
                .map(this::render);
    }
}
