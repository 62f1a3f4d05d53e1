package com.amannmalik.finmoney.cli;

import com.amannmalik.finmoney.api.currency.Currency;
import com.amannmalik.finmoney.api.money.Money;
import com.amannmalik.finmoney.api.rounding.RoundingStrategy;
import com.amannmalik.finmoney.api.shared.MoneyError;
import com.amannmalik.finmoney.api.shared.MoneyResult;
import picocli.CommandLine;

import java.math.BigDecimal;

@CommandLine.Command(
        name = "round",
        mixinStandardHelpOptions = true,
        description = "Round an amount with a rounding strategy")
public final class RoundCommand extends MoneyCommand {
    @CommandLine.Parameters(index = "0", description = "Amount to round")
    BigDecimal amount;
    @CommandLine.Option(
            names = {"-p", "--places"},
            description = "Fractional digits to keep (default: the currency's decimal places)")
    Integer places;
    @CommandLine.Option(
            names = {"-s", "--strategy"},
            defaultValue = "MIDPOINT_NEAREST_EVEN",
            description = "One of ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    RoundingStrategy strategy;

    public RoundCommand() {
    }

    @Override
    MoneyResult<Output> evaluate(Currency currency) {
        var money = Money.of(amount, currency);
        if (places == null) {
            return MoneyResult.ok(render(money.rounded(strategy)));
        }
        if (!Currency.isSupportedPrecision(places)) {
            return MoneyResult.err(new MoneyError.PrecisionOverflow(places, Currency.MAX_DECIMAL_PLACES));
        }
        return MoneyResult.ok(render(money.round(places, strategy)));
    }
}
