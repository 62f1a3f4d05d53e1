package com.amannmalik.finmoney.cli;

import com.amannmalik.finmoney.api.currency.Currency;
import com.amannmalik.finmoney.api.money.Money;
import com.amannmalik.finmoney.api.shared.MoneyResult;
import picocli.CommandLine;

import java.math.BigDecimal;

@CommandLine.Command(
        name = "tick",
        mixinStandardHelpOptions = true,
        description = "Snap an amount onto an exchange tick lattice, or check that it already is on one")
public final class TickCommand extends MoneyCommand {
    @CommandLine.Parameters(index = "0", description = "Amount to quantize")
    BigDecimal amount;
    @CommandLine.Option(names = {"-t", "--tick"}, required = true, description = "Tick size (> 0)")
    BigDecimal tick;
    @CommandLine.Option(
            names = {"-m", "--mode"},
            defaultValue = "NEAREST",
            description = "One of ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    Mode mode;
    @CommandLine.Option(names = "--check", defaultValue = "false", description = "Only report whether the amount is a multiple of the tick")
    boolean check;

    public TickCommand() {
    }

    @Override
    MoneyResult<Output> evaluate(Currency currency) {
        var money = Money.of(amount, currency);
        if (check) {
            return MoneyResult.ok(flag("multiple_of_tick", money.isMultipleOfTick(tick)));
        }
        var snapped = switch (mode) {
            case NEAREST -> money.toTickNearest(tick);
            case DOWN -> money.toTickDown(tick);
            case UP -> money.toTickUp(tick);
        };
        return snapped.map(this::render);
    }

    enum Mode {
        NEAREST,
        DOWN,
        UP
    }
}
