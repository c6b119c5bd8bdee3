package com.payments.engine.command;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class FundsCommand extends Command {

    private final BigDecimal amount;

    FundsCommand(CommandType type, int clientId, long transactionId, BigDecimal amount) {
        super(type, clientId, transactionId);
        if (!type.movesFunds()) {
            throw new IllegalArgumentException(type + " does not carry an amount");
        }
        this.amount = Objects.requireNonNull(amount, "amount");
    }
}
