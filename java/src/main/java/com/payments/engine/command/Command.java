package com.payments.engine.command;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * One input operation, consumed by a single {@code LedgerEngine.apply} call.
 *
 * Deposits and withdrawals are {@link FundsCommand}s and carry an amount; disputes,
 * resolves and chargebacks are {@link ReferenceCommand}s that point at an earlier
 * transaction id.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class Command {

    private final CommandType type;
    private final int clientId;
    private final long transactionId;

    protected Command(CommandType type, int clientId, long transactionId) {
        this.type = type;
        this.clientId = clientId;
        this.transactionId = transactionId;
    }

    public static FundsCommand deposit(int clientId, long transactionId, BigDecimal amount) {
        return new FundsCommand(CommandType.DEPOSIT, clientId, transactionId, amount);
    }

    public static FundsCommand withdrawal(int clientId, long transactionId, BigDecimal amount) {
        return new FundsCommand(CommandType.WITHDRAWAL, clientId, transactionId, amount);
    }

    public static ReferenceCommand dispute(int clientId, long transactionId) {
        return new ReferenceCommand(CommandType.DISPUTE, clientId, transactionId);
    }

    public static ReferenceCommand resolve(int clientId, long transactionId) {
        return new ReferenceCommand(CommandType.RESOLVE, clientId, transactionId);
    }

    public static ReferenceCommand chargeback(int clientId, long transactionId) {
        return new ReferenceCommand(CommandType.CHARGEBACK, clientId, transactionId);
    }
}
