package com.payments.engine.command;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Dispute, resolve or chargeback of a previously recorded deposit or withdrawal.
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class ReferenceCommand extends Command {

    ReferenceCommand(CommandType type, int clientId, long transactionId) {
        super(type, clientId, transactionId);
        if (type.movesFunds()) {
            throw new IllegalArgumentException(type + " requires an amount");
        }
    }
}
