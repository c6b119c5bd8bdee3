package com.payments.engine.command;

import java.util.Locale;
import java.util.Optional;

public enum CommandType {
    DEPOSIT,
    WITHDRAWAL,
    DISPUTE,
    RESOLVE,
    CHARGEBACK;

    public boolean movesFunds() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    /**
     * Case-insensitive lookup of the CSV {@code type} column, e.g. " Deposit " -> DEPOSIT.
     */
    public static Optional<CommandType> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (CommandType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
