package com.payments.engine.domain;

import java.math.BigDecimal;

public enum TransactionKind {
    DEPOSIT,
    WITHDRAWAL;

    /**
     * The amount a dispute moves from available into held for a transaction of this kind.
     * Disputing a withdrawal pulls the withdrawn funds back, so the hold is negative.
     */
    public BigDecimal disputedAmount(BigDecimal amount) {
        return this == DEPOSIT ? amount : amount.negate();
    }
}
