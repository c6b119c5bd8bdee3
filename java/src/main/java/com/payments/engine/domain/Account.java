package com.payments.engine.domain;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Balances of a single client.
 *
 * available and held are allowed to go negative: a dispute against funds that were
 * already withdrawn, or a chargeback after a withdrawal, is recorded as is.
 */
@Getter
@ToString
public class Account {

    private static final BigDecimal OPENING_BALANCE = new BigDecimal("0.0");

    private final int clientId;
    private BigDecimal available;
    private BigDecimal held;
    private boolean locked;

    public Account(int clientId) {
        this.clientId = clientId;
        this.available = OPENING_BALANCE;
        this.held = OPENING_BALANCE;
        this.locked = false;
    }

    public BigDecimal getTotal() {
        return available.add(held);
    }

    public void credit(BigDecimal amount) {
        available = available.add(amount);
    }

    public void debit(BigDecimal amount) {
        available = available.subtract(amount);
    }

    /**
     * Move {@code amount} from available to held. A negative amount moves funds the other way.
     */
    public void hold(BigDecimal amount) {
        available = available.subtract(amount);
        held = held.add(amount);
    }

    public void release(BigDecimal amount) {
        hold(amount.negate());
    }

    public void removeHeld(BigDecimal amount) {
        held = held.subtract(amount);
    }

    // once locked, never unlocked
    public void lock() {
        locked = true;
    }
}
