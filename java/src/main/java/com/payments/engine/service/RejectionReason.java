package com.payments.engine.service;

public enum RejectionReason {
    INVALID_AMOUNT("amount must be greater than 0.0"),
    DUPLICATE("transaction already processed"),
    INSUFFICIENT_FUNDS("insufficient funds"),
    MISSING_ACCOUNT("missing account"),
    INVALID_TRANSACTION("invalid transaction"),
    DISPUTE_CHARGEBACK("transaction was charged back"),
    FROZEN_ACCOUNT("frozen account");

    private final String description;

    RejectionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
