package com.payments.engine.service;

import java.util.Optional;

/**
 * Outcome of {@link LedgerEngine#apply}. A rejection is an expected outcome, not an error:
 * the engine state is unchanged and the caller moves on to the next command.
 */
public class ApplyResult {

    private static final ApplyResult APPLIED = new ApplyResult(null, null);

    private final RejectionReason reason;
    private final Long transactionId;

    private ApplyResult(RejectionReason reason, Long transactionId) {
        this.reason = reason;
        this.transactionId = transactionId;
    }

    public static ApplyResult applied() {
        return APPLIED;
    }

    public static ApplyResult rejected(RejectionReason reason) {
        return new ApplyResult(reason, null);
    }

    public static ApplyResult rejected(RejectionReason reason, long transactionId) {
        return new ApplyResult(reason, transactionId);
    }

    public boolean isApplied() {
        return reason == null;
    }

    public Optional<RejectionReason> getReason() {
        return Optional.ofNullable(reason);
    }

    /**
     * The transaction id named by the rejection, for reasons that refer to one
     * (duplicate, invalid transaction, dispute of a chargeback).
     */
    public Optional<Long> getTransactionId() {
        return Optional.ofNullable(transactionId);
    }

    @Override
    public String toString() {
        if (isApplied()) {
            return "applied";
        }
        return transactionId == null
                ? reason.getDescription()
                : reason.getDescription() + " (tx " + transactionId + ")";
    }
}
