package com.payments.engine.domain;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * A deposit or withdrawal that has been applied to an account.
 *
 * The original fields never change; only the dispute status moves.
 */
@Getter
@ToString
public class HistoricalTransaction {

    private final long transactionId;
    private final TransactionKind kind;
    private final int clientId;
    private final BigDecimal amount;
    private TransactionStatus status;

    public HistoricalTransaction(long transactionId, TransactionKind kind, int clientId, BigDecimal amount) {
        this.transactionId = transactionId;
        this.kind = kind;
        this.clientId = clientId;
        this.amount = amount;
        this.status = TransactionStatus.NORMAL;
    }

    public boolean belongsTo(int clientId) {
        return this.clientId == clientId;
    }

    public boolean isUnderDispute() {
        return status == TransactionStatus.DISPUTED;
    }

    public boolean isChargedBack() {
        return status == TransactionStatus.CHARGED_BACK;
    }

    public void markDisputed() {
        status = TransactionStatus.DISPUTED;
    }

    public void markResolved() {
        status = TransactionStatus.NORMAL;
    }

    public void markChargedBack() {
        status = TransactionStatus.CHARGED_BACK;
    }
}
