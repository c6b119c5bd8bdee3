package com.payments.engine.exception;

import com.payments.engine.service.RejectionReason;

/**
 * Thrown when a parsed input record cannot become a command, e.g. a deposit without an amount.
 * The record is skipped; processing continues with the next one.
 */
public class InvalidRecordException extends RuntimeException {

    private final RejectionReason reason;

    public InvalidRecordException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
