package com.payments.engine.domain;

/**
 * NORMAL -> DISPUTED -> NORMAL (resolve) or CHARGED_BACK (terminal).
 */
public enum TransactionStatus {
    NORMAL,
    DISPUTED,
    CHARGED_BACK
}
