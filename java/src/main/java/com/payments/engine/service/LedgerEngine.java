package com.payments.engine.service;

import com.payments.engine.command.Command;
import com.payments.engine.command.FundsCommand;
import com.payments.engine.domain.Account;
import com.payments.engine.domain.Amounts;
import com.payments.engine.domain.HistoricalTransaction;
import com.payments.engine.domain.TransactionKind;
import com.payments.engine.dto.AccountSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory ledger: the account table keyed by client id and the history of applied
 * deposits and withdrawals keyed by transaction id.
 *
 * Commands must be applied in input order; a dispute only makes sense against the state
 * left by everything before it. Not thread-safe, one instance per replay.
 */
public class LedgerEngine {

    private static final Logger logger = LoggerFactory.getLogger(LedgerEngine.class);

    private final Map<Integer, Account> accounts = new HashMap<>();
    private final Map<Long, HistoricalTransaction> history = new HashMap<>();

    /**
     * Apply a single command.
     *
     * A rejected command leaves both tables untouched.
     */
    public ApplyResult apply(Command command) {
        switch (command.getType()) {
            case DEPOSIT:
                return deposit((FundsCommand) command);
            case WITHDRAWAL:
                return withdraw((FundsCommand) command);
            case DISPUTE:
                return dispute(command.getClientId(), command.getTransactionId());
            case RESOLVE:
                return resolve(command.getClientId(), command.getTransactionId());
            case CHARGEBACK:
                return chargeback(command.getClientId(), command.getTransactionId());
            default:
                throw new IllegalArgumentException("Unsupported command type: " + command.getType());
        }
    }

    private ApplyResult deposit(FundsCommand deposit) {
        long tx = deposit.getTransactionId();
        if (!Amounts.isPositive(deposit.getAmount())) {
            return ApplyResult.rejected(RejectionReason.INVALID_AMOUNT);
        }
        if (history.containsKey(tx)) {
            return ApplyResult.rejected(RejectionReason.DUPLICATE, tx);
        }

        Account account = accounts.computeIfAbsent(deposit.getClientId(), Account::new);
        account.credit(deposit.getAmount());
        record(deposit, TransactionKind.DEPOSIT);

        logger.debug("Deposited {} to client {} (tx {})", deposit.getAmount(), deposit.getClientId(), tx);
        return ApplyResult.applied();
    }

    private ApplyResult withdraw(FundsCommand withdrawal) {
        long tx = withdrawal.getTransactionId();
        if (!Amounts.isPositive(withdrawal.getAmount())) {
            return ApplyResult.rejected(RejectionReason.INVALID_AMOUNT);
        }
        if (history.containsKey(tx)) {
            return ApplyResult.rejected(RejectionReason.DUPLICATE, tx);
        }

        Account account = accounts.get(withdrawal.getClientId());
        if (account == null) {
            return ApplyResult.rejected(RejectionReason.MISSING_ACCOUNT);
        }
        if (account.isLocked()) {
            return ApplyResult.rejected(RejectionReason.FROZEN_ACCOUNT);
        }
        if (Amounts.isLessThan(account.getAvailable(), withdrawal.getAmount())) {
            return ApplyResult.rejected(RejectionReason.INSUFFICIENT_FUNDS);
        }

        account.debit(withdrawal.getAmount());
        record(withdrawal, TransactionKind.WITHDRAWAL);

        logger.debug("Withdrew {} from client {} (tx {})", withdrawal.getAmount(), withdrawal.getClientId(), tx);
        return ApplyResult.applied();
    }

    private ApplyResult dispute(int clientId, long tx) {
        HistoricalTransaction transaction = history.get(tx);
        if (transaction == null || !transaction.belongsTo(clientId)) {
            return ApplyResult.rejected(RejectionReason.INVALID_TRANSACTION, tx);
        }
        if (transaction.isChargedBack()) {
            return ApplyResult.rejected(RejectionReason.DISPUTE_CHARGEBACK, tx);
        }
        if (transaction.isUnderDispute()) {
            return ApplyResult.rejected(RejectionReason.DUPLICATE, tx);
        }
        Account account = accounts.get(clientId);
        if (account == null) {
            return ApplyResult.rejected(RejectionReason.MISSING_ACCOUNT);
        }

        account.hold(disputedAmount(transaction));
        transaction.markDisputed();

        logger.debug("Disputed tx {} of client {}", tx, clientId);
        return ApplyResult.applied();
    }

    private ApplyResult resolve(int clientId, long tx) {
        HistoricalTransaction transaction = history.get(tx);
        if (transaction == null
                || !transaction.belongsTo(clientId)
                || !transaction.isUnderDispute()) {
            // a charged back transaction is no longer under dispute
            return ApplyResult.rejected(RejectionReason.INVALID_TRANSACTION, tx);
        }
        Account account = accounts.get(clientId);
        if (account == null) {
            return ApplyResult.rejected(RejectionReason.MISSING_ACCOUNT);
        }

        account.release(disputedAmount(transaction));
        transaction.markResolved();

        logger.debug("Resolved dispute on tx {} of client {}", tx, clientId);
        return ApplyResult.applied();
    }

    private ApplyResult chargeback(int clientId, long tx) {
        HistoricalTransaction transaction = history.get(tx);
        if (transaction == null || !transaction.belongsTo(clientId)) {
            return ApplyResult.rejected(RejectionReason.INVALID_TRANSACTION, tx);
        }
        if (transaction.isChargedBack()) {
            return ApplyResult.rejected(RejectionReason.DUPLICATE, tx);
        }
        if (!transaction.isUnderDispute()) {
            return ApplyResult.rejected(RejectionReason.INVALID_TRANSACTION, tx);
        }
        Account account = accounts.get(clientId);
        if (account == null) {
            return ApplyResult.rejected(RejectionReason.MISSING_ACCOUNT);
        }

        // held is reduced by the original amount for both kinds
        account.removeHeld(transaction.getAmount());
        account.lock();
        transaction.markChargedBack();

        logger.info("Charged back tx {}, client {} is now locked", tx, clientId);
        return ApplyResult.applied();
    }

    private void record(FundsCommand command, TransactionKind kind) {
        history.put(command.getTransactionId(), new HistoricalTransaction(
                command.getTransactionId(), kind, command.getClientId(), command.getAmount()));
    }

    private static BigDecimal disputedAmount(HistoricalTransaction transaction) {
        return transaction.getKind().disputedAmount(transaction.getAmount());
    }

    /**
     * Every account ever created, ascending by client id, rounded for display.
     */
    public List<AccountSnapshot> snapshot() {
        return snapshot(Amounts.DISPLAY_SCALE);
    }

    public List<AccountSnapshot> snapshot(int displayScale) {
        return accounts.values().stream()
                .sorted(Comparator.comparingInt(Account::getClientId))
                .map(account -> AccountSnapshot.from(account, displayScale))
                .collect(Collectors.toList());
    }

    Optional<Account> findAccount(int clientId) {
        return Optional.ofNullable(accounts.get(clientId));
    }

    Optional<HistoricalTransaction> findTransaction(long transactionId) {
        return Optional.ofNullable(history.get(transactionId));
    }

    public int accountCount() {
        return accounts.size();
    }
}
