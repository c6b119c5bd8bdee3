package com.payments.engine.ingest;

import com.payments.engine.command.Command;
import com.payments.engine.domain.Amounts;
import com.payments.engine.dto.TransactionRecord;
import com.payments.engine.exception.InvalidRecordException;
import com.payments.engine.service.RejectionReason;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a parsed record into a command for the ledger engine.
 *
 * Deposits and withdrawals without a positive amount never reach the engine.
 */
@Component
public class CommandFactory {

    private final Validator validator;

    public CommandFactory(Validator validator) {
        this.validator = validator;
    }

    public Command toCommand(TransactionRecord record) {
        Set<ConstraintViolation<TransactionRecord>> violations = validator.validate(record);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                    .map(ConstraintViolation::getMessage)
                    .collect(Collectors.joining(", "));
            throw new InvalidRecordException(RejectionReason.INVALID_TRANSACTION,
                    "invalid record " + record + ": " + details);
        }

        int client = record.getClient().intValue();
        long tx = record.getTx();

        switch (record.getType()) {
            case DEPOSIT:
                requirePositiveAmount(record);
                return Command.deposit(client, tx, record.getAmount());
            case WITHDRAWAL:
                requirePositiveAmount(record);
                return Command.withdrawal(client, tx, record.getAmount());
            case DISPUTE:
                return Command.dispute(client, tx);
            case RESOLVE:
                return Command.resolve(client, tx);
            case CHARGEBACK:
                return Command.chargeback(client, tx);
            default:
                throw new IllegalArgumentException("Unsupported record type: " + record.getType());
        }
    }

    private static void requirePositiveAmount(TransactionRecord record) {
        if (!Amounts.isPositive(record.getAmount())) {
            throw new InvalidRecordException(RejectionReason.INVALID_AMOUNT,
                    RejectionReason.INVALID_AMOUNT.getDescription() + " (tx " + record.getTx() + ")");
        }
    }
}
