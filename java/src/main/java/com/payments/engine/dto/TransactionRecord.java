package com.payments.engine.dto;

import com.payments.engine.command.CommandType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One row of the input CSV: {@code type, client, tx, amount}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRecord {

    @NotNull(message = "Type is required")
    private CommandType type;

    @NotNull(message = "Client is required")
    @Min(value = 0, message = "Client must not be negative")
    @Max(value = 65535, message = "Client must fit in 16 bits")
    private Long client;

    @NotNull(message = "Transaction id is required")
    @Min(value = 0, message = "Transaction id must not be negative")
    @Max(value = 4294967295L, message = "Transaction id must fit in 32 bits")
    private Long tx;

    // only deposits and withdrawals carry an amount
    private BigDecimal amount;
}
