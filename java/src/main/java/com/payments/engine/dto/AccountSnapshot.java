package com.payments.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.payments.engine.domain.Account;
import com.payments.engine.domain.Amounts;
import lombok.*;

import java.math.BigDecimal;

/**
 * Reporting view of an account, with balances rounded for display.
 */
@Getter
@AllArgsConstructor
@Builder
@ToString
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountSnapshot {

    @JsonProperty("client")
    private int clientId;
    private BigDecimal available;
    private BigDecimal held;
    private BigDecimal total;
    private boolean locked;

    public static AccountSnapshot from(Account account, int scale) {
        return AccountSnapshot.builder()
                .clientId(account.getClientId())
                .available(Amounts.roundForDisplay(account.getAvailable(), scale))
                .held(Amounts.roundForDisplay(account.getHeld(), scale))
                .total(Amounts.roundForDisplay(account.getTotal(), scale))
                .locked(account.isLocked())
                .build();
    }
}
