package com.payments.engine.service;

import com.payments.engine.dto.AccountSnapshot;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@AllArgsConstructor
@ToString
public class ReplaySummary {

    private final int applied;
    private final int rejected;
    private final int invalidRecords;
    private final int droppedRows;
    private final List<AccountSnapshot> accounts;
}
