package com.govsandbox.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Read-only view of an account at one instant. Balances are only changed through the ledger store.
 */
public record AccountSnapshot(String accountId, BigDecimal balance, String currency, List<String> transactionIds,
                              long createdAtMs) {

    public AccountSnapshot {
        transactionIds = List.copyOf(transactionIds);
    }
}
