package com.govsandbox.ledger;

import com.govsandbox.domain.AccountSnapshot;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable account state owned by {@link LedgerStore}. Balance and history change only through the
 * package-private mutators, which the store calls while holding this account's lock.
 */
final class Account {

    private final String accountId;
    private final String currency;
    private final long createdAtMs;
    private final List<String> transactionIds = new ArrayList<>();
    private BigDecimal balance;

    Account(String accountId, BigDecimal initialBalance, String currency, long createdAtMs) {
        this.accountId = accountId;
        this.balance = initialBalance;
        this.currency = currency;
        this.createdAtMs = createdAtMs;
    }

    String accountId() {
        return accountId;
    }

    String currency() {
        return currency;
    }

    BigDecimal balance() {
        return balance;
    }

    void debit(BigDecimal amount, String transactionId) {
        BigDecimal next = balance.subtract(amount);
        if (next.signum() < 0) {
            throw new IllegalStateException("Debit of " + amount + " would overdraw " + accountId);
        }
        balance = next;
        transactionIds.add(transactionId);
    }

    void credit(BigDecimal amount, String transactionId) {
        balance = balance.add(amount);
        transactionIds.add(transactionId);
    }

    AccountSnapshot snapshot() {
        return new AccountSnapshot(accountId, balance, currency, transactionIds, createdAtMs);
    }
}
