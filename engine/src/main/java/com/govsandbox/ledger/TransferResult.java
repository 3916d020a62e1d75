package com.govsandbox.ledger;

import com.govsandbox.domain.AccountSnapshot;

/**
 * Both sides of an applied transfer, captured inside the same critical section.
 */
public record TransferResult(AccountSnapshot source, AccountSnapshot destination) {
}
