package com.govsandbox.domain;

/**
 * Transaction lifecycle. SIMULATED, COMMITTED and REJECTED are terminal; status only moves forward.
 */
public enum TransactionStatus {
    PENDING,
    APPROVAL_REQUIRED,
    SIMULATED,
    COMMITTED,
    REJECTED;

    public boolean isTerminal() {
        return this == SIMULATED || this == COMMITTED || this == REJECTED;
    }

    /** COMMITTED is the only status that implies the ledger balances really moved. */
    public boolean impliesSettlement() {
        return this == COMMITTED;
    }

    public boolean canTransitionTo(TransactionStatus next) {
        return switch (this) {
            case PENDING -> next != PENDING;
            case APPROVAL_REQUIRED -> next == COMMITTED || next == REJECTED;
            case SIMULATED, COMMITTED, REJECTED -> false;
        };
    }
}
