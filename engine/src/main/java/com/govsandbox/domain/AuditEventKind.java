package com.govsandbox.domain;

/**
 * Governance event kinds witnessed into the hash chain.
 */
public enum AuditEventKind {
    ACCOUNT_FUNDED,
    TRANSACTION_SIMULATION,
    TRANSACTION_EXECUTION,
    APPROVAL_REQUESTED,
    APPROVAL_GRANTED,
    APPROVAL_DENIED,
    APPROVAL_TIMED_OUT,
    MODE_PROMOTED,
    COMPLIANCE_VIOLATION,
    EMERGENCY_STOP_TRIGGERED,
    EMERGENCY_STOP_CLEARED,
    EVIDENCE_RECORD_GENERATED;

    /** Kinds that record the terminal outcome of a transaction; exactly one per terminal transaction. */
    public boolean isTransactionOutcome() {
        return this == TRANSACTION_SIMULATION || this == TRANSACTION_EXECUTION;
    }
}
