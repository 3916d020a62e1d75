package com.govsandbox.common;

/**
 * Closed set of failure kinds surfaced by the sandbox core.
 * Business-rule kinds may also appear as the rejection reason of a terminal REJECTED transaction.
 */
public enum ErrorKind {
    INVALID_INPUT,
    INVALID_AMOUNT,
    DUPLICATE_ACCOUNT,
    ACCOUNT_NOT_FOUND,
    INSUFFICIENT_FUNDS,
    CURRENCY_MISMATCH,
    UNAUTHORIZED_PROMOTION,
    HALTED_BY_OPERATOR,
    APPROVAL_DENIED,
    APPROVAL_TIMED_OUT,
    APPROVAL_NOT_PENDING,
    APPROVAL_NOT_FOUND,
    CHAIN_INTEGRITY_VIOLATION,
    LATENCY_CAP_EXCEEDED,
    SIGNATURE_FAILURE,
    EXPORT_FAILURE;

    /** Rejections recorded as data (terminal REJECTED status plus audit event) rather than thrown. */
    public boolean isBusinessRejection() {
        return switch (this) {
            case ACCOUNT_NOT_FOUND, INSUFFICIENT_FUNDS, CURRENCY_MISMATCH, APPROVAL_DENIED, APPROVAL_TIMED_OUT -> true;
            default -> false;
        };
    }
}
