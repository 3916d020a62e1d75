package com.govsandbox.approval;

public enum ApprovalStatus {
    PENDING,
    GRANTED,
    DENIED,
    TIMED_OUT;

    public boolean isResolved() {
        return this != PENDING;
    }
}
