package com.govsandbox.approval;

/**
 * Final answer for one approval request. {@code approverId} is null for TIMED_OUT;
 * {@code auditEventId} is the event that witnessed the resolution.
 */
public record ApprovalResolution(String requestId, ApprovalStatus status, String approverId, long resolvedAtMs,
                                 String auditEventId) {

    public boolean isGranted() {
        return status == ApprovalStatus.GRANTED;
    }
}
