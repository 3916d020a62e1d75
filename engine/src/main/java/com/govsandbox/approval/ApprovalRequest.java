package com.govsandbox.approval;

import com.govsandbox.domain.TransactionIntent;
import lombok.Getter;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One pending-or-resolved approval. Resolution happens once; the coordinator serializes on this object.
 */
@Getter
public class ApprovalRequest {

    private final String requestId;
    private final TransactionIntent intent;
    private final long createdAtMs;
    private final long createdAtNanos;
    private final CompletableFuture<ApprovalResolution> resolution = new CompletableFuture<>();

    ApprovalRequest(String requestId, TransactionIntent intent, long createdAtMs, long createdAtNanos) {
        this.requestId = requestId;
        this.intent = intent;
        this.createdAtMs = createdAtMs;
        this.createdAtNanos = createdAtNanos;
    }

    public ApprovalStatus getStatus() {
        return resolution.isDone() ? resolution.join().status() : ApprovalStatus.PENDING;
    }

    public Optional<ApprovalResolution> resolved() {
        return resolution.isDone() ? Optional.of(resolution.join()) : Optional.empty();
    }

    void complete(ApprovalResolution outcome) {
        resolution.complete(outcome);
    }
}
