package com.govsandbox.domain;

import com.govsandbox.common.CanonicalJson;
import com.govsandbox.common.ErrorKind;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One transfer attempt. Identity fields and the content digest are fixed at creation; status only moves
 * forward (see {@link TransactionStatus#canTransitionTo}) and reaches a terminal value only together with
 * the id of the audit event that witnessed the outcome.
 */
@Getter
public class Transaction {

    private final String transactionId;
    private final String sourceAccountId;
    private final String destinationAccountId;
    private final BigDecimal amount;
    private final String currency;
    private final ExecutionMode mode;
    private final long createdAtMs;
    private final String digest;

    private TransactionStatus status = TransactionStatus.PENDING;
    private ErrorKind rejectionReason;
    private String auditEventId;
    private String approvalRequestId;
    private BigDecimal projectedSourceBalance;
    private BigDecimal projectedDestinationBalance;

    public Transaction(TransactionIntent intent, ExecutionMode mode, long createdAtMs) {
        if (intent.amount() == null || intent.amount().signum() <= 0) {
            throw new IllegalArgumentException("Transaction amount must be positive, got: " + intent.amount());
        }
        this.transactionId = Objects.requireNonNull(intent.transactionId(), "transactionId");
        this.sourceAccountId = intent.sourceAccountId();
        this.destinationAccountId = intent.destinationAccountId();
        this.amount = intent.amount();
        this.currency = intent.currency();
        this.mode = Objects.requireNonNull(mode, "mode");
        this.createdAtMs = createdAtMs;
        this.digest = computeDigest();
    }

    public String computeDigest() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("transactionId", transactionId);
        content.put("sourceAccountId", sourceAccountId);
        content.put("destinationAccountId", destinationAccountId);
        content.put("amount", amount.toPlainString());
        content.put("currency", currency);
        content.put("mode", mode.name());
        content.put("createdAtMs", createdAtMs);
        return CanonicalJson.sha3Hex(content);
    }

    public synchronized TransactionStatus getStatus() {
        return status;
    }

    public synchronized ErrorKind getRejectionReason() {
        return rejectionReason;
    }

    public synchronized String getAuditEventId() {
        return auditEventId;
    }

    public synchronized String getApprovalRequestId() {
        return approvalRequestId;
    }

    public synchronized BigDecimal getProjectedSourceBalance() {
        return projectedSourceBalance;
    }

    public synchronized BigDecimal getProjectedDestinationBalance() {
        return projectedDestinationBalance;
    }

    /** True once the terminal outcome has been witnessed in the audit chain. */
    public synchronized boolean isWitnessed() {
        return auditEventId != null;
    }

    public synchronized void awaitApproval(String approvalRequestId) {
        advance(TransactionStatus.APPROVAL_REQUIRED);
        this.approvalRequestId = approvalRequestId;
    }

    public synchronized void recordProjection(BigDecimal sourceBalance, BigDecimal destinationBalance) {
        this.projectedSourceBalance = sourceBalance;
        this.projectedDestinationBalance = destinationBalance;
    }

    /**
     * Moves to a terminal status. Requires the id of the audit event recording this outcome.
     */
    public synchronized void complete(TransactionStatus terminal, ErrorKind reason, String witnessEventId) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        if (terminal == TransactionStatus.REJECTED && reason == null) {
            throw new IllegalArgumentException("REJECTED requires a reason");
        }
        if (witnessEventId == null || witnessEventId.isBlank()) {
            throw new IllegalStateException("Terminal status " + terminal + " requires a witnessed audit event");
        }
        advance(terminal);
        this.rejectionReason = reason;
        this.auditEventId = witnessEventId;
    }

    private void advance(TransactionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Transaction " + transactionId + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }
}
