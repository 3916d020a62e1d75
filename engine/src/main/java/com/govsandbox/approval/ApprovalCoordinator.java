package com.govsandbox.approval;

import com.github.benmanes.caffeine.cache.Cache;
import com.govsandbox.audit.HashChainedAuditLog;
import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import com.govsandbox.common.SecureIds;
import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.AuditEventKind;
import com.govsandbox.domain.ComplianceTier;
import com.govsandbox.domain.PayloadKeys;
import com.govsandbox.domain.TransactionIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Request/resolve handshake with the external approval authority. Every state change of a request is
 * witnessed; a request not resolved within the configured timeout resolves itself as TIMED_OUT.
 */
@Service
@Slf4j
public class ApprovalCoordinator {

    private final Cache<String, ApprovalRequest> requests;
    private final ApprovalProperties properties;
    private final HashChainedAuditLog auditLog;
    private final Clock clock;

    public ApprovalCoordinator(@Qualifier(ApprovalCacheConfig.APPROVAL_REQUESTS) Cache<String, ApprovalRequest> requests,
                               ApprovalProperties properties, HashChainedAuditLog auditLog, Clock clock) {
        if (properties.getRetention().compareTo(properties.getTimeout()) <= 0) {
            throw new IllegalStateException("sandbox.approval.retention must exceed sandbox.approval.timeout");
        }
        this.requests = requests;
        this.properties = properties;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    /**
     * Opens a request for {@code intent} and witnesses APPROVAL_REQUESTED.
     *
     * @return the new request; its id is what the approver resolves
     */
    public ApprovalRequest requestApproval(TransactionIntent intent) {
        ApprovalRequest request = new ApprovalRequest(SecureIds.next("AR"), intent, clock.millis(), System.nanoTime());
        Map<String, String> payload = intentPayload(request);
        auditLog.witness(AuditEventKind.APPROVAL_REQUESTED, intent.actor(), payload, ComplianceTier.POLICY_TIER);
        requests.put(request.getRequestId(), request);
        log.info("Approval {} requested for transaction {} ({} {})", request.getRequestId(), intent.transactionId(),
                intent.amount().toPlainString(), intent.currency());
        return request;
    }

    /**
     * @throws SandboxException APPROVAL_NOT_FOUND, APPROVAL_NOT_PENDING, INVALID_INPUT
     */
    public ApprovalResolution resolveApproval(String requestId, boolean granted, String approverId) {
        if (approverId == null || approverId.isBlank()) {
            throw new SandboxException(ErrorKind.INVALID_INPUT, "Approver id must not be blank");
        }
        ApprovalRequest request = find(requestId)
                .orElseThrow(() -> new SandboxException(ErrorKind.APPROVAL_NOT_FOUND, "No approval request " + requestId));
        synchronized (request) {
            if (request.getStatus().isResolved()) {
                throw new SandboxException(ErrorKind.APPROVAL_NOT_PENDING,
                        "Approval " + requestId + " already " + request.getStatus());
            }
            ApprovalStatus status = granted ? ApprovalStatus.GRANTED : ApprovalStatus.DENIED;
            Map<String, String> payload = intentPayload(request);
            payload.put(PayloadKeys.APPROVER_ID, approverId);
            AuditEvent event = auditLog.witness(
                    granted ? AuditEventKind.APPROVAL_GRANTED : AuditEventKind.APPROVAL_DENIED,
                    approverId, payload, ComplianceTier.POLICY_TIER);
            ApprovalResolution resolution = new ApprovalResolution(requestId, status, approverId, clock.millis(), event.eventId());
            request.complete(resolution);
            log.info("Approval {} {} by {}", requestId, status, approverId);
            return resolution;
        }
    }

    /**
     * Blocks until {@code request} is resolved or its timeout (counted from creation) elapses, in which case
     * it is resolved as TIMED_OUT. Never waits longer than the configured timeout.
     */
    public ApprovalResolution awaitResolution(ApprovalRequest request) {
        long remainingNanos = properties.getTimeout().toNanos() - (System.nanoTime() - request.getCreatedAtNanos());
        try {
            return request.getResolution().get(Math.max(0, remainingNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            return expire(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return expire(request);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Approval " + request.getRequestId() + " completed exceptionally", e.getCause());
        }
    }

    public ApprovalResolution awaitResolution(String requestId) {
        return awaitResolution(find(requestId)
                .orElseThrow(() -> new SandboxException(ErrorKind.APPROVAL_NOT_FOUND, "No approval request " + requestId)));
    }

    public Optional<ApprovalRequest> find(String requestId) {
        return requestId == null ? Optional.empty() : Optional.ofNullable(requests.getIfPresent(requestId));
    }

    public Optional<ApprovalStatus> status(String requestId) {
        return find(requestId).map(ApprovalRequest::getStatus);
    }

    /** Unresolved requests, oldest first. */
    public List<ApprovalRequest> pendingRequests() {
        return requests.asMap().values().stream()
                .filter(r -> r.getStatus() == ApprovalStatus.PENDING)
                .sorted(Comparator.comparingLong(ApprovalRequest::getCreatedAtNanos))
                .toList();
    }

    private ApprovalResolution expire(ApprovalRequest request) {
        synchronized (request) {
            Optional<ApprovalResolution> existing = request.resolved();
            if (existing.isPresent()) {
                return existing.get();
            }
            AuditEvent event = auditLog.witness(AuditEventKind.APPROVAL_TIMED_OUT, request.getIntent().actor(),
                    intentPayload(request), ComplianceTier.POLICY_TIER);
            ApprovalResolution resolution = new ApprovalResolution(request.getRequestId(), ApprovalStatus.TIMED_OUT, null,
                    clock.millis(), event.eventId());
            request.complete(resolution);
            log.warn("Approval {} timed out after {}ms for transaction {}", request.getRequestId(),
                    properties.getTimeout().toMillis(), request.getIntent().transactionId());
            return resolution;
        }
    }

    private static Map<String, String> intentPayload(ApprovalRequest request) {
        TransactionIntent intent = request.getIntent();
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.APPROVAL_REQUEST_ID, request.getRequestId());
        payload.put(PayloadKeys.TRANSACTION_ID, intent.transactionId());
        payload.put(PayloadKeys.SOURCE_ACCOUNT, intent.sourceAccountId());
        payload.put(PayloadKeys.DESTINATION_ACCOUNT, intent.destinationAccountId());
        payload.put(PayloadKeys.AMOUNT, intent.amount().toPlainString());
        payload.put(PayloadKeys.CURRENCY, intent.currency());
        return payload;
    }
}
