package com.govsandbox.execution;

import com.govsandbox.approval.ApprovalCoordinator;
import com.govsandbox.approval.ApprovalRequest;
import com.govsandbox.approval.ApprovalResolution;
import com.govsandbox.approval.ApprovalStatus;
import com.govsandbox.audit.HashChainedAuditLog;
import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import com.govsandbox.common.SecureIds;
import com.govsandbox.domain.AccountSnapshot;
import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.AuditEventKind;
import com.govsandbox.domain.ComplianceTier;
import com.govsandbox.domain.PayloadKeys;
import com.govsandbox.domain.Transaction;
import com.govsandbox.domain.TransactionIntent;
import com.govsandbox.domain.TransactionStatus;
import com.govsandbox.gate.ExecutionGate;
import com.govsandbox.gate.GateDecision;
import com.govsandbox.gate.HaltSignal;
import com.govsandbox.ledger.LedgerStore;
import com.govsandbox.ledger.TransferProjection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs transaction attempts through the execution gate, the ledger and the audit log.
 * <p>
 * Each attempt ends with exactly one outcome event (TRANSACTION_SIMULATION in SHADOW, TRANSACTION_EXECUTION
 * otherwise) appended before the call returns. The halt check, balance check, witness and (for commits) the
 * ledger mutation run as one unit under both account locks, with the execution mode pinned. Approval waits
 * happen outside those locks. Lock order is always mode lock, then ledger store lock, then account locks
 * in ascending id order.
 * <p>
 * The transaction registry keeps every attempt for the life of the process so {@link #transactions()} can
 * answer for the whole session; it is not bounded like the approval registry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShadowExecutionEngine {

    private static final String UNKNOWN_ACTOR = "UNKNOWN";

    private final LedgerStore ledger;
    private final ExecutionGate gate;
    private final HashChainedAuditLog auditLog;
    private final ApprovalCoordinator approvals;
    private final List<HaltSignal> haltSignals;
    private final Clock clock;
    private final Map<String, Transaction> transactions = new ConcurrentHashMap<>();

    /**
     * Creates and funds an account, witnessed as ACCOUNT_FUNDED. Funding is the only way the conserved
     * total changes.
     *
     * @throws SandboxException INVALID_INPUT, INVALID_AMOUNT, DUPLICATE_ACCOUNT, HALTED_BY_OPERATOR
     */
    public AccountSnapshot createAccount(String actor, String accountId, BigDecimal initialBalance, String currency) {
        requireActor(actor);
        ensureNotHalted();
        ledger.validateNewAccount(accountId, initialBalance, currency);
        return gate.withModePinned(mode -> ledger.withAccountLocked(accountId, () -> {
            ledger.validateNewAccount(accountId, initialBalance, currency);
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put(PayloadKeys.ACCOUNT_ID, accountId);
            payload.put(PayloadKeys.AMOUNT, initialBalance.toPlainString());
            payload.put(PayloadKeys.CURRENCY, currency);
            payload.put(PayloadKeys.MODE, mode.name());
            auditLog.witness(AuditEventKind.ACCOUNT_FUNDED, actor, payload, ComplianceTier.ADVISORY_TIER);
            return ledger.createAccount(accountId, initialBalance, currency);
        }));
    }

    /**
     * Attempts a transfer under the current execution mode and returns the transaction in a terminal status.
     * Business-rule failures come back as REJECTED with a reason; malformed input, halts and integrity
     * failures are thrown.
     *
     * @throws SandboxException INVALID_INPUT (witnessed as a compliance violation), HALTED_BY_OPERATOR,
     *                          LATENCY_CAP_EXCEEDED, SIGNATURE_FAILURE
     */
    public Transaction simulateTransaction(String actor, String sourceAccountId, String destinationAccountId,
                                           BigDecimal amount, String currency) {
        ensureNotHalted();
        validateInput(actor, sourceAccountId, destinationAccountId, amount, currency);

        TransactionIntent intent = new TransactionIntent(SecureIds.next("TX"), actor, sourceAccountId,
                destinationAccountId, amount, currency);
        try {
            PendingApproval pending = gate.withDecision(intent, decision -> execute(intent, decision));
            if (pending != null) {
                completeAfterApproval(pending);
                return pending.transaction();
            }
            return transactions.get(intent.transactionId());
        } catch (RuntimeException e) {
            transactions.remove(intent.transactionId());
            throw e;
        }
    }

    public Optional<Transaction> getTransaction(String transactionId) {
        return transactionId == null ? Optional.empty() : Optional.ofNullable(transactions.get(transactionId));
    }

    /** All registered transactions, oldest first. */
    public List<Transaction> transactions() {
        return transactions.values().stream()
                .sorted(Comparator.comparingLong(Transaction::getCreatedAtMs))
                .toList();
    }

    /**
     * Runs with the mode pinned. Returns a pending approval when the commit must wait, otherwise null
     * after the transaction reached its terminal status.
     */
    private PendingApproval execute(TransactionIntent intent, GateDecision decision) {
        Transaction tx = new Transaction(intent, decision.mode(), clock.millis());
        transactions.put(tx.getTransactionId(), tx);
        return ledger.withAccountsLocked(tx.getSourceAccountId(), tx.getDestinationAccountId(), () -> {
            ensureNotHalted();
            TransferProjection projection = ledger.projectTransfer(tx.getSourceAccountId(), tx.getDestinationAccountId(),
                    tx.getAmount(), tx.getCurrency());
            switch (decision.verdict()) {
                case SIMULATE -> {
                    if (projection.isAccepted()) {
                        tx.recordProjection(projection.projectedSourceBalance(), projection.projectedDestinationBalance());
                        finish(tx, intent.actor(), TransactionStatus.SIMULATED, null);
                    } else {
                        finish(tx, intent.actor(), TransactionStatus.REJECTED, projection.rejection());
                    }
                    return null;
                }
                case COMMIT -> {
                    commitOrReject(tx, intent.actor(), projection);
                    return null;
                }
                case REQUIRE_APPROVAL -> {
                    if (!projection.isAccepted()) {
                        finish(tx, intent.actor(), TransactionStatus.REJECTED, projection.rejection());
                        return null;
                    }
                    ApprovalRequest request = approvals.requestApproval(intent);
                    tx.awaitApproval(request.getRequestId());
                    log.info("Transaction {} awaiting approval {} ({})", tx.getTransactionId(), request.getRequestId(),
                            decision.reason());
                    return new PendingApproval(tx, intent.actor(), request);
                }
                default -> throw new IllegalStateException("Unhandled verdict " + decision.verdict());
            }
        });
    }

    private void completeAfterApproval(PendingApproval pending) {
        ApprovalResolution resolution = approvals.awaitResolution(pending.request());
        Transaction tx = pending.transaction();
        ledger.withAccountsLocked(tx.getSourceAccountId(), tx.getDestinationAccountId(), () -> {
            if (resolution.status() == ApprovalStatus.DENIED) {
                finish(tx, pending.actor(), TransactionStatus.REJECTED, ErrorKind.APPROVAL_DENIED);
            } else if (resolution.status() == ApprovalStatus.TIMED_OUT) {
                finish(tx, pending.actor(), TransactionStatus.REJECTED, ErrorKind.APPROVAL_TIMED_OUT);
            } else if (isHalted()) {
                finish(tx, pending.actor(), TransactionStatus.REJECTED, ErrorKind.HALTED_BY_OPERATOR);
            } else {
                commitOrReject(tx, pending.actor(), ledger.projectTransfer(tx.getSourceAccountId(),
                        tx.getDestinationAccountId(), tx.getAmount(), tx.getCurrency()));
            }
            return null;
        });
    }

    /** Caller holds both account locks. Witnesses before mutating. */
    private void commitOrReject(Transaction tx, String actor, TransferProjection projection) {
        if (!projection.isAccepted()) {
            finish(tx, actor, TransactionStatus.REJECTED, projection.rejection());
            return;
        }
        tx.recordProjection(projection.projectedSourceBalance(), projection.projectedDestinationBalance());
        AuditEvent event = witnessOutcome(tx, actor, TransactionStatus.COMMITTED, null);
        ledger.applyTransfer(tx);
        tx.complete(TransactionStatus.COMMITTED, null, event.eventId());
        log.info("Transaction {} COMMITTED in {} ({} {} {} -> {})", tx.getTransactionId(), tx.getMode(),
                tx.getAmount().toPlainString(), tx.getCurrency(), tx.getSourceAccountId(), tx.getDestinationAccountId());
    }

    private void finish(Transaction tx, String actor, TransactionStatus status, ErrorKind reason) {
        AuditEvent event = witnessOutcome(tx, actor, status, reason);
        tx.complete(status, reason, event.eventId());
        if (status == TransactionStatus.REJECTED) {
            log.warn("Transaction {} REJECTED in {}: {}", tx.getTransactionId(), tx.getMode(), reason);
        } else {
            log.debug("Transaction {} {} in {}", tx.getTransactionId(), status, tx.getMode());
        }
    }

    private AuditEvent witnessOutcome(Transaction tx, String actor, TransactionStatus status, ErrorKind reason) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.TRANSACTION_ID, tx.getTransactionId());
        payload.put(PayloadKeys.STATUS, status.name());
        payload.put(PayloadKeys.MODE, tx.getMode().name());
        payload.put(PayloadKeys.SOURCE_ACCOUNT, tx.getSourceAccountId());
        payload.put(PayloadKeys.DESTINATION_ACCOUNT, tx.getDestinationAccountId());
        payload.put(PayloadKeys.AMOUNT, tx.getAmount().toPlainString());
        payload.put(PayloadKeys.CURRENCY, tx.getCurrency());
        payload.put(PayloadKeys.TRANSACTION_DIGEST, tx.getDigest());
        if (reason != null) {
            payload.put(PayloadKeys.REASON, reason.name());
        }
        if (tx.getApprovalRequestId() != null) {
            payload.put(PayloadKeys.APPROVAL_REQUEST_ID, tx.getApprovalRequestId());
        }
        if (status != TransactionStatus.REJECTED && tx.getProjectedSourceBalance() != null) {
            payload.put(PayloadKeys.PROJECTED_SOURCE_BALANCE, tx.getProjectedSourceBalance().toPlainString());
            payload.put(PayloadKeys.PROJECTED_DESTINATION_BALANCE, tx.getProjectedDestinationBalance().toPlainString());
        }
        AuditEventKind kind = tx.getMode().allowsRealMutation()
                ? AuditEventKind.TRANSACTION_EXECUTION
                : AuditEventKind.TRANSACTION_SIMULATION;
        ComplianceTier tier = status == TransactionStatus.REJECTED ? ComplianceTier.ADVISORY_TIER : ComplianceTier.INFORMATIONAL_TIER;
        return auditLog.witness(kind, actor, payload, tier);
    }

    private void validateInput(String actor, String sourceAccountId, String destinationAccountId,
                               BigDecimal amount, String currency) {
        String problem = null;
        if (actor == null || actor.isBlank()) {
            problem = "actor must not be blank";
        } else if (sourceAccountId == null || sourceAccountId.isBlank()) {
            problem = "source account id must not be blank";
        } else if (destinationAccountId == null || destinationAccountId.isBlank()) {
            problem = "destination account id must not be blank";
        } else if (sourceAccountId.equals(destinationAccountId)) {
            problem = "source and destination must differ";
        } else if (amount == null || amount.signum() <= 0) {
            problem = "amount must be positive, got " + (amount == null ? null : amount.toPlainString());
        } else if (currency == null || !LedgerStore.CURRENCY_CODE.matcher(currency).matches()) {
            problem = "currency must be a 3-letter code, got " + currency;
        }
        if (problem == null) {
            return;
        }
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.VIOLATION, ErrorKind.INVALID_INPUT.name());
        payload.put(PayloadKeys.DETAIL, problem);
        payload.put(PayloadKeys.SOURCE_ACCOUNT, String.valueOf(sourceAccountId));
        payload.put(PayloadKeys.DESTINATION_ACCOUNT, String.valueOf(destinationAccountId));
        payload.put(PayloadKeys.AMOUNT, amount == null ? "null" : amount.toPlainString());
        String witnessActor = actor == null || actor.isBlank() ? UNKNOWN_ACTOR : actor;
        auditLog.witness(AuditEventKind.COMPLIANCE_VIOLATION, witnessActor, payload, ComplianceTier.POLICY_TIER);
        log.warn("Rejected malformed transaction request from {}: {}", witnessActor, problem);
        throw new SandboxException(ErrorKind.INVALID_INPUT, "Invalid transaction request: " + problem);
    }

    private void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new SandboxException(ErrorKind.INVALID_INPUT, "Actor must not be blank");
        }
    }

    private boolean isHalted() {
        return haltSignals.stream().anyMatch(HaltSignal::isHalted);
    }

    private void ensureNotHalted() {
        if (isHalted()) {
            throw new SandboxException(ErrorKind.HALTED_BY_OPERATOR, "Sandbox halted by operator");
        }
    }

    private record PendingApproval(Transaction transaction, String actor, ApprovalRequest request) {
    }
}
