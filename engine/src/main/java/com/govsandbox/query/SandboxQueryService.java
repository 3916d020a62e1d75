package com.govsandbox.query;

import com.govsandbox.audit.HashChainedAuditLog;
import com.govsandbox.domain.AccountSnapshot;
import com.govsandbox.domain.AuditEvent;
import com.govsandbox.domain.AuditEventKind;
import com.govsandbox.domain.ComplianceTier;
import com.govsandbox.domain.EvidenceRecord;
import com.govsandbox.domain.ExecutionMode;
import com.govsandbox.domain.Transaction;
import com.govsandbox.evidence.EvidenceRecordBuilder;
import com.govsandbox.execution.ShadowExecutionEngine;
import com.govsandbox.gate.ExecutionGate;
import com.govsandbox.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view for presentation and telemetry layers. Nothing here changes state or writes to the log.
 */
@Service
@RequiredArgsConstructor
public class SandboxQueryService {

    private final ExecutionGate gate;
    private final LedgerStore ledger;
    private final HashChainedAuditLog auditLog;
    private final EvidenceRecordBuilder evidence;
    private final ShadowExecutionEngine engine;

    public ExecutionMode currentMode() {
        return gate.currentMode();
    }

    public Optional<AccountSnapshot> account(String accountId) {
        return ledger.findAccount(accountId);
    }

    public List<AccountSnapshot> accounts() {
        return ledger.snapshotAll();
    }

    public String chainHeadDigest() {
        return auditLog.headDigest();
    }

    public List<AuditEvent> latestEvents(int count) {
        return auditLog.latest(count);
    }

    public Optional<EvidenceRecord> latestEvidenceRecord() {
        return evidence.latestRecord();
    }

    public Optional<Transaction> transaction(String transactionId) {
        return engine.getTransaction(transactionId);
    }

    public AuditStatistics statistics() {
        long length = auditLog.size();
        String head = length == 0
                ? auditLog.genesisDigest()
                : auditLog.get(length - 1).map(AuditEvent::digest).orElse(auditLog.headDigest());
        Map<ComplianceTier, Long> byTier = new EnumMap<>(ComplianceTier.class);
        for (ComplianceTier tier : ComplianceTier.values()) {
            byTier.put(tier, 0L);
        }
        Map<AuditEventKind, Long> byKind = new EnumMap<>(AuditEventKind.class);
        for (AuditEventKind kind : AuditEventKind.values()) {
            byKind.put(kind, 0L);
        }
        for (AuditEvent event : auditLog.range(0, length)) {
            byTier.merge(event.tier(), 1L, Long::sum);
            byKind.merge(event.kind(), 1L, Long::sum);
        }
        return new AuditStatistics(length, head, evidence.allRecords().size(), byTier, byKind);
    }
}
