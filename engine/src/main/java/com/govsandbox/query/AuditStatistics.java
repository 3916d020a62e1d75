package com.govsandbox.query;

import com.govsandbox.domain.AuditEventKind;
import com.govsandbox.domain.ComplianceTier;

import java.util.Map;

/**
 * Counts over the whole audit chain. Maps contain every tier and kind, zero included.
 */
public record AuditStatistics(long chainLength, String headDigest, long evidenceRecordCount,
                              Map<ComplianceTier, Long> eventsByTier, Map<AuditEventKind, Long> eventsByKind) {

    public AuditStatistics {
        eventsByTier = Map.copyOf(eventsByTier);
        eventsByKind = Map.copyOf(eventsByKind);
    }
}
