package com.govsandbox.domain;

/**
 * Declared compliance tier of an audit event. Declaration order is significant:
 * natural ordering gives LAW_TIER > POLICY_TIER > ADVISORY_TIER > INFORMATIONAL_TIER.
 */
public enum ComplianceTier {
    INFORMATIONAL_TIER,
    ADVISORY_TIER,
    POLICY_TIER,
    LAW_TIER
}
