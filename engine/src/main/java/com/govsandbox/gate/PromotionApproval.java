package com.govsandbox.gate;

import com.govsandbox.common.CanonicalJson;
import com.govsandbox.common.Digests;
import com.govsandbox.domain.ExecutionMode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token presented to {@link ExecutionGate#promote}: an external approver's ML-DSA signature (Base64) over
 * {@link #payloadDigest}. Valid once, within the configured TTL of {@code issuedAtMs}.
 */
public record PromotionApproval(String approverId, ExecutionMode fromMode, ExecutionMode targetMode,
                                long issuedAtMs, String nonce, String signature) {

    public byte[] payloadDigest() {
        return payloadDigest(approverId, fromMode, targetMode, issuedAtMs, nonce);
    }

    /**
     * Digest an approver signs to authorize {@code fromMode -> targetMode}.
     */
    public static byte[] payloadDigest(String approverId, ExecutionMode fromMode, ExecutionMode targetMode,
                                       long issuedAtMs, String nonce) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("purpose", "MODE_PROMOTION");
        content.put("approverId", approverId);
        content.put("fromMode", fromMode == null ? null : fromMode.name());
        content.put("targetMode", targetMode == null ? null : targetMode.name());
        content.put("issuedAtMs", issuedAtMs);
        content.put("nonce", nonce);
        return Digests.sha3(CanonicalJson.toBytes(content));
    }
}
