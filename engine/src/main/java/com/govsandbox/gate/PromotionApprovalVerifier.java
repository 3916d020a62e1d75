package com.govsandbox.gate;

import com.govsandbox.common.Digests;
import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import com.govsandbox.domain.ExecutionMode;
import com.govsandbox.signature.MlDsaVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checks promotion tokens: registered approver, matching transition, issue time within the TTL window,
 * valid ML-DSA signature, never used before. Every failure is UNAUTHORIZED_PROMOTION.
 */
@Component
@Slf4j
public class PromotionApprovalVerifier {

    private final MlDsaVerifier signatureVerifier;
    private final Clock clock;
    private final long ttlMs;
    private final Map<String, byte[]> approverKeys = new ConcurrentHashMap<>();
    /** Payload digest (hex) of consumed tokens to their issue time; pruned once past the TTL window. */
    private final Map<String, Long> consumed = new ConcurrentHashMap<>();

    public PromotionApprovalVerifier(GateProperties properties, MlDsaVerifier signatureVerifier, Clock clock) {
        this.signatureVerifier = signatureVerifier;
        this.clock = clock;
        this.ttlMs = properties.getPromotionTokenTtl().toMillis();
        properties.getApprovers().forEach((id, key) -> registerApprover(id, Base64.getDecoder().decode(key.strip())));
    }

    public void registerApprover(String approverId, byte[] publicKey) {
        if (approverId == null || approverId.isBlank() || publicKey == null || publicKey.length == 0) {
            throw new SandboxException(ErrorKind.INVALID_INPUT, "Approver id and public key are required");
        }
        approverKeys.put(approverId, publicKey.clone());
        log.info("Promotion approver registered: {}", approverId);
    }

    public boolean isRegistered(String approverId) {
        return approverId != null && approverKeys.containsKey(approverId);
    }

    /**
     * Validates and consumes {@code token} for {@code from -> target}.
     *
     * @throws SandboxException UNAUTHORIZED_PROMOTION with the failed check in the message
     */
    public void verifyAndConsume(PromotionApproval token, ExecutionMode from, ExecutionMode target) {
        if (token == null) {
            throw unauthorized("no approval token presented");
        }
        byte[] publicKey = approverKeys.get(token.approverId());
        if (publicKey == null) {
            throw unauthorized("approver " + token.approverId() + " is not registered");
        }
        if (token.fromMode() != from || token.targetMode() != target) {
            throw unauthorized("token authorizes " + token.fromMode() + " -> " + token.targetMode()
                    + ", requested " + from + " -> " + target);
        }
        long now = clock.millis();
        if (Math.abs(now - token.issuedAtMs()) > ttlMs) {
            throw unauthorized("token issued at " + token.issuedAtMs() + " is outside the " + ttlMs + "ms window");
        }
        if (token.nonce() == null || token.nonce().isBlank()) {
            throw unauthorized("token has no nonce");
        }
        byte[] signature;
        try {
            signature = Base64.getDecoder().decode(token.signature() == null ? "" : token.signature());
        } catch (IllegalArgumentException e) {
            throw unauthorized("token signature is not valid Base64");
        }
        byte[] digest = token.payloadDigest();
        if (!signatureVerifier.verify(digest, signature, publicKey)) {
            throw unauthorized("token signature does not verify for approver " + token.approverId());
        }
        pruneConsumed(now);
        if (consumed.putIfAbsent(Digests.toHex(digest), token.issuedAtMs()) != null) {
            throw unauthorized("token already used");
        }
    }

    private void pruneConsumed(long now) {
        consumed.values().removeIf(issuedAt -> Math.abs(now - issuedAt) > ttlMs);
    }

    private static SandboxException unauthorized(String detail) {
        return new SandboxException(ErrorKind.UNAUTHORIZED_PROMOTION, "Promotion not authorized: " + detail);
    }
}
