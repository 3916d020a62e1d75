package com.govsandbox.audit;

import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import lombok.Getter;

/**
 * First broken link found while re-verifying the chain. Implies tampering or a bug; never ignored.
 */
@Getter
public class ChainIntegrityViolationException extends SandboxException {

    public enum BreakType {
        SEQUENCE_GAP,
        LINK_MISMATCH,
        DIGEST_MISMATCH,
        SIGNATURE_INVALID,
        UNKNOWN_SIGNER_KEY
    }

    private final long brokenIndex;
    private final String eventId;
    private final BreakType breakType;

    public ChainIntegrityViolationException(long brokenIndex, String eventId, BreakType breakType, String detail) {
        super(ErrorKind.CHAIN_INTEGRITY_VIOLATION,
                "Chain broken at index " + brokenIndex + " (" + eventId + "): " + breakType + " - " + detail);
        this.brokenIndex = brokenIndex;
        this.eventId = eventId;
        this.breakType = breakType;
    }
}
