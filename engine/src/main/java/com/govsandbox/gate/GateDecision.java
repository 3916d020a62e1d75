package com.govsandbox.gate;

import com.govsandbox.domain.ExecutionMode;

/**
 * Classification of one transaction intent under the mode that was current while deciding.
 */
public record GateDecision(Verdict verdict, ExecutionMode mode, String reason) {

    public enum Verdict {
        /** Compute the outcome without touching real balances. */
        SIMULATE,
        /** Hold the commit until an external approver resolves it. */
        REQUIRE_APPROVAL,
        COMMIT
    }
}
