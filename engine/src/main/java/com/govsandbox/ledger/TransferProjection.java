package com.govsandbox.ledger;

import com.govsandbox.common.ErrorKind;

import java.math.BigDecimal;

/**
 * Outcome of checking a transfer against current balances without applying it.
 * Either {@code rejection} is set, or both projected balances are.
 */
public record TransferProjection(ErrorKind rejection, BigDecimal projectedSourceBalance,
                                 BigDecimal projectedDestinationBalance) {

    public static TransferProjection accepted(BigDecimal source, BigDecimal destination) {
        return new TransferProjection(null, source, destination);
    }

    public static TransferProjection rejected(ErrorKind reason) {
        return new TransferProjection(reason, null, null);
    }

    public boolean isAccepted() {
        return rejection == null;
    }
}
