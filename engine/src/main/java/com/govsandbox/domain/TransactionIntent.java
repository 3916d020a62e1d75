package com.govsandbox.domain;

import java.math.BigDecimal;

/**
 * What a caller asks to do, before the gate has classified it.
 */
public record TransactionIntent(String transactionId, String actor, String sourceAccountId,
                                String destinationAccountId, BigDecimal amount, String currency) {
}
