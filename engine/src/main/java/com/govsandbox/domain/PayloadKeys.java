package com.govsandbox.domain;

/**
 * Well-known keys of the structured audit payload.
 */
public final class PayloadKeys {

    public static final String TRANSACTION_ID = "transactionId";
    public static final String STATUS = "status";
    public static final String REASON = "reason";
    public static final String MODE = "mode";
    public static final String SOURCE_ACCOUNT = "sourceAccountId";
    public static final String DESTINATION_ACCOUNT = "destinationAccountId";
    public static final String ACCOUNT_ID = "accountId";
    public static final String AMOUNT = "amount";
    public static final String CURRENCY = "currency";
    public static final String TRANSACTION_DIGEST = "transactionDigest";
    public static final String PROJECTED_SOURCE_BALANCE = "projectedSourceBalance";
    public static final String PROJECTED_DESTINATION_BALANCE = "projectedDestinationBalance";
    public static final String APPROVAL_REQUEST_ID = "approvalRequestId";
    public static final String APPROVER_ID = "approverId";
    public static final String FROM_MODE = "fromMode";
    public static final String TARGET_MODE = "targetMode";
    public static final String VIOLATION = "violation";
    public static final String DETAIL = "detail";
    public static final String RECORD_ID = "recordId";
    public static final String FROM_INDEX = "fromIndex";
    public static final String TO_INDEX = "toIndex";
    public static final String RANGE_DIGEST = "rangeDigest";
    public static final String LATENCY_MS = "latencyMs";
    public static final String ATTEMPTED_KIND = "attemptedKind";

    private PayloadKeys() {
    }
}
