package com.flagship.finance_ledger.audit;

import lombok.Value;

import java.time.Instant;

/**
 * One recorded transaction mutation. {@code detail} is the JSON state after the
 * mutation, or the deleted state for DELETE.
 */
@Value
public class AuditLogEntry {
    Long id;
    AuditOperation operation;
    long transactionId;
    Long userId;
    String detail;
    Instant createdAt;
}
