package com.flagship.finance_ledger.audit;

public enum AuditOperation {
    CREATE,
    UPDATE,
    DELETE
}
