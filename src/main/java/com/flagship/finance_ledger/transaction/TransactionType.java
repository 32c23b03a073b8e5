package com.flagship.finance_ledger.transaction;

public enum TransactionType {
    EXPENSE,
    INCOME
}
