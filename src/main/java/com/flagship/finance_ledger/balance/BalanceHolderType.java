package com.flagship.finance_ledger.balance;

public enum BalanceHolderType {
    ACCOUNT,
    CREDIT_CARD
}
