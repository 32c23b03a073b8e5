package com.flagship.finance_ledger.transaction;

import com.flagship.finance_ledger.balance.BalanceHolderType;

/**
 * Where a transaction's money moves: an account or a credit card.
 * Determines which holder id is set on the row.
 */
public enum TransactionSource {
    ACCOUNT(BalanceHolderType.ACCOUNT),
    CREDIT_CARD(BalanceHolderType.CREDIT_CARD);

    private final BalanceHolderType holderType;

    TransactionSource(BalanceHolderType holderType) {
        this.holderType = holderType;
    }

    public BalanceHolderType holderType() {
        return holderType;
    }
}
