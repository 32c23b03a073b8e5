package com.flagship.finance_ledger.balance;

import lombok.Value;

import java.util.Objects;

/**
 * Tagged reference to the row that owns a running balance: {ACCOUNT, id} or {CREDIT_CARD, id}.
 */
@Value
public class BalanceHolder {
    BalanceHolderType type;
    long id;

    private BalanceHolder(BalanceHolderType type, long id) {
        this.type = Objects.requireNonNull(type);
        this.id = id;
    }

    public static BalanceHolder of(BalanceHolderType type, long id) {
        return new BalanceHolder(type, id);
    }

    public static BalanceHolder account(long accountId) {
        return new BalanceHolder(BalanceHolderType.ACCOUNT, accountId);
    }

    public static BalanceHolder creditCard(long creditCardId) {
        return new BalanceHolder(BalanceHolderType.CREDIT_CARD, creditCardId);
    }
}
