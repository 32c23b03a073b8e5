package com.flagship.finance_ledger.balance;

import org.springframework.stereotype.Repository;

/**
 * Credit card balances track outstanding debt: expenses push it up, refunds and payments down.
 */
@Repository
public class CreditCardBalanceStore extends JdbcBalanceStore {

    public CreditCardBalanceStore() {
        super(BalanceHolderType.CREDIT_CARD, "credit_card");
    }
}
