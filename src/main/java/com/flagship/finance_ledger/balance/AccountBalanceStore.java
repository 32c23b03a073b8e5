package com.flagship.finance_ledger.balance;

import org.springframework.stereotype.Repository;

@Repository
public class AccountBalanceStore extends JdbcBalanceStore {

    public AccountBalanceStore() {
        super(BalanceHolderType.ACCOUNT, "account");
    }
}
