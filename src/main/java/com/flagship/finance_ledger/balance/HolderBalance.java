package com.flagship.finance_ledger.balance;

import lombok.Value;

/**
 * Snapshot of a holder's balance as the store reports it, e.g. right after a delta.
 */
@Value
public class HolderBalance {
    BalanceHolder holder;
    Long userId;
    String balance;
}
