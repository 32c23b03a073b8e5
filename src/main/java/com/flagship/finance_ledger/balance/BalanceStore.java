package com.flagship.finance_ledger.balance;

import com.flagship.finance_ledger.unitofwork.UnitOfWorkContext;

/**
 * Capability to move one holder type's balance by a signed delta.
 *
 * Implementations must issue a single atomic in-database increment per call and
 * must never read the current balance to compute the new one.
 */
public interface BalanceStore {

    BalanceHolderType holderType();

    /**
     * Applies {@code balance = balance + delta} to exactly one row.
     *
     * @param holderId id of the account or credit card
     * @param signedDelta signed decimal string, two fraction digits
     * @param ctx active unit of work
     * @return the holder's balance after the increment
     * @throws IllegalStateException if the holder row does not exist
     */
    HolderBalance applyDelta(long holderId, String signedDelta, UnitOfWorkContext ctx);

    HolderBalance getBalance(long holderId, UnitOfWorkContext ctx);
}
