package com.flagship.finance_ledger.unitofwork;

import java.util.function.Function;

/**
 * All-or-nothing execution boundary for ledger mutations.
 *
 * The work function receives the context bound to one database transaction.
 * Normal return commits; any exception rolls back every statement issued
 * through the context (rows, tag associations, balance deltas) and is rethrown.
 */
public interface UnitOfWork {

    <T> T run(Function<UnitOfWorkContext, T> work);

    /**
     * Same boundary, read-only. Used for read-back queries.
     */
    <T> T readOnly(Function<UnitOfWorkContext, T> work);
}
