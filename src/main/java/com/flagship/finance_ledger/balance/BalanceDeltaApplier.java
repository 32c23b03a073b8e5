package com.flagship.finance_ledger.balance;

import com.flagship.finance_ledger.monetary.MonetaryDelta;
import com.flagship.finance_ledger.observability.TransactionMetrics;
import com.flagship.finance_ledger.unitofwork.UnitOfWorkContext;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes a signed delta to the balance store for the holder's type.
 *
 * Zero deltas are dropped here, so callers can pass every computed delta through
 * without issuing no-op UPDATE statements.
 */
@Component
public class BalanceDeltaApplier {

    private final Map<BalanceHolderType, BalanceStore> stores = new EnumMap<>(BalanceHolderType.class);
    private final TransactionMetrics metrics;

    public BalanceDeltaApplier(List<BalanceStore> balanceStores, TransactionMetrics metrics) {
        for (BalanceStore store : balanceStores) {
            BalanceStore previous = stores.put(store.holderType(), store);
            if (previous != null) {
                throw new IllegalStateException("Duplicate balance store for " + store.holderType());
            }
        }
        for (BalanceHolderType type : BalanceHolderType.values()) {
            if (!stores.containsKey(type)) {
                throw new IllegalStateException("No balance store registered for " + type);
            }
        }
        this.metrics = metrics;
    }

    /**
     * @return the balance after the delta, or empty when the delta was zero and nothing was issued
     */
    public Optional<HolderBalance> apply(BalanceHolder holder, String signedDelta, UnitOfWorkContext ctx) {
        if (MonetaryDelta.isZero(signedDelta)) {
            return Optional.empty();
        }
        HolderBalance after = stores.get(holder.getType()).applyDelta(holder.getId(), signedDelta, ctx);
        metrics.recordDeltaApplied(holder.getType());
        return Optional.of(after);
    }

    public HolderBalance balanceOf(BalanceHolder holder, UnitOfWorkContext ctx) {
        return stores.get(holder.getType()).getBalance(holder.getId(), ctx);
    }
}
