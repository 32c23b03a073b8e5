package com.flagship.finance_ledger.balance;

import com.flagship.finance_ledger.unitofwork.UnitOfWorkContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;

/**
 * JDBC balance store for a table with {@code id}, {@code user_id} and {@code balance} columns.
 *
 * The increment is a single UPDATE; the row lock it takes is held until the unit of
 * work ends, so the read-back that follows sees this transaction's own result.
 */
@Slf4j
abstract class JdbcBalanceStore implements BalanceStore {

    private final BalanceHolderType holderType;
    private final String applyDeltaSql;
    private final String selectBalanceSql;

    protected JdbcBalanceStore(BalanceHolderType holderType, String table) {
        this.holderType = holderType;
        this.applyDeltaSql = "UPDATE " + table
            + " SET balance = balance + CAST(? AS DECIMAL(10,2)), updated_at = CURRENT_TIMESTAMP WHERE id = ?";
        this.selectBalanceSql = "SELECT id, user_id, balance FROM " + table + " WHERE id = ?";
    }

    @Override
    public BalanceHolderType holderType() {
        return holderType;
    }

    @Override
    public HolderBalance applyDelta(long holderId, String signedDelta, UnitOfWorkContext ctx) {
        int updated = ctx.jdbc().update(applyDeltaSql, signedDelta, holderId);
        if (updated != 1) {
            throw new IllegalStateException(
                String.format("Balance invariant violation: %s %d not found while applying delta %s",
                    holderType, holderId, signedDelta));
        }
        HolderBalance after = getBalance(holderId, ctx);
        log.debug("Applied delta: holder={} id={} delta={} balance={}",
            holderType, holderId, signedDelta, after.getBalance());
        return after;
    }

    @Override
    public HolderBalance getBalance(long holderId, UnitOfWorkContext ctx) {
        List<HolderBalance> rows = ctx.jdbc().query(selectBalanceSql, balanceRowMapper(), holderId);
        if (rows.isEmpty()) {
            throw new IllegalStateException(
                String.format("Balance invariant violation: %s %d not found", holderType, holderId));
        }
        return rows.get(0);
    }

    private RowMapper<HolderBalance> balanceRowMapper() {
        return (rs, rowNum) -> new HolderBalance(
            BalanceHolder.of(holderType, rs.getLong("id")),
            rs.getLong("user_id"),
            rs.getBigDecimal("balance").toPlainString()
        );
    }
}
