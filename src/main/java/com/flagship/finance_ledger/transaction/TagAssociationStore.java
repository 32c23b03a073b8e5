package com.flagship.finance_ledger.transaction;

import com.flagship.finance_ledger.unitofwork.UnitOfWorkContext;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Join rows between transactions and tags. The association has no attributes of its own.
 */
@Repository
public class TagAssociationStore {

    /**
     * Replaces the transaction's tag set: delete every join row, then insert one per id.
     * Calling it twice with the same ids leaves the same rows.
     */
    public void replace(long transactionId, Collection<Long> tagIds, UnitOfWorkContext ctx) {
        deleteAll(transactionId, ctx);
        if (tagIds.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(tagIds.size());
        for (Long tagId : tagIds) {
            rows.add(new Object[] {transactionId, tagId});
        }
        ctx.jdbc().batchUpdate("INSERT INTO transaction_tag (transaction_id, tag_id) VALUES (?, ?)", rows);
    }

    public int deleteAll(long transactionId, UnitOfWorkContext ctx) {
        return ctx.jdbc().update("DELETE FROM transaction_tag WHERE transaction_id = ?", transactionId);
    }

    public List<Long> findTagIds(long transactionId, UnitOfWorkContext ctx) {
        return ctx.jdbc().queryForList(
            "SELECT tag_id FROM transaction_tag WHERE transaction_id = ? ORDER BY tag_id",
            Long.class,
            transactionId
        );
    }

    /**
     * Batched variant for read-back of many transactions. Transactions without tags are absent from the map.
     */
    public Map<Long, List<Long>> findTagIdsByTransactions(Collection<Long> transactionIds, UnitOfWorkContext ctx) {
        Map<Long, List<Long>> tagsByTransaction = new HashMap<>();
        if (transactionIds.isEmpty()) {
            return tagsByTransaction;
        }
        ctx.namedJdbc().query(
            "SELECT transaction_id, tag_id FROM transaction_tag WHERE transaction_id IN (:ids) "
                + "ORDER BY transaction_id, tag_id",
            new MapSqlParameterSource("ids", transactionIds),
            (RowCallbackHandler) rs -> tagsByTransaction
                .computeIfAbsent(rs.getLong("transaction_id"), id -> new ArrayList<>())
                .add(rs.getLong("tag_id"))
        );
        return tagsByTransaction;
    }
}
