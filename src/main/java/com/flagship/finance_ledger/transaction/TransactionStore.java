package com.flagship.finance_ledger.transaction;

import com.flagship.finance_ledger.unitofwork.UnitOfWorkContext;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * JDBC store for transaction rows.
 *
 * Every method takes the active unit of work. Monetary values are bound as strings
 * and cast to DECIMAL(10,2) by the database, so they never pass through a binary
 * floating-point type.
 */
@Repository
public class TransactionStore {

    private static final String COLUMNS =
        "id, value, transaction_date, transaction_type, transaction_source, account_id, credit_card_id, "
            + "category_id, subcategory_id, is_installment, total_months, is_recurring, payment_day, "
            + "active, observation, created_at, updated_at";

    private static final String INSERT_SQL =
        "INSERT INTO ledger_transaction (value, transaction_date, transaction_type, transaction_source, "
            + "account_id, credit_card_id, category_id, subcategory_id, is_installment, total_months, "
            + "is_recurring, payment_day, active, observation, created_at, updated_at) "
            + "VALUES (CAST(? AS DECIMAL(10,2)), ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)";

    private static final String UPDATE_SQL =
        "UPDATE ledger_transaction SET value = CAST(? AS DECIMAL(10,2)), transaction_date = ?, "
            + "transaction_type = ?, transaction_source = ?, account_id = ?, credit_card_id = ?, "
            + "category_id = ?, subcategory_id = ?, is_installment = ?, total_months = ?, is_recurring = ?, "
            + "payment_day = ?, active = ?, observation = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?";

    /**
     * Inserts a new row and returns its store-assigned id.
     */
    public long insert(Transaction transaction, UnitOfWorkContext ctx) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        ctx.jdbc().update(connection -> {
            PreparedStatement ps = connection.prepareStatement(INSERT_SQL, new String[] {"id"});
            bindMutableColumns(ps, transaction);
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Insert into ledger_transaction returned no generated id");
        }
        return key.longValue();
    }

    /**
     * Overwrites every mutable column of an existing row.
     *
     * @throws IllegalStateException if the row does not exist
     */
    public void update(Transaction transaction, UnitOfWorkContext ctx) {
        int updated = ctx.jdbc().update(connection -> {
            PreparedStatement ps = connection.prepareStatement(UPDATE_SQL);
            int next = bindMutableColumns(ps, transaction);
            ps.setLong(next, transaction.getId());
            return ps;
        });
        if (updated != 1) {
            throw new IllegalStateException("Transaction " + transaction.getId() + " vanished during update");
        }
    }

    public boolean delete(long transactionId, UnitOfWorkContext ctx) {
        return ctx.jdbc().update("DELETE FROM ledger_transaction WHERE id = ?", transactionId) == 1;
    }

    public Optional<Transaction> findById(long transactionId, UnitOfWorkContext ctx) {
        return ctx.jdbc().query(
            "SELECT " + COLUMNS + " FROM ledger_transaction WHERE id = ?",
            transactionRowMapper(),
            transactionId
        ).stream().findFirst();
    }

    /**
     * Reads the row and locks it until the unit of work ends. Concurrent updates or
     * deletes of the same transaction block here until this unit of work commits or
     * rolls back.
     */
    public Optional<Transaction> findByIdForUpdate(long transactionId, UnitOfWorkContext ctx) {
        return ctx.jdbc().query(
            "SELECT " + COLUMNS + " FROM ledger_transaction WHERE id = ? FOR UPDATE",
            transactionRowMapper(),
            transactionId
        ).stream().findFirst();
    }

    public List<Transaction> findByAccount(long accountId, UnitOfWorkContext ctx) {
        return ctx.jdbc().query(
            "SELECT " + COLUMNS + " FROM ledger_transaction WHERE account_id = ? ORDER BY transaction_date, id",
            transactionRowMapper(),
            accountId
        );
    }

    public List<Transaction> findByCreditCard(long creditCardId, UnitOfWorkContext ctx) {
        return ctx.jdbc().query(
            "SELECT " + COLUMNS + " FROM ledger_transaction WHERE credit_card_id = ? ORDER BY transaction_date, id",
            transactionRowMapper(),
            creditCardId
        );
    }

    /**
     * Transactions on every account owned by {@code userId}, ordered by account, then
     * date, then id. Credit card transactions are not included.
     */
    public List<Transaction> findByUser(long userId, UnitOfWorkContext ctx) {
        return ctx.jdbc().query(
            "SELECT " + COLUMNS + " FROM ledger_transaction "
                + "WHERE account_id IN (SELECT id FROM account WHERE user_id = ?) "
                + "ORDER BY account_id, transaction_date, id",
            transactionRowMapper(),
            userId
        );
    }

    public long countByAccount(long accountId, UnitOfWorkContext ctx) {
        Long count = ctx.jdbc().queryForObject(
            "SELECT COUNT(*) FROM ledger_transaction WHERE account_id = ?", Long.class, accountId);
        return count != null ? count : 0L;
    }

    public long countByCreditCard(long creditCardId, UnitOfWorkContext ctx) {
        Long count = ctx.jdbc().queryForObject(
            "SELECT COUNT(*) FROM ledger_transaction WHERE credit_card_id = ?", Long.class, creditCardId);
        return count != null ? count : 0L;
    }

    public long countByUser(long userId, UnitOfWorkContext ctx) {
        Long count = ctx.jdbc().queryForObject(
            "SELECT COUNT(*) FROM ledger_transaction WHERE account_id IN (SELECT id FROM account WHERE user_id = ?)",
            Long.class, userId);
        return count != null ? count : 0L;
    }

    /**
     * Ids of the accounts owned by {@code userId}, ascending.
     */
    public List<Long> findAccountIdsByUser(long userId, UnitOfWorkContext ctx) {
        return ctx.jdbc().queryForList("SELECT id FROM account WHERE user_id = ? ORDER BY id", Long.class, userId);
    }

    /**
     * Binds value through observation in column order, returns the next parameter index.
     */
    private int bindMutableColumns(PreparedStatement ps, Transaction transaction) throws SQLException {
        ps.setString(1, transaction.getValue());
        ps.setObject(2, toOffsetDateTime(transaction.getDate()));
        ps.setString(3, transaction.getTransactionType().name());
        ps.setString(4, transaction.getTransactionSource().name());
        ps.setObject(5, transaction.getAccountId(), Types.BIGINT);
        ps.setObject(6, transaction.getCreditCardId(), Types.BIGINT);
        ps.setObject(7, transaction.getCategoryId(), Types.BIGINT);
        ps.setObject(8, transaction.getSubcategoryId(), Types.BIGINT);
        ps.setBoolean(9, transaction.isInstallment());
        ps.setObject(10, transaction.getTotalMonths(), Types.INTEGER);
        ps.setBoolean(11, transaction.isRecurring());
        ps.setObject(12, transaction.getPaymentDay(), Types.INTEGER);
        ps.setBoolean(13, transaction.isActive());
        ps.setString(14, transaction.getObservation());
        return 15;
    }

    private RowMapper<Transaction> transactionRowMapper() {
        return (rs, rowNum) -> Transaction.builder()
            .id(rs.getLong("id"))
            .value(rs.getBigDecimal("value").toPlainString())
            .date(toInstant(rs.getObject("transaction_date", OffsetDateTime.class)))
            .transactionType(TransactionType.valueOf(rs.getString("transaction_type")))
            .transactionSource(TransactionSource.valueOf(rs.getString("transaction_source")))
            .accountId(rs.getObject("account_id", Long.class))
            .creditCardId(rs.getObject("credit_card_id", Long.class))
            .categoryId(rs.getObject("category_id", Long.class))
            .subcategoryId(rs.getObject("subcategory_id", Long.class))
            .installment(rs.getBoolean("is_installment"))
            .totalMonths(rs.getObject("total_months", Integer.class))
            .recurring(rs.getBoolean("is_recurring"))
            .paymentDay(rs.getObject("payment_day", Integer.class))
            .active(rs.getBoolean("active"))
            .observation(rs.getString("observation"))
            .createdAt(toInstant(rs.getObject("created_at", OffsetDateTime.class)))
            .updatedAt(toInstant(rs.getObject("updated_at", OffsetDateTime.class)))
            .build();
    }

    private static OffsetDateTime toOffsetDateTime(Instant instant) {
        return instant != null ? OffsetDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }
}
