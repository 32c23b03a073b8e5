package com.flagship.finance_ledger.unitofwork;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.TransactionStatus;

/**
 * Handle for one open unit of work.
 *
 * Every store operation that must participate in a mutation takes this handle
 * explicitly. The JDBC templates it hands out are bound to the unit of work's
 * database transaction; using them after the unit of work has completed is a
 * programming error.
 */
public final class UnitOfWorkContext {

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final TransactionStatus status;

    public UnitOfWorkContext(JdbcTemplate jdbcTemplate, TransactionStatus status) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = jdbcTemplate != null ? new NamedParameterJdbcTemplate(jdbcTemplate) : null;
        this.status = status;
    }

    public JdbcTemplate jdbc() {
        ensureOpen();
        return jdbcTemplate;
    }

    public NamedParameterJdbcTemplate namedJdbc() {
        ensureOpen();
        return namedJdbcTemplate;
    }

    public boolean isOpen() {
        return status == null || !status.isCompleted();
    }

    private void ensureOpen() {
        if (!isOpen()) {
            throw new IllegalStateException("Unit of work has already completed");
        }
    }
}
