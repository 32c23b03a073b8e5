package com.flagship.finance_ledger.lookup;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Runs on the caller's thread and joins whatever database transaction is bound to it.
 */
@Repository
@RequiredArgsConstructor
public class JdbcAccountLookup implements AccountLookup {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<AccountRef> getById(long accountId) {
        return jdbcTemplate.query(
            "SELECT id, user_id, active FROM account WHERE id = ?",
            (rs, rowNum) -> new AccountRef(rs.getLong("id"), rs.getLong("user_id"), rs.getBoolean("active")),
            accountId
        ).stream().findFirst();
    }
}
