package com.flagship.finance_ledger.lookup;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcCreditCardLookup implements CreditCardLookup {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<CreditCardRef> getById(long creditCardId) {
        return jdbcTemplate.query(
            "SELECT id, user_id, active FROM credit_card WHERE id = ?",
            (rs, rowNum) -> new CreditCardRef(rs.getLong("id"), rs.getLong("user_id"), rs.getBoolean("active")),
            creditCardId
        ).stream().findFirst();
    }
}
