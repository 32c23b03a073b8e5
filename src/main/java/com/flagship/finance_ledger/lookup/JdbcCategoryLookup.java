package com.flagship.finance_ledger.lookup;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcCategoryLookup implements CategoryLookup {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<CategoryRef> getById(long categoryId) {
        return jdbcTemplate.query(
            "SELECT id, active FROM category WHERE id = ?",
            (rs, rowNum) -> new CategoryRef(rs.getLong("id"), rs.getBoolean("active")),
            categoryId
        ).stream().findFirst();
    }
}
