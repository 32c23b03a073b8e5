package com.flagship.finance_ledger.lookup;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcSubcategoryLookup implements SubcategoryLookup {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<SubcategoryRef> getById(long subcategoryId) {
        return jdbcTemplate.query(
            "SELECT id, category_id, active FROM subcategory WHERE id = ?",
            (rs, rowNum) -> new SubcategoryRef(rs.getLong("id"), rs.getLong("category_id"), rs.getBoolean("active")),
            subcategoryId
        ).stream().findFirst();
    }
}
