package com.flagship.finance_ledger.lookup;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public class JdbcTagLookup implements TagLookup {

    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public JdbcTagLookup(JdbcTemplate jdbcTemplate) {
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    public List<TagRef> findByIdsForUser(Collection<Long> tagIds, long userId, boolean activeOnly) {
        if (tagIds.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT id, user_id, active FROM tag WHERE id IN (:ids) AND user_id = :userId"
            + (activeOnly ? " AND active = TRUE" : "");
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ids", tagIds)
            .addValue("userId", userId);
        return namedJdbcTemplate.query(sql, params,
            (rs, rowNum) -> new TagRef(rs.getLong("id"), rs.getLong("user_id"), rs.getBoolean("active")));
    }
}
