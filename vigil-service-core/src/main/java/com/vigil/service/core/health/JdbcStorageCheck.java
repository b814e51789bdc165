package com.vigil.service.core.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Round-trips a trivial query; any data access failure counts as unreachable. */
@Slf4j
@RequiredArgsConstructor
public class JdbcStorageCheck implements StorageCheck {

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public String mode() {
        return "jdbc";
    }

    @Override
    public boolean usesDatabase() {
        return true;
    }

    @Override
    public boolean isReachable() {
        try {
            jdbc.getJdbcOperations().queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("Database unreachable: {}", e.getMostSpecificCause().getMessage());
            return false;
        }
    }
}
