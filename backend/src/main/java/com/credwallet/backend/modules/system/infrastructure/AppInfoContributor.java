package com.credwallet.backend.modules.system.infrastructure;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.info.Info;
import org.springframework.boot.actuate.info.InfoContributor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Component;

/**
 * Publishes the key/value rows of {@code app_info} under {@code vault} on the info endpoint.
 */
@Component
public class AppInfoContributor implements InfoContributor {

    private static final Logger log = LoggerFactory.getLogger(AppInfoContributor.class);

    private final JdbcTemplate jdbcTemplate;

    public AppInfoContributor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void contribute(Info.Builder builder) {
        Map<String, String> entries = new LinkedHashMap<>();
        try {
            jdbcTemplate.query("SELECT key, value FROM app_info ORDER BY key",
                    (RowCallbackHandler) rs -> entries.put(rs.getString("key"), rs.getString("value")));
        } catch (DataAccessException ex) {
            log.warn("Unable to read app_info: {}", ex.getMessage());
            builder.withDetail("vault", Map.of("available", false));
            return;
        }
        builder.withDetail("vault", entries);
    }
}
