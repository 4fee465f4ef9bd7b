package com.credwallet.backend.modules.system.infrastructure;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN when any vault table is missing from the current schema.
 */
@Component("vaultSchema")
public class VaultSchemaHealthIndicator extends AbstractHealthIndicator {

    static final List<String> REQUIRED_TABLES = List.of(
            "users",
            "credentials",
            "shares",
            "ekyc_sessions",
            "audit_logs"
    );

    private static final String EXISTING_TABLES_SQL = """
            SELECT table_name
            FROM information_schema.tables
            WHERE table_schema = current_schema()
            """;

    private final JdbcTemplate jdbcTemplate;

    public VaultSchemaHealthIndicator(JdbcTemplate jdbcTemplate) {
        super("Vault schema check failed");
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        Set<String> existing = new TreeSet<>(jdbcTemplate.queryForList(EXISTING_TABLES_SQL, String.class));
        List<String> missing = REQUIRED_TABLES.stream()
                .filter(table -> !existing.contains(table))
                .toList();

        if (missing.isEmpty()) {
            builder.up().withDetail("tables", REQUIRED_TABLES);
        } else {
            builder.down().withDetail("missingTables", missing);
        }
    }
}
