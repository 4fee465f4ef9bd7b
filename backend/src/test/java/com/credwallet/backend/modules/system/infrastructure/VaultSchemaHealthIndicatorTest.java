package com.credwallet.backend.modules.system.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class VaultSchemaHealthIndicatorTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    void upWhenEveryTableExists() {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class)))
                .thenReturn(List.of("app_info", "users", "credentials", "shares", "ekyc_sessions", "audit_logs"));

        Health health = new VaultSchemaHealthIndicator(jdbcTemplate).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void downListsMissingTables() {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class)))
                .thenReturn(List.of("users", "credentials"));

        Health health = new VaultSchemaHealthIndicator(jdbcTemplate).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails().get("missingTables"))
                .isEqualTo(List.of("shares", "ekyc_sessions", "audit_logs"));
    }

    @Test
    void downWhenStoreIsUnreachable() {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThat(new VaultSchemaHealthIndicator(jdbcTemplate).health().getStatus()).isEqualTo(Status.DOWN);
    }
}
