package com.credwallet.backend.modules.system;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.credwallet.backend.support.AbstractPostgresIntegrationTest;
import com.credwallet.backend.support.TestTokens;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class ActuatorIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestTokens testTokens;

    @Test
    void healthIsPublicAndReportsSchema() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));

        mockMvc.perform(get("/actuator/health")
                        .header("Authorization", testTokens.bearer(1L, "ADMIN")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.vaultSchema.status").value("UP"));
    }

    @Test
    void infoExposesAppInfoToAdmins() throws Exception {
        mockMvc.perform(get("/actuator/info")
                        .header("Authorization", testTokens.bearer(1L)))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/actuator/info")
                        .header("Authorization", testTokens.bearer(1L, "ADMIN")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.vault.project_name").value("credwallet"))
                .andExpect(jsonPath("$.vault.schema_version").value("1"));
    }
}
