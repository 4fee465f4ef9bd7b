package com.credwallet.backend.modules.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.List;

import com.credwallet.backend.modules.credential.application.CredentialService;
import com.credwallet.backend.modules.identity.domain.VaultUser;
import com.credwallet.backend.support.AbstractPostgresIntegrationTest;
import com.credwallet.backend.support.TestTokens;
import com.credwallet.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
class AuditLogControllerIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private TestTokens testTokens;

    @Autowired
    private CredentialService credentialService;

    private VaultUser alice;
    private VaultUser bob;
    private VaultUser admin;

    @BeforeEach
    void setUp() {
        alice = testUserFactory.createUser("alice");
        bob = testUserFactory.createUser("bob");
        admin = testUserFactory.createAdmin("root");
        for (int i = 0; i < 5; i++) {
            credentialService.create(alice.getId(), "alice-" + i, null, new byte[]{1}, null);
        }
        credentialService.create(bob.getId(), "bob-0", null, new byte[]{1}, null);
    }

    @Test
    void regularUserOnlySeesOwnEntriesWhateverTheFilter() throws Exception {
        mockMvc.perform(get("/audit-logs")
                        .param("userId", String.valueOf(alice.getId()))
                        .header("Authorization", testTokens.bearer(bob.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(2))
                .andExpect(jsonPath("$.items[0].action").value("credential.create"))
                .andExpect(jsonPath("$.items[0].userId").value(bob.getId()))
                .andExpect(jsonPath("$.items[1].action").value("user.register"));
    }

    @Test
    void adminPagesThroughAnotherUsersEntriesNewestFirst() throws Exception {
        List<Long> ids = new ArrayList<>();
        String pageToken = null;
        int pages = 0;
        do {
            MockHttpServletRequestBuilder request = get("/audit-logs")
                    .param("userId", String.valueOf(alice.getId()))
                    .param("action", "credential.")
                    .param("size", "2")
                    .header("Authorization", testTokens.bearer(admin.getId()));
            if (pageToken != null) {
                request.param("pageToken", pageToken);
            }
            String content = mockMvc.perform(request)
                    .andExpect(status().isOk())
                    .andReturn()
                    .getResponse()
                    .getContentAsString();
            JsonNode body = objectMapper.readTree(content);
            body.get("items").forEach(item -> ids.add(item.get("id").asLong()));
            JsonNode next = body.get("nextPageToken");
            pageToken = next == null || next.isNull() ? null : next.asText();
            pages++;
        } while (pageToken != null);

        assertThat(pages).isEqualTo(3);
        assertThat(ids).hasSize(5).doesNotHaveDuplicates().isSortedAccordingTo((a, b) -> Long.compare(b, a));
    }

    @Test
    void malformedPageTokenIsRejected() throws Exception {
        mockMvc.perform(get("/audit-logs")
                        .param("pageToken", "%%%")
                        .header("Authorization", testTokens.bearer(alice.getId())))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_PAGE_TOKEN"));
    }
}
