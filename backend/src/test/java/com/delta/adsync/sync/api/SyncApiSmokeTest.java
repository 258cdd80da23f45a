package com.delta.adsync.sync.api;

import com.delta.adsync.sync.FakeGraphApi;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.io.IOException;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SyncApiSmokeTest {
    private static final MockWebServer SERVER = new MockWebServer();
    private static final FakeGraphApi GRAPH = new FakeGraphApi();

    @DynamicPropertySource
    static void graphProperties(DynamicPropertyRegistry registry) {
        SERVER.setDispatcher(GRAPH);
        registry.add("adsync.graph.base-url", () -> SERVER.url("/").toString());
    }

    @AfterAll
    static void stopServer() throws IOException {
        SERVER.shutdown();
    }

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        GRAPH.reset();
    }

    @Test
    void runEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/sync/run"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void statusRequiresTenant() throws Exception {
        mockMvc.perform(get("/api/sync/status"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void statusOfUnknownTenantIsEmpty() throws Exception {
        mockMvc.perform(get("/api/sync/status").param("tenantId", "tenant-smoke-empty"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.tenantId").value("tenant-smoke-empty"))
            .andExpect(jsonPath("$.watermarks.length()").value(0))
            .andExpect(jsonPath("$.recentJobs.length()").value(0))
            .andExpect(jsonPath("$.runningAccounts.length()").value(0));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/sync/jobs/999999"))
            .andExpect(status().isNotFound());
    }

    @Test
    void batchResolveRejectsEmptyAdIds() throws Exception {
        mockMvc.perform(post("/api/creatives/resolve-batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tenantId\":\"t\",\"accountId\":\"1\",\"adIds\":[]}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void syncOfUnboundAccountIsReportedPerAccount() throws Exception {
        mockMvc.perform(post("/api/sync/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tenantId\":\"tenant-smoke-run\",\"accountIds\":[\"act_404\"],\"mode\":\"daily\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.accountsRequested").value(1))
            .andExpect(jsonPath("$.accountsFailed").value(1))
            .andExpect(jsonPath("$.accounts[0].externalAccountId").value("404"))
            .andExpect(jsonPath("$.errors[0]").value(containsString("Unknown ad account 404")));
    }

    @Test
    void connectionLifecycleOverHttp() throws Exception {
        mockMvc.perform(post("/api/connections")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tenantId\":\"tenant-smoke\",\"accessToken\":\"EAAB-smoke\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.tenantId").value("tenant-smoke"))
            .andExpect(jsonPath("$.status").value("CONNECTED"))
            .andExpect(jsonPath("$.defaultConnection").value(true))
            .andExpect(jsonPath("$.grantedScopes[1]").value("business_management"))
            .andExpect(jsonPath("$.accessTokenCiphertext").doesNotExist());

        String listed = mockMvc.perform(get("/api/connections").param("tenantId", "tenant-smoke"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andReturn()
            .getResponse()
            .getContentAsString();
        long connectionId = Long.parseLong(listed.replaceAll("(?s).*?\"id\":(\\d+).*", "$1"));

        mockMvc.perform(post("/api/connections/" + connectionId + "/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tenantId\":\"tenant-smoke\",\"accountId\":\"act_31337\",\"name\":\"Smoke\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.externalAccountId").value("31337"))
            .andExpect(jsonPath("$.primaryConnectionId").value(connectionId));

        mockMvc.perform(delete("/api/connections/" + connectionId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("connection_in_use"))
            .andExpect(jsonPath("$.message").value(containsString("primary connection")));

        GRAPH.adAccount("act_31338", "Discovered", "USD", "UTC");
        mockMvc.perform(post("/api/connections/" + connectionId + "/accounts/discover"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].externalAccountId").value("31338"))
            .andExpect(jsonPath("$[0].primaryConnectionId").value(connectionId));

        for (String accountId : new String[]{"31337", "31338"}) {
            mockMvc.perform(delete("/api/connections/" + connectionId + "/accounts/" + accountId).param("tenantId", "tenant-smoke"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.primaryConnectionId").doesNotExist());
        }
        mockMvc.perform(delete("/api/connections/" + connectionId))
            .andExpect(status().isNoContent());
    }

    @Test
    void registrationWithRejectedTokenIsBadRequest() throws Exception {
        GRAPH.rejectToken("EAAB-revoked");

        mockMvc.perform(post("/api/connections")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tenantId\":\"tenant-smoke-bad\",\"accessToken\":\"EAAB-revoked\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("connection_invalid"));
        mockMvc.perform(get("/api/connections").param("tenantId", "tenant-smoke-bad"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void registrationWithoutCredentialIsRejected() throws Exception {
        mockMvc.perform(post("/api/connections")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tenantId\":\"tenant-smoke\"}"))
            .andExpect(status().isBadRequest());
    }
}
