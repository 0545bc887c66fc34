package io.github.samzhu.medlog.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * End-to-end tests of the HTTP API against a temporary storage document.
 *
 * <p>The application context is shared across tests, so every test works with
 * freshly issued codes and never assumes an empty store.
 */
@SpringBootTest
@AutoConfigureMockMvc
class MedlogApiIntegrationTest {

    private static final String ADMIN_TOKEN = "test-admin-token";

    private static Path dataFile;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @DynamicPropertySource
    static void medlogProperties(DynamicPropertyRegistry registry) {
        try {
            dataFile = Files.createTempDirectory("medlog-it").resolve("storage.json");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        registry.add("medlog.storage.data-file", () -> dataFile.toString());
        registry.add("medlog.migration.run-on-startup", () -> "false");
        registry.add("medlog.migration.cron", () -> "-");
        registry.add("medlog.admin.token", () -> ADMIN_TOKEN);
        registry.add("medlog.cors.allowed-origins", () -> "https://app.example.com");
    }

    @Test
    void shouldIssueCodeAndStableToken() throws Exception {
        // Given
        String code = generateCode();

        // When
        String first = generateToken(code);
        String second = generateToken(code);

        // Then
        assertThat(code).matches("[A-Z0-9]{6}");
        assertThat(first).matches("[0-9a-f]{64}").isEqualTo(second);
        mockMvc.perform(get("/code").header(HttpHeaders.AUTHORIZATION, "Bearer " + first))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(code));
    }

    @Test
    void shouldLoginWithKnownCodeAndRejectUnknownOrMissingCode() throws Exception {
        String code = generateCode();

        mockMvc.perform(post("/login").contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\":\"" + code + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));

        mockMvc.perform(post("/login").contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\":\"NOPE00\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid code"));

        mockMvc.perform(post("/generate-token").contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Code is required"));
    }

    @Test
    void shouldStoreEventOnceAndListIt() throws Exception {
        // Given
        String token = generateToken(generateCode());
        String body = eventBody("evt-1", "2026-02-21T14:30:00.000Z", "spray", 2);

        // When
        mockMvc.perform(post("/events").header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("saved"));
        mockMvc.perform(post("/events").header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("skipped"));

        // Then
        mockMvc.perform(get("/events").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.events", hasSize(1)))
            .andExpect(jsonPath("$.events[0].id").value("evt-1"))
            .andExpect(jsonPath("$.events[0].date").value("2026-02-21"))
            .andExpect(jsonPath("$.events[0].timestamp").value("2026-02-21T14:30:00.000Z"))
            .andExpect(jsonPath("$.events[0].type").value("spray"))
            .andExpect(jsonPath("$.events[0].count").value(2))
            .andExpect(jsonPath("$.events[0].preventive").value(false))
            .andExpect(jsonPath("$.events[0].received_at").isString());
    }

    @Test
    void shouldRejectMissingMalformedAndUnknownBearerTokens() throws Exception {
        mockMvc.perform(get("/events"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Authorization header required"));

        mockMvc.perform(get("/events").header(HttpHeaders.AUTHORIZATION, "Token abc"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Invalid authorization format. Use: Bearer <token>"));

        mockMvc.perform(get("/logs").header(HttpHeaders.AUTHORIZATION, "Bearer deadbeef"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Invalid token"));
    }

    @Test
    void shouldRejectInvalidEventFields() throws Exception {
        String token = generateToken(generateCode());

        mockMvc.perform(post("/events").header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content(eventBody("evt-t", "not-a-timestamp", "spray", 1)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value(containsString("timestamp")));

        mockMvc.perform(post("/events").header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content(eventBody("evt-c", "2026-02-21T14:30:00.000Z", "spray", 0)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value(containsString("Validation error in 'count'")));

        mockMvc.perform(post("/events").header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content(eventBody("evt-x", "2026-02-21T14:30:00.000Z", "aspirin", 1)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value(containsString("Validation error in 'type'")));

        mockMvc.perform(post("/events").header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("'event' (object) is required"));
    }

    @Test
    void shouldAcceptLegacyLogByTokenOrByCode() throws Exception {
        // Given
        String code = generateCode();
        String token = generateToken(code);

        // When: token 驗證
        mockMvc.perform(post("/logs").header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"log\":{\"date\":\"2026-01-15\",\"spray\":1}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("saved"));

        // When: body 中的代碼
        mockMvc.perform(post("/logs").contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\":\"" + code + "\",\"log\":{\"date\":\"2026-01-16\",\"ventoline\":2}}"))
            .andExpect(status().isOk());

        // Then
        mockMvc.perform(get("/logs").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.logs", hasSize(2)))
            .andExpect(jsonPath("$.logs[0].spray").value(1))
            .andExpect(jsonPath("$.logs[0].ventoline").value(0))
            .andExpect(jsonPath("$.logs[1].date").value("2026-01-16"));
    }

    @Test
    void shouldRejectLegacyLogWithoutValidAuthOrCounts() throws Exception {
        String validLog = "\"log\":{\"date\":\"2026-01-15\",\"spray\":1}";

        mockMvc.perform(post("/logs").contentType(MediaType.APPLICATION_JSON)
                .content("{" + validLog + "}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Either 'code' in body or 'Authorization' header is required"));

        mockMvc.perform(post("/logs").contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\":\"NOPE00\"," + validLog + "}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unknown code"));

        String code = generateCode();
        mockMvc.perform(post("/logs").header(HttpHeaders.AUTHORIZATION, "Bearer deadbeef")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\":\"" + code + "\"," + validLog + "}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Invalid token"));

        mockMvc.perform(post("/logs").contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\":\"" + code + "\",\"log\":{\"date\":\"2026-01-15\",\"spray\":0}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error")
                .value("Validation error in 'log': At least one medicine type must have a non-zero count"));
    }

    @Test
    void shouldMigrateLegacyLogsThroughAdminEndpoint() throws Exception {
        // Given
        String token = generateToken(generateCode());
        mockMvc.perform(post("/logs").header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"log\":{\"date\":\"2026-01-15\",\"spray\":1,\"ventoline\":2}}"))
            .andExpect(status().isOk());

        // When
        mockMvc.perform(post("/admin/migrate-logs"))
            .andExpect(status().isForbidden());
        mockMvc.perform(post("/admin/migrate-logs").header("X-Admin-Token", ADMIN_TOKEN))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.legacy_logs").isNumber())
            .andExpect(jsonPath("$.created_events").isNumber())
            .andExpect(jsonPath("$.skipped_existing").isNumber())
            .andExpect(jsonPath("$.skipped_invalid").isNumber())
            .andExpect(jsonPath("$.createdEvents").doesNotExist());

        // Then
        mockMvc.perform(get("/events").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.events", hasSize(2)))
            .andExpect(jsonPath("$.events[0].type").value("spray"))
            .andExpect(jsonPath("$.events[1].type").value("ventoline"))
            .andExpect(jsonPath("$.events[1].count").value(2))
            .andExpect(jsonPath("$.events[0].timestamp").value("2026-01-15T12:00:00.000Z"))
            .andExpect(jsonPath("$.events[0].id").value(matchesPattern("[0-9a-f-]{36}")));
    }

    @Test
    void shouldReportHealthAndHonourCorsOrigins() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.version").value("0.1.0"));

        mockMvc.perform(options("/events")
                .header(HttpHeaders.ORIGIN, "https://app.example.com")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
            .andExpect(status().isOk())
            .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "https://app.example.com"))
            .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true"));

        mockMvc.perform(options("/events")
                .header(HttpHeaders.ORIGIN, "https://evil.example.com")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
            .andExpect(status().isForbidden());
    }

    private String generateCode() throws Exception {
        String response = mockMvc.perform(post("/generate-code"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).get("code").asText();
    }

    private String generateToken(String code) throws Exception {
        String response = mockMvc.perform(post("/generate-token").contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\":\"" + code + "\"}"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        JsonNode node = objectMapper.readTree(response);
        return node.get("token").asText();
    }

    private static String eventBody(String id, String timestamp, String type, int count) {
        return String.format(
            "{\"event\":{\"id\":\"%s\",\"date\":\"2026-02-21\",\"timestamp\":\"%s\",\"type\":\"%s\",\"count\":%d}}",
            id, timestamp, type, count);
    }
}
