package com.remotelink.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the RemoteLink client.
 * <p>
 * Real server on a random port, no mocks: HTTP → controller → dispatcher →
 * registry/auth → handler → response envelope. Endpoints come from the
 * shipped {@code config/endpoints} tree, commands from the test tree.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class AppEndToEndTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private final ObjectMapper mapper = new ObjectMapper();

    // ── helpers ─────────────────────────────────────────────────

    private ResponseEntity<String> get(String path, String token) {
        return restTemplate.exchange(path, HttpMethod.GET, new HttpEntity<>(headers(token)), String.class);
    }

    private ResponseEntity<String> post(String path, Object body, String token) throws Exception {
        return restTemplate.exchange(path, HttpMethod.POST,
                new HttpEntity<>(mapper.writeValueAsString(body), headers(token)), String.class);
    }

    private static HttpHeaders headers(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (token != null) {
            headers.setBearerAuth(token);
        }
        return headers;
    }

    private JsonNode json(ResponseEntity<String> response) throws Exception {
        assertNotNull(response.getBody(), "expected a JSON body");
        return mapper.readTree(response.getBody());
    }

    private String login() throws Exception {
        ResponseEntity<String> response = post("/api/login",
                Map.of("username", "admin", "password", "secret"), null);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return json(response).path("data").path("token").asText();
    }

    // ── liveness ────────────────────────────────────────────────

    @Test
    void test_reportsRunningClient() throws Exception {
        ResponseEntity<String> response = get("/api/test", null);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        JsonNode body = json(response);
        assertEquals("success", body.get("status").asText());
        assertEquals("APIRest is running", body.get("message").asText());
        assertEquals("test-client", body.path("data").path("name").asText());
        assertEquals(5000, body.path("data").path("port").asInt());
    }

    @Test
    void options_isNoContent() {
        ResponseEntity<String> response = restTemplate.exchange("/api/test", HttpMethod.OPTIONS,
                HttpEntity.EMPTY, String.class);

        assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode());
        assertNull(response.getBody());
    }

    @Test
    void corsPreflight_fromAllowedOrigin_isNoContent() {
        HttpHeaders headers = new HttpHeaders();
        headers.setOrigin("http://localhost:3000");
        headers.setAccessControlRequestMethod(HttpMethod.POST);
        headers.add(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "Content-Type, Authorization");

        ResponseEntity<String> response = restTemplate.exchange("/api/login", HttpMethod.OPTIONS,
                new HttpEntity<>(headers), String.class);

        assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode());
        assertEquals("http://localhost:3000", response.getHeaders().getAccessControlAllowOrigin());
        assertTrue(response.getHeaders().getAccessControlAllowMethods().contains(HttpMethod.POST));
        assertNull(response.getBody());
    }

    @Test
    void corsPreflight_fromUnknownOrigin_isForbidden() {
        HttpHeaders headers = new HttpHeaders();
        headers.setOrigin("http://evil.example");
        headers.setAccessControlRequestMethod(HttpMethod.GET);

        ResponseEntity<String> response = restTemplate.exchange("/api/test", HttpMethod.OPTIONS,
                new HttpEntity<>(headers), String.class);

        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
        assertNull(response.getHeaders().getAccessControlAllowOrigin());
    }

    @Test
    void health_reportsStatusAndCheckTime() throws Exception {
        JsonNode data = json(get("/api/health", null)).path("data");

        assertEquals("test-client", data.path("name").asText());
        assertTrue(data.path("status").asText().matches("healthy|degraded"));
        assertFalse(data.path("last_health_check").asText().isEmpty());
    }

    @Test
    void getTime_returnsLocalTimeAsMessage() throws Exception {
        JsonNode body = json(get("/api/get_time", null));
        assertTrue(body.get("message").asText().matches("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}"));
    }

    // ── command endpoint ────────────────────────────────────────

    @Test
    void command_restartService_isExecuted() throws Exception {
        ResponseEntity<String> response = post("/api/command",
                Map.of("command", "restart_service", "message", "go"), null);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        JsonNode body = json(response);
        assertEquals("success", body.get("status").asText());
        assertEquals("Command executed", body.get("message").asText());
        assertEquals("restart_service", body.path("data").path("command").asText());
        JsonNode process = body.path("data").path("result");
        assertEquals("echo", process.path("command").asText());
        assertEquals("go", process.path("args").get(1).asText());
        assertTrue(process.path("pid").asLong() > 0);
    }

    @Test
    void command_missingName_isBadRequest() throws Exception {
        ResponseEntity<String> response = post("/api/command", Map.of("message", "go"), null);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        JsonNode body = json(response);
        assertEquals("error", body.get("status").asText());
        assertEquals("command", body.path("details").path("fields").get(0).asText());
    }

    @Test
    void command_unknown_isNotFound() throws Exception {
        ResponseEntity<String> response = post("/api/command", Map.of("command", "warp_drive"), null);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("COMMAND_NOT_FOUND", json(response).get("code").asText());
    }

    @Test
    void command_action_returnsItsResult() throws Exception {
        JsonNode body = json(post("/api/command", Map.of("command", "test_command", "message", "hello"), null));
        assertEquals("hello", body.path("data").path("result").path("message").asText());
    }

    @Test
    void command_missingDeclaredArg_isBadRequest() throws Exception {
        ResponseEntity<String> response = post("/api/command", Map.of("command", "needs_count"), null);
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void command_protected_needsSession() throws Exception {
        assertEquals(HttpStatus.UNAUTHORIZED,
                post("/api/command", Map.of("command", "guarded"), null).getStatusCode());
        assertEquals(HttpStatus.OK,
                post("/api/command", Map.of("command", "guarded"), login()).getStatusCode());
    }

    @Test
    void command_actionFailure_isSanitizedInternalError() throws Exception {
        ResponseEntity<String> response = post("/api/command", Map.of("command", "explode"), null);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        String message = json(response).get("message").asText();
        assertTrue(message.startsWith("Internal server error (ref "));
        assertFalse(message.contains("relay"));
    }

    @Test
    void commands_listsCatalog() throws Exception {
        JsonNode commands = json(get("/api/commands", null)).path("data").path("commands");

        assertTrue(commands.isArray());
        boolean found = false;
        for (JsonNode command : commands) {
            if ("restart_service".equals(command.path("name").asText())) {
                found = true;
                assertEquals("process", command.path("type").asText());
            }
        }
        assertTrue(found);
    }

    // ── dispatch errors ─────────────────────────────────────────

    @Test
    void unknownEndpoint_isNotFound() throws Exception {
        ResponseEntity<String> response = get("/api/does_not_exist", null);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("ENDPOINT_NOT_FOUND", json(response).get("code").asText());
    }

    @Test
    void undeclaredMethod_isMethodNotAllowed() throws Exception {
        ResponseEntity<String> response = get("/api/command", null);

        assertEquals(HttpStatus.METHOD_NOT_ALLOWED, response.getStatusCode());
        assertEquals("POST", json(response).path("details").path("allowed").get(0).asText());
    }

    @Test
    void malformedBody_isBadRequest() throws Exception {
        ResponseEntity<String> response = restTemplate.exchange("/api/command", HttpMethod.POST,
                new HttpEntity<>("{ not json", headers(null)), String.class);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("error", json(response).get("status").asText());
    }

    // ── auth ────────────────────────────────────────────────────

    @Test
    void protectedEndpoints_rejectMissingAndForgedTokens() throws Exception {
        assertEquals(HttpStatus.UNAUTHORIZED, get("/api/list", null).getStatusCode());
        assertEquals(HttpStatus.UNAUTHORIZED, get("/api/list", "forged-token").getStatusCode());
        assertEquals(HttpStatus.UNAUTHORIZED, get("/api/system", null).getStatusCode());
    }

    @Test
    void login_wrongPassword_isUnauthorized() throws Exception {
        ResponseEntity<String> response = post("/api/login",
                Map.of("username", "admin", "password", "nope"), null);

        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
        assertEquals("INVALID_CREDENTIALS", json(response).get("code").asText());
    }

    @Test
    void tokenHeader_andPayloadField_areAccepted() throws Exception {
        String token = login();

        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Auth-Token", token);
        ResponseEntity<String> viaHeader = restTemplate.exchange("/api/list", HttpMethod.GET,
                new HttpEntity<>(headers), String.class);
        assertEquals(HttpStatus.OK, viaHeader.getStatusCode());

        assertEquals(HttpStatus.OK, get("/api/list?token=" + token, null).getStatusCode());
    }

    @Test
    void logout_thenTokenIsRejected() throws Exception {
        String token = login();

        assertEquals(HttpStatus.OK, post("/api/logout", Map.of(), token).getStatusCode());
        assertEquals(HttpStatus.UNAUTHORIZED, get("/api/list", token).getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, post("/api/logout", Map.of(), token).getStatusCode());
    }

    // ── processes ───────────────────────────────────────────────

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void executeListKill_flow() throws Exception {
        String token = login();

        JsonNode started = json(post("/api/execute", Map.of("command", "sleep 5"), token));
        assertEquals("Process started", started.get("message").asText());
        JsonNode record = started.path("data").path("processes").get(0);
        long pid = record.path("pid").asLong();
        assertEquals("running", record.path("state").asText());

        JsonNode listed = json(get("/api/list", token)).path("data").path("processes");
        boolean running = false;
        for (JsonNode p : listed) {
            if (p.path("pid").asLong() == pid) {
                running = "running".equals(p.path("state").asText());
                assertEquals("sleep 5", p.path("command").asText());
            }
        }
        assertTrue(running);

        JsonNode killed = json(post("/api/kill", Map.of("pid", pid), token));
        assertEquals("Process killed", killed.get("message").asText());
        assertEquals("killed", killed.path("data").path("processes").get(0).path("state").asText());

        ResponseEntity<String> again = post("/api/kill", Map.of("pid", pid), token);
        assertEquals(HttpStatus.NOT_FOUND, again.getStatusCode());
        assertEquals("PROCESS_NOT_FOUND", json(again).get("code").asText());
    }

    @Test
    void kill_unknownPid_isNotFound() throws Exception {
        ResponseEntity<String> response = post("/api/kill", Map.of("pid", 999_999_999), login());
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    void execute_withoutSession_hasNoEffect() throws Exception {
        String token = login();
        int before = json(get("/api/list", token)).path("data").path("processes").size();

        assertEquals(HttpStatus.UNAUTHORIZED,
                post("/api/execute", Map.of("command", "sleep 5"), null).getStatusCode());

        assertEquals(before, json(get("/api/list", token)).path("data").path("processes").size());
    }

    // ── supplementary endpoints ─────────────────────────────────

    @Test
    void programs_servesPrivateCatalog() throws Exception {
        JsonNode body = json(get("/api/programs", null));

        assertEquals("Program operation successful", body.get("message").asText());
        assertEquals("Notepad", body.path("data").path("programs").path("notepad").path("name").asText());
    }

    @Test
    void tree_showsNestedPaths() throws Exception {
        JsonNode data = json(get("/api/tree", null)).path("data");

        assertEquals("simple", data.path("tree").path("processes").path("execute").asText());
        assertEquals("complex", data.path("tree").path("programs").asText());
        assertTrue(data.path("endpoints").size() >= 10);
    }

    @Test
    void system_withSession_describesHost() throws Exception {
        JsonNode data = json(get("/api/system", login())).path("data");

        assertTrue(data.path("cpu").path("count").asInt() > 0);
        assertTrue(data.has("memory"));
    }

    @Test
    void logs_returnsTailOfConfiguredFile() throws Exception {
        JsonNode data = json(get("/api/logs?lines=2", login())).path("data");

        assertEquals("sample.log", data.path("source").asText());
        assertEquals(2, data.path("lines").size());
        assertEquals("line four", data.path("lines").get(1).asText());
    }
}
