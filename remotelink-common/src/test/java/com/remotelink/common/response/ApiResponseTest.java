package com.remotelink.common.response;

import com.remotelink.common.model.ProcessRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApiResponseTest {

    @Test
    void successCases_reportSuccessStatus() {
        ProcessRecord record = ProcessRecord.running(42, "sleep 5", List.of(), Instant.now());
        List<ApiResponse> oks = List.of(
                ApiResponse.success("done"),
                ApiResponse.process("Process started", record),
                ApiResponse.programs(Map.of()),
                ApiResponse.systemInfo(Map.of("name", "pc")),
                ApiResponse.logs("app.log", List.of("a")),
                ApiResponse.noContent());
        for (ApiResponse response : oks) {
            assertInstanceOf(ApiResponse.Ok.class, response);
            assertEquals("success", response.status());
        }
    }

    @Test
    void errorCases_reportErrorStatusAndCode() {
        List<ApiResponse.Error> errors = List.of(
                ApiResponse.notFound("Endpoint 'x'"),
                ApiResponse.invalidFields(List.of("command")),
                ApiResponse.unauthorized("token required"),
                ApiResponse.methodNotAllowed("DELETE", List.of("GET")),
                ApiResponse.internal("ab12cd34"));
        for (ApiResponse.Error error : errors) {
            assertEquals("error", error.status());
            assertNotNull(error.code());
            assertEquals(error.code(), error.toWire().get("code"));
        }
    }

    @Test
    void notFound_usesResourceMessage() {
        ApiResponse.NotFound nf = ApiResponse.notFound(ErrorCodes.COMMAND_NOT_FOUND, "Command 'foo'");
        assertEquals("Command 'foo' not found", nf.message());
        assertEquals(ErrorCodes.COMMAND_NOT_FOUND, nf.code());
    }

    @Test
    void methodNotAllowed_namesExpectedMethods() {
        ApiResponse.MethodNotAllowed error = ApiResponse.methodNotAllowed("GET", List.of("POST"));
        assertEquals("Unsupported method: GET. Expected method: POST", error.message());
        assertEquals(Map.of("allowed", List.of("POST")), error.details());
    }

    @Test
    void toWire_success_omitsNullData() {
        Map<String, Object> wire = ApiResponse.success("hello").toWire();
        assertEquals(List.of("status", "message"), List.copyOf(wire.keySet()));
    }

    @Test
    void toWire_validationError_listsFields() {
        Map<String, Object> wire = ApiResponse.invalidFields(List.of("command", "args")).toWire();
        assertEquals("error", wire.get("status"));
        assertEquals(ErrorCodes.INVALID_PAYLOAD, wire.get("code"));
        assertEquals(Map.of("fields", List.of("command", "args")), wire.get("details"));
        assertTrue(((String) wire.get("message")).contains("command, args"));
    }

    @Test
    void internal_carriesReferenceOnly() {
        ApiResponse.InternalError error = ApiResponse.internal("deadbeef");
        assertEquals("Internal server error (ref deadbeef)", error.message());
        assertEquals(Map.of("reference", "deadbeef"), error.details());
    }

    @Test
    void processInfo_wrapsRecordsUnderProcesses() {
        ProcessRecord record = ProcessRecord.running(7, "echo", List.of("hi"), Instant.now());
        Object data = ApiResponse.process("Process started", record).data();
        assertEquals(Map.of("processes", List.of(record)), data);
    }

    @Test
    void systemInfo_acceptsOrderedMap() {
        ApiResponse.SystemInfoPayload payload = ApiResponse.systemInfo(Map.of("cpu", Map.of("count", 4)));
        assertThrows(UnsupportedOperationException.class, () -> payload.system().put("x", 1));
    }

    @Test
    void exceptions_carryTheirError() {
        ApiException nf = new NotFoundException(ErrorCodes.PROCESS_NOT_FOUND, "Process 9");
        assertInstanceOf(ApiResponse.NotFound.class, nf.getError());
        assertEquals("Process 9 not found", nf.getMessage());

        ApiException auth = new AuthException("token expired");
        assertEquals("Unauthorized access: token expired", auth.getError().message());

        ApiException invalid = ValidationException.field("pid");
        assertEquals(List.of("pid"), ((ApiResponse.ValidationError) invalid.getError()).fields());
    }
}
