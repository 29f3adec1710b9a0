package com.remotelink.common.response;

import com.remotelink.common.model.ProcessRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed set of response shapes produced by every endpoint.
 * <p>
 * Two branches: {@link Ok} (status {@code success}) and {@link Error}
 * (status {@code error}). Each concrete shape is a record case; new payload
 * shapes are added as new cases. Build responses only through the static
 * factories below so a case and its status can never disagree.
 * <p>
 * Wire shape:
 * <ul>
 * <li>{@code {"status":"success","message":...,"data":...}}</li>
 * <li>{@code {"status":"error","message":...,"code":...,"details":...}}</li>
 * </ul>
 */
public sealed interface ApiResponse permits ApiResponse.Ok, ApiResponse.Error {

    String STATUS_SUCCESS = "success";
    String STATUS_ERROR = "error";

    String status();

    String message();

    /** JSON body for this response, as an ordered map ready for Jackson. */
    Map<String, Object> toWire();

    // ── Success branch ──────────────────────────────────────────

    sealed interface Ok extends ApiResponse
            permits Success, ProcessInfo, ProgramInfo, SystemInfoPayload, LogPayload, NoContent {

        Object data();

        @Override
        default String status() {
            return STATUS_SUCCESS;
        }

        @Override
        default Map<String, Object> toWire() {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", status());
            body.put("message", message());
            Object data = data();
            if (data != null) {
                body.put("data", data);
            }
            return body;
        }
    }

    /** Generic success with optional free-form data. */
    record Success(String message, Object data) implements Ok {
    }

    /** One or more process records from the command executor. */
    record ProcessInfo(String message, List<ProcessRecord> processes) implements Ok {
        public ProcessInfo {
            processes = List.copyOf(processes);
        }

        @Override
        public Object data() {
            return Map.of("processes", processes);
        }
    }

    /** Program catalog entries keyed by program id. */
    record ProgramInfo(String message, Map<String, Object> programs) implements Ok {
        public ProgramInfo {
            programs = Collections.unmodifiableMap(new LinkedHashMap<>(programs));
        }

        @Override
        public Object data() {
            return Map.of("programs", programs);
        }
    }

    /** Host information (cpu, memory, disk, os). */
    record SystemInfoPayload(String message, Map<String, Object> system) implements Ok {
        public SystemInfoPayload {
            system = Collections.unmodifiableMap(new LinkedHashMap<>(system));
        }

        @Override
        public Object data() {
            return system;
        }
    }

    /** Log lines read from a log source. */
    record LogPayload(String message, String source, List<String> lines) implements Ok {
        public LogPayload {
            lines = List.copyOf(lines);
        }

        @Override
        public Object data() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("source", source);
            data.put("lines", lines);
            return data;
        }
    }

    /** Empty answer, used for CORS preflight. */
    record NoContent() implements Ok {
        @Override
        public String message() {
            return "";
        }

        @Override
        public Object data() {
            return null;
        }
    }

    // ── Error branch ────────────────────────────────────────────

    sealed interface Error extends ApiResponse
            permits NotFound, ValidationError, AuthError, MethodNotAllowed, InternalError {

        String code();

        /** Optional structured detail; null when there is none. */
        default Object details() {
            return null;
        }

        @Override
        default String status() {
            return STATUS_ERROR;
        }

        @Override
        default Map<String, Object> toWire() {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", status());
            body.put("message", message());
            body.put("code", code());
            Object details = details();
            if (details != null) {
                body.put("details", details);
            }
            return body;
        }
    }

    record NotFound(String code, String message) implements Error {
    }

    record ValidationError(String code, String message, List<String> fields) implements Error {
        public ValidationError {
            fields = List.copyOf(fields);
        }

        @Override
        public Object details() {
            return fields.isEmpty() ? null : Map.of("fields", fields);
        }
    }

    record AuthError(String code, String message) implements Error {
    }

    record MethodNotAllowed(String code, String message, List<String> allowed) implements Error {
        public MethodNotAllowed {
            allowed = List.copyOf(allowed);
        }

        @Override
        public Object details() {
            return Map.of("allowed", allowed);
        }
    }

    record InternalError(String code, String message, String reference) implements Error {
        @Override
        public Object details() {
            return reference == null ? null : Map.of("reference", reference);
        }
    }

    // ── Factories ───────────────────────────────────────────────

    static Success success(String message) {
        return new Success(message, null);
    }

    static Success success(String message, Object data) {
        return new Success(message, data);
    }

    static ProcessInfo process(String message, ProcessRecord record) {
        return new ProcessInfo(message, List.of(record));
    }

    static ProcessInfo processes(String message, List<ProcessRecord> records) {
        return new ProcessInfo(message, records);
    }

    static ProgramInfo programs(Map<String, Object> programs) {
        return new ProgramInfo("Program operation successful", programs);
    }

    static SystemInfoPayload systemInfo(Map<String, Object> system) {
        return new SystemInfoPayload("System information", system);
    }

    static LogPayload logs(String source, List<String> lines) {
        return new LogPayload("System logs retrieved", source, lines);
    }

    static NoContent noContent() {
        return new NoContent();
    }

    static NotFound notFound(String resource) {
        return new NotFound(ErrorCodes.NOT_FOUND, resource + " not found");
    }

    static NotFound notFound(String code, String resource) {
        return new NotFound(code, resource + " not found");
    }

    static ValidationError invalidFields(List<String> fields) {
        return new ValidationError(ErrorCodes.INVALID_PAYLOAD,
                "Missing or invalid field(s): " + String.join(", ", fields), fields);
    }

    static ValidationError badRequest(String message) {
        return new ValidationError(ErrorCodes.INVALID_REQUEST, "Bad request: " + message, List.of());
    }

    static ValidationError badRequest(String code, String message) {
        return new ValidationError(code, "Bad request: " + message, List.of());
    }

    static AuthError unauthorized(String message) {
        return new AuthError(ErrorCodes.UNAUTHORIZED, "Unauthorized access: " + message);
    }

    static AuthError unauthorized(String code, String message) {
        return new AuthError(code, "Unauthorized access: " + message);
    }

    static MethodNotAllowed methodNotAllowed(String method, List<String> allowed) {
        return new MethodNotAllowed(ErrorCodes.METHOD_NOT_ALLOWED,
                "Unsupported method: " + method + ". Expected method: " + String.join(", ", allowed),
                allowed);
    }

    static InternalError internal(String reference) {
        return new InternalError(ErrorCodes.INTERNAL,
                "Internal server error (ref " + reference + ")", reference);
    }

    static InternalError internal(String code, String message) {
        return new InternalError(code, "Internal server error: " + message, null);
    }
}
