package com.remotelink.app.web;

import com.remotelink.common.response.ApiException;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.common.response.ErrorCodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns failures raised before or around dispatch into the same response
 * envelope the dispatcher produces.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionAdvice {

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ApiController.toEntity(ApiResponse.badRequest(ErrorCodes.INVALID_PAYLOAD,
                "request body must be a JSON object"));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return ApiController.toEntity(ApiResponse.badRequest(ErrorCodes.INVALID_PAYLOAD,
                "unsupported content type " + ex.getContentType()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethod(HttpRequestMethodNotSupportedException ex) {
        List<String> allowed = new ArrayList<>();
        if (ex.getSupportedHttpMethods() != null) {
            ex.getSupportedHttpMethods().forEach(m -> allowed.add(m.name()));
        }
        return ApiController.toEntity(ApiResponse.methodNotAllowed(ex.getMethod(), allowed));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoResource(NoResourceFoundException ex) {
        return ApiController.toEntity(ApiResponse.notFound("Resource '/" + ex.getResourcePath() + "'"));
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, Object>> handleApi(ApiException ex) {
        return ApiController.toEntity(ex.getError());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        String reference = UUID.randomUUID().toString().substring(0, 8);
        log.error("Unhandled web error (ref {}): {}", reference, ex.getMessage(), ex);
        return ApiController.toEntity(ApiResponse.internal(reference));
    }
}
