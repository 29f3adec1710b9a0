package com.remotelink.gateway.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.common.response.ErrorCodes;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;

/**
 * Turns whatever a handler returned into a taxonomy response.
 */
@Slf4j
public final class ResponseNormalizer {

    static final String DEFAULT_MESSAGE = "OK";

    private ResponseNormalizer() {
    }

    public static ApiResponse normalize(Object result, String endpointName) {
        if (result instanceof ApiResponse response) {
            return response;
        }
        if (result instanceof CharSequence text) {
            return ApiResponse.success(text.toString());
        }
        if (result instanceof Map<?, ?> || result instanceof Collection<?> || result instanceof JsonNode
                || result instanceof Number || result instanceof Boolean
                || (result != null && result.getClass().isRecord())) {
            return ApiResponse.success(DEFAULT_MESSAGE, result);
        }
        String type = result == null ? "null" : result.getClass().getName();
        log.error("Endpoint '{}' returned an unrecognized result type: {}", endpointName, type);
        return ApiResponse.internal(ErrorCodes.UNRECOGNIZED_RESULT,
                "endpoint '" + endpointName + "' returned an unrecognized result");
    }
}
