package com.remotelink.common.response;

import java.util.List;

/** Malformed or missing caller input. */
public class ValidationException extends ApiException {

    public ValidationException(List<String> fields) {
        super(ApiResponse.invalidFields(fields));
    }

    public ValidationException(String code, String message) {
        super(ApiResponse.badRequest(code, message));
    }

    public static ValidationException field(String name) {
        return new ValidationException(List.of(name));
    }
}
