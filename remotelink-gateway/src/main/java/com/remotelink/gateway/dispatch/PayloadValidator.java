package com.remotelink.gateway.dispatch;

import com.remotelink.common.response.ValidationException;
import com.remotelink.gateway.registry.ParamSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks a payload against declared parameters.
 */
public final class PayloadValidator {

    private PayloadValidator() {
    }

    /**
     * Names of fields that are required but missing, or present with the
     * wrong type, in declaration order.
     */
    public static List<String> invalidFields(List<ParamSpec> params, Map<String, Object> payload) {
        List<String> invalid = new ArrayList<>();
        for (ParamSpec param : params) {
            Object value = payload.get(param.name());
            if (value == null || (value instanceof CharSequence s && s.toString().isBlank())) {
                if (param.required()) {
                    invalid.add(param.name());
                }
                continue;
            }
            if (!param.type().accepts(value)) {
                invalid.add(param.name());
            }
        }
        return invalid;
    }

    /**
     * @throws ValidationException listing every offending field
     */
    public static void validate(List<ParamSpec> params, Map<String, Object> payload) {
        List<String> invalid = invalidFields(params, payload);
        if (!invalid.isEmpty()) {
            throw new ValidationException(invalid);
        }
    }
}
