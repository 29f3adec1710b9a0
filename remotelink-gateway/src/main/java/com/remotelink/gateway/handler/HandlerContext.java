package com.remotelink.gateway.handler;

import com.remotelink.common.model.Session;
import com.remotelink.common.response.ValidationException;
import com.remotelink.gateway.dispatch.Request;
import com.remotelink.gateway.registry.EndpointDescriptor;
import jakarta.annotation.Nullable;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * What a handler sees of the request it serves.
 *
 * @param descriptor the matched endpoint
 * @param request    the validated request
 * @param session    the caller's session when a valid token was supplied
 */
public record HandlerContext(EndpointDescriptor descriptor, Request request, @Nullable Session session) {

    public Map<String, Object> payload() {
        return request.payload();
    }

    /** Directory holding the endpoint's private files. */
    public Path baseDir() {
        return descriptor.baseDir();
    }

    @Nullable
    public String string(String name) {
        Object value = payload().get(name);
        return value == null ? null : value.toString();
    }

    public String string(String name, String fallback) {
        String value = string(name);
        return value == null ? fallback : value;
    }

    /**
     * A whole-number field. A value with a fraction or outside the
     * {@code long} range is a validation error on that field.
     */
    @Nullable
    public Long longValue(String name) {
        Object value = payload().get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        try {
            return new BigDecimal(value.toString().trim()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw ValidationException.field(name);
        }
    }

    public long longValue(String name, long fallback) {
        Long value = longValue(name);
        return value == null ? fallback : value;
    }

    public boolean bool(String name, boolean fallback) {
        Object value = payload().get(name);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    /** A list field as strings; a single scalar becomes a one-element list. */
    public List<String> stringList(String name) {
        Object value = payload().get(name);
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                result.add(String.valueOf(item));
            }
        } else if (value != null) {
            result.add(value.toString());
        }
        return result;
    }
}
