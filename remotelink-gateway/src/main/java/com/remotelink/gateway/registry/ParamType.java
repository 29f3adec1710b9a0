package com.remotelink.gateway.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * JSON type a declared payload field must have.
 * <p>
 * Query-string values arrive as text, so numeric and boolean types also
 * accept a string that parses as that type.
 */
public enum ParamType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT,
    ANY;

    @JsonCreator
    public static ParamType fromJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return ANY;
        }
        String key = raw.trim().toUpperCase(Locale.ROOT);
        return switch (key) {
            case "STR" -> STRING;
            case "INT", "LONG" -> INTEGER;
            case "FLOAT", "DOUBLE" -> NUMBER;
            case "BOOL" -> BOOLEAN;
            case "LIST" -> ARRAY;
            case "MAP", "DICT" -> OBJECT;
            default -> valueOf(key);
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof CharSequence;
            case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short
                    || (value instanceof BigInteger b && b.bitLength() < Long.SIZE)
                    || (value instanceof CharSequence s && isLong(s.toString()));
            case NUMBER -> value instanceof Number
                    || (value instanceof CharSequence s && isDecimal(s.toString()));
            case BOOLEAN -> value instanceof Boolean
                    || (value instanceof CharSequence s
                            && ("true".equalsIgnoreCase(s.toString()) || "false".equalsIgnoreCase(s.toString())));
            case ARRAY -> value instanceof Collection<?> || (value != null && value.getClass().isArray());
            case OBJECT -> value instanceof Map<?, ?>;
            case ANY -> true;
        };
    }

    private static boolean isLong(String s) {
        try {
            Long.parseLong(s.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isDecimal(String s) {
        try {
            new BigDecimal(s.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
