package com.remotelink.common.response;

/**
 * Machine-readable error codes carried by {@link ApiResponse.Error} cases.
 */
public final class ErrorCodes {

    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String INVALID_PAYLOAD = "INVALID_PAYLOAD";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String ENDPOINT_NOT_FOUND = "ENDPOINT_NOT_FOUND";
    public static final String COMMAND_NOT_FOUND = "COMMAND_NOT_FOUND";
    public static final String PROCESS_NOT_FOUND = "PROCESS_NOT_FOUND";
    public static final String SESSION_NOT_FOUND = "SESSION_NOT_FOUND";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String RATE_LIMITED = "RATE_LIMITED";
    public static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
    public static final String COMMAND_NOT_ALLOWED = "COMMAND_NOT_ALLOWED";
    public static final String INTERNAL = "INTERNAL";
    public static final String UNRECOGNIZED_RESULT = "UNRECOGNIZED_RESULT";
    public static final String INVALID_CONFIGURATION = "INVALID_CONFIGURATION";

    private ErrorCodes() {
    }
}
