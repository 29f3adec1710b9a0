package com.remotelink.common.response;

/** Missing, invalid or expired credentials. */
public class AuthException extends ApiException {

    public AuthException(String message) {
        super(ApiResponse.unauthorized(message));
    }

    public AuthException(String code, String message) {
        super(ApiResponse.unauthorized(code, message));
    }
}
