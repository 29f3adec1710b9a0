package com.remotelink.common.response;

import lombok.Getter;

/**
 * Unchecked exception carrying a taxonomy error.
 * <p>
 * Handlers throw it (or a subclass) instead of building transport errors;
 * the dispatcher turns {@link #getError()} into the response as-is.
 */
@Getter
public class ApiException extends RuntimeException {

    private final ApiResponse.Error error;

    public ApiException(ApiResponse.Error error) {
        super(error.message());
        this.error = error;
    }

    public ApiException(ApiResponse.Error error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }
}
