package com.remotelink.gateway.dispatch;

import com.remotelink.common.response.ApiResponse;

/**
 * Maps taxonomy cases to HTTP status codes. The only place status codes
 * are chosen.
 */
public final class HttpStatusMapper {

    private HttpStatusMapper() {
    }

    public static int statusOf(ApiResponse response) {
        if (response instanceof ApiResponse.NoContent) {
            return 204;
        }
        if (response instanceof ApiResponse.Ok) {
            return 200;
        }
        if (response instanceof ApiResponse.ValidationError) {
            return 400;
        }
        if (response instanceof ApiResponse.AuthError) {
            return 401;
        }
        if (response instanceof ApiResponse.NotFound) {
            return 404;
        }
        if (response instanceof ApiResponse.MethodNotAllowed) {
            return 405;
        }
        return 500;
    }
}
