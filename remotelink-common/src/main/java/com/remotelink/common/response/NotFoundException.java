package com.remotelink.common.response;

/** An endpoint, command, session token or pid that does not exist. */
public class NotFoundException extends ApiException {

    public NotFoundException(String resource) {
        super(ApiResponse.notFound(resource));
    }

    public NotFoundException(String code, String resource) {
        super(ApiResponse.notFound(code, resource));
    }
}
