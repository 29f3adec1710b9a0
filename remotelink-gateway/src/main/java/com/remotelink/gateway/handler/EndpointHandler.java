package com.remotelink.gateway.handler;

/**
 * Behavior bound to one or more endpoint manifests by {@link #id()}.
 * <p>
 * A handler returns either an {@code ApiResponse} or a plain value (text,
 * map, collection, record, number, boolean) that the dispatcher wraps as a
 * success. Failures are reported by throwing {@code ApiException}; anything
 * else thrown becomes a sanitized internal error.
 */
public interface EndpointHandler {

    String id();

    Object handle(HandlerContext context) throws Exception;
}
