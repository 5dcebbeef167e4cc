package com.fnmesh.router.routing;

import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Why an invocation could not be routed, and the status the client sees for it.
 */
public enum RoutingFailure {
    NOT_FOUND(HttpResponseStatus.NOT_FOUND),
    UNAVAILABLE(HttpResponseStatus.SERVICE_UNAVAILABLE),
    UPSTREAM_ERROR(HttpResponseStatus.BAD_GATEWAY),
    BAD_REQUEST(HttpResponseStatus.BAD_REQUEST);

    private final HttpResponseStatus status;

    RoutingFailure(HttpResponseStatus status) {
        this.status = status;
    }

    public HttpResponseStatus status() {
        return status;
    }
}
