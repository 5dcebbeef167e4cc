package com.fnmesh.router.routing;

import lombok.Getter;

import java.util.UUID;

/**
 * A request that the router could not deliver to a backend.
 */
@Getter
public class RoutingException extends RuntimeException {

    private final RoutingFailure failure;

    public RoutingException(RoutingFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public RoutingException(RoutingFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public static RoutingException notFound(UUID functionId) {
        return new RoutingException(RoutingFailure.NOT_FOUND, "Unknown function " + functionId);
    }

    public static RoutingException unavailable(UUID functionId) {
        return new RoutingException(RoutingFailure.UNAVAILABLE, "No backends available for function " + functionId);
    }
}
