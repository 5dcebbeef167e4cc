package com.fnmesh.router.http;

import com.fnmesh.core.model.Backend;
import com.fnmesh.router.routing.RoutingException;
import com.fnmesh.router.routing.RoutingFailure;

import java.util.UUID;

/**
 * Parsed form of an inbound {@code /invoke/{functionId}[/{suffix}][?query]} request URI.
 *
 * @param functionId function being invoked
 * @param suffix     everything after {@code /invoke/{functionId}/}, empty if absent
 * @param query      raw query string without the leading {@code ?}, or null
 */
public record InvokePath(UUID functionId, String suffix, String query) {

    public static final String PREFIX = "/invoke/";

    /**
     * @throws RoutingException {@link RoutingFailure#BAD_REQUEST} if the URI is not an
     *                          invoke URI or the function id is not a UUID
     */
    public static InvokePath parse(String uri) {
        String path = uri;
        String query = null;
        int q = uri.indexOf('?');
        if (q >= 0) {
            path = uri.substring(0, q);
            query = uri.substring(q + 1);
        }

        if (!path.startsWith(PREFIX)) {
            throw new RoutingException(RoutingFailure.BAD_REQUEST, "Not an invoke path: " + path);
        }

        String rest = path.substring(PREFIX.length());
        int slash = rest.indexOf('/');
        String id = slash < 0 ? rest : rest.substring(0, slash);
        String suffix = slash < 0 ? "" : rest.substring(slash + 1);

        return new InvokePath(parseFunctionId(id), suffix, query);
    }

    /**
     * Builds {@code http://{ip}:{port}/invoke/{containerId}/{suffix}}. The inbound query string,
     * if any, is appended unchanged so that backends see the caller's parameters.
     *
     * @return absolute URI of the backend endpoint serving this invocation
     */
    public String targetUri(Backend backend, int backendPort) {
        StringBuilder sb = new StringBuilder("http://")
            .append(backend.getIp())
            .append(':')
            .append(backendPort)
            .append(PREFIX)
            .append(backend.getContainerId())
            .append('/')
            .append(suffix);
        if (query != null) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    private static UUID parseFunctionId(String id) {
        try {
            UUID functionId = UUID.fromString(id);
            if (functionId.toString().equalsIgnoreCase(id)) {
                return functionId;
            }
        } catch (IllegalArgumentException e) {
            throw new RoutingException(RoutingFailure.BAD_REQUEST, "Invalid function id: " + id, e);
        }
        throw new RoutingException(RoutingFailure.BAD_REQUEST, "Invalid function id: " + id);
    }
}
