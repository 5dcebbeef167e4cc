package com.fnmesh.router.routing;

import com.fnmesh.core.hash.BackendRing;
import com.fnmesh.core.model.Backend;
import com.fnmesh.router.directory.IBackendDirectory;
import com.google.common.net.InetAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Picks the backend for an invocation by hashing the client address onto the function's ring.
 * <p>
 * Requests from one client address keep landing on the same backend for as long as the
 * function's backend set does not change.
 * </p>
 */
public class FunctionRouter {
    private static final Logger log = LoggerFactory.getLogger(FunctionRouter.class);

    private final IBackendDirectory directory;

    public FunctionRouter(IBackendDirectory directory) {
        this.directory = directory;
    }

    /**
     * @param functionId function being invoked
     * @param client     address of the calling client
     * @return backend that should serve the request
     * @throws RoutingException {@link RoutingFailure#NOT_FOUND} for an unknown function,
     *                          {@link RoutingFailure#UNAVAILABLE} for a function without backends
     */
    public Backend pickBackend(UUID functionId, InetAddress client) {
        BackendRing ring = directory.get(functionId)
            .orElseThrow(() -> RoutingException.notFound(functionId));

        Backend backend = ring.successor(affinityKey(client))
            .orElseThrow(() -> RoutingException.unavailable(functionId));

        log.trace("Function {} client {} -> {}", functionId, client, backend);
        return backend;
    }

    static byte[] affinityKey(InetAddress client) {
        return InetAddresses.toAddrString(client).getBytes(StandardCharsets.UTF_8);
    }
}
