package com.fnmesh.router.discovery;

/**
 * Any failure while synchronizing the backend directory with ZooKeeper: connect, list,
 * fetch, decode, path parsing or watch registration.
 * <p>
 * Fatal during startup. Afterwards it only ends the current watch iteration, which is
 * restarted after the reconnect delay; request handling never sees it.
 * </p>
 */
public class DiscoveryException extends RuntimeException {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
