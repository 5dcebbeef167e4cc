package com.fnmesh.router.registry;

import reactor.core.publisher.Mono;

/**
 * Opens fresh coordination-service sessions.
 */
public interface IRegistryConnector {

    /**
     * Connects a new session scoped to the configured environment root.
     *
     * @return Mono emitting the connected client, or erroring if the service is unreachable
     */
    Mono<IRegistryClient> connect();
}
