package com.fnmesh.router.registry;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * One session with the coordination service, scoped to an environment root.
 * <p>
 * All paths are relative to that root. A client is not reused after its watch
 * stream reports a terminal session state; callers open a new one instead.
 * </p>
 */
public interface IRegistryClient {

    /**
     * Lists the names of the immediate children of a node.
     */
    Mono<List<String>> listChildren(String path);

    /**
     * Reads a node's payload.
     *
     * @return the data and version, or empty if the node does not exist
     */
    Mono<VersionedData> getData(String path);

    /**
     * Registers a persistent recursive watch on a subtree.
     * <p>
     * The watch is registered when the returned {@link Mono} completes; every later change
     * below {@code path}, and every session state change, is emitted on the inner
     * {@link Flux}, which errors if the watch breaks.
     * </p>
     */
    Mono<Flux<RegistryEvent>> watch(String path);

    /**
     * Closes the session; outstanding watch streams complete.
     */
    void close();
}
