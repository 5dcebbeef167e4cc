package com.fnmesh.router.directory;

import com.fnmesh.core.hash.BackendRing;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Per-function view of the current backend rings (Dependency Inversion Principle).
 * <p>
 * Written only by the discovery watcher, read by every request. Readers never block each
 * other and never observe a partially built ring: {@link #put} and {@link #remove} swap
 * whole immutable rings. A read racing a write may see either side of it.
 * </p>
 */
public interface IBackendDirectory {

    /**
     * @return the function's ring, or empty if the function is unknown
     */
    Optional<BackendRing> get(UUID functionId);

    /**
     * Atomically replaces the function's ring.
     */
    void put(UUID functionId, BackendRing ring);

    /**
     * Forgets a function.
     */
    void remove(UUID functionId);

    /**
     * @return snapshot of the known function ids
     */
    Set<UUID> functionIds();

    int size();
}
