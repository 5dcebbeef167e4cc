package com.fnmesh.core.hash;

import com.fnmesh.core.model.Backend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable consistent hash ring over the backends of one function.
 * <p>
 * <b>Consistent hashing properties:</b>
 * <ul>
 *   <li>Every backend owns {@code replicas} virtual nodes, smoothing the key distribution.
 *       The only exception is a 64-bit vnode hash collision: the position stays with the
 *       backend that sorts first and the other replica is dropped, so the ring then holds
 *       fewer than {@code replicas * backends} vnodes.</li>
 *   <li>Adding/removing a backend reassigns approximately 1/n of keys.</li>
 *   <li>Deterministic key → backend mapping, independent of the order backends were supplied in.</li>
 * </ul>
 * </p>
 * <p>
 * <b>Thread-safety:</b> Immutable after construction; safe for concurrent reads. Updating a
 * function's backends means building a new ring and swapping it in.
 * </p>
 */
public final class BackendRing {
    private static final Logger log = LoggerFactory.getLogger(BackendRing.class);

    /**
     * Virtual nodes per backend used by the router.
     */
    public static final int DEFAULT_REPLICAS = 20;

    private final NavigableMap<Long, Backend> ring; // hash → backend
    private final NavigableSet<Backend> backends;
    private final int replicas;

    private BackendRing(NavigableMap<Long, Backend> ring, NavigableSet<Backend> backends, int replicas) {
        this.ring = ring;
        this.backends = backends;
        this.replicas = replicas;
    }

    /**
     * Builds a ring from a backend collection. Duplicates are collapsed.
     *
     * @param backends Backends to place on the ring (may be empty)
     * @param replicas Virtual nodes per backend, must be positive
     * @return Immutable ring
     */
    public static BackendRing fromBackends(Collection<Backend> backends, int replicas) {
        if (replicas <= 0) {
            throw new IllegalArgumentException("replicas must be positive, got " + replicas);
        }

        // Canonical order, so a hash collision is resolved the same way for any input order
        TreeSet<Backend> distinct = new TreeSet<>(backends);
        TreeMap<Long, Backend> ring = new TreeMap<>();

        for (Backend backend : distinct) {
            for (int i = 0; i < replicas; i++) {
                long hash = Hashers.murmur3Hash(backend.ringKey() + "#" + i);
                Backend owner = ring.putIfAbsent(hash, backend);
                if (owner != null) {
                    log.warn("Virtual node collision at {}: {} keeps it, {} replica {} dropped",
                        hash, owner, backend, i);
                }
            }
        }

        log.debug("Created ring with {} vnodes from {} backends", ring.size(), distinct.size());

        return new BackendRing(
            Collections.unmodifiableNavigableMap(ring),
            Collections.unmodifiableNavigableSet(distinct),
            replicas
        );
    }

    public static BackendRing fromBackends(Collection<Backend> backends) {
        return fromBackends(backends, DEFAULT_REPLICAS);
    }

    /**
     * Finds the backend owning a key.
     * <p>
     * The owner is the first vnode whose hash is ≥ the key hash, wrapping around to the
     * lowest vnode if needed.
     * </p>
     *
     * @param key Key bytes (the router uses the client IP address text)
     * @return Owning backend, or empty if the ring has no backends
     */
    public Optional<Backend> successor(byte[] key) {
        if (ring.isEmpty()) {
            return Optional.empty();
        }

        long hash = Hashers.murmur3Hash(key);
        Map.Entry<Long, Backend> entry = ring.ceilingEntry(hash);

        if (entry == null) {
            // Wrap around to the first vnode
            entry = ring.firstEntry();
        }

        return Optional.of(entry.getValue());
    }

    public Optional<Backend> successor(String key) {
        return successor(key.getBytes(StandardCharsets.UTF_8));
    }

    public int getVnodeCount() {
        return ring.size();
    }

    public int getBackendCount() {
        return backends.size();
    }

    public int getReplicas() {
        return replicas;
    }

    public boolean isEmpty() {
        return ring.isEmpty();
    }

    /**
     * @return Distinct backends on this ring, in canonical order
     */
    public NavigableSet<Backend> getBackends() {
        return backends;
    }

    /**
     * @return Read-only view of the virtual nodes (hash → owning backend)
     */
    public NavigableMap<Long, Backend> getVnodes() {
        return ring;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BackendRing)) {
            return false;
        }
        BackendRing other = (BackendRing) o;
        return replicas == other.replicas && ring.equals(other.ring);
    }

    @Override
    public int hashCode() {
        return Objects.hash(replicas, ring);
    }

    @Override
    public String toString() {
        return "BackendRing{backends=" + backends.size() + ", vnodes=" + ring.size() + "}";
    }
}
