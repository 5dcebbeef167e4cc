package com.fnmesh.router.directory;

import com.fnmesh.core.hash.BackendRing;
import com.fnmesh.core.metrics.MetricsNames;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link IBackendDirectory} backed by a {@link ConcurrentHashMap} of immutable rings.
 */
public class BackendDirectory implements IBackendDirectory {
    private static final Logger log = LoggerFactory.getLogger(BackendDirectory.class);

    // functionId -> ring
    private final Map<UUID, BackendRing> rings = new ConcurrentHashMap<>();

    public BackendDirectory(MeterRegistry meterRegistry) {
        Gauge.builder(MetricsNames.DIRECTORY_FUNCTIONS, rings, Map::size)
            .description("Functions currently known to the router")
            .register(meterRegistry);
    }

    @Override
    public Optional<BackendRing> get(UUID functionId) {
        return Optional.ofNullable(rings.get(functionId));
    }

    @Override
    public void put(UUID functionId, BackendRing ring) {
        Objects.requireNonNull(ring, "ring");
        BackendRing previous = rings.put(functionId, ring);
        log.debug("Function {} ring replaced: {} -> {}", functionId, previous, ring);
    }

    @Override
    public void remove(UUID functionId) {
        if (rings.remove(functionId) != null) {
            log.debug("Function {} removed from directory", functionId);
        }
    }

    @Override
    public Set<UUID> functionIds() {
        return Set.copyOf(rings.keySet());
    }

    @Override
    public int size() {
        return rings.size();
    }
}
