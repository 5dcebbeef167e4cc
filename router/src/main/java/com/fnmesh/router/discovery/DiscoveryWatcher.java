package com.fnmesh.router.discovery;

import com.fnmesh.core.codec.BackendCodec;
import com.fnmesh.core.hash.BackendRing;
import com.fnmesh.core.metrics.MetricsNames;
import com.fnmesh.core.metrics.MetricsTags;
import com.fnmesh.core.model.Backend;
import com.fnmesh.router.directory.IBackendDirectory;
import com.fnmesh.router.registry.IRegistryClient;
import com.fnmesh.router.registry.IRegistryConnector;
import com.fnmesh.router.registry.RegistryEvent;
import com.fnmesh.router.registry.VersionedData;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps the {@link IBackendDirectory} synchronized with the {@code /function} subtree.
 * <p>
 * Lifecycle:
 * <ol>
 *   <li>{@link #start()} connects a long-lived data session, lists {@code /function} and
 *       loads every function's backends before completing. Any failure here is fatal.</li>
 *   <li>A supervised watch loop then runs for the lifetime of the process. Each iteration
 *       opens a fresh session, registers a persistent recursive watch, resyncs the whole
 *       subtree and applies change notifications. Any error (including a disconnected,
 *       expired or closed session) ends the iteration; the next one starts after the
 *       fixed reconnect delay, forever.</li>
 * </ol>
 * </p>
 * <p>
 * This is the only writer of the directory, and it applies updates one at a time.
 * </p>
 */
public class DiscoveryWatcher {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryWatcher.class);

    private final IRegistryConnector connector;
    private final IBackendDirectory directory;
    private final Duration reconnectDelay;
    private final int replicas;

    private final Counter restarts;
    private final Map<RegistryEvent.Type, Counter> eventCounters = new EnumMap<>(RegistryEvent.Type.class);

    private volatile IRegistryClient dataClient;
    private volatile Disposable watchLoop;

    public DiscoveryWatcher(
        IRegistryConnector connector,
        IBackendDirectory directory,
        Duration reconnectDelay,
        int replicas,
        MeterRegistry meterRegistry
    ) {
        this.connector = connector;
        this.directory = directory;
        this.reconnectDelay = reconnectDelay;
        this.replicas = replicas;

        this.restarts = Counter.builder(MetricsNames.DISCOVERY_RESTARTS_TOTAL)
            .description("Watch loop iterations restarted after an error")
            .register(meterRegistry);
        for (RegistryEvent.Type type : RegistryEvent.Type.values()) {
            eventCounters.put(type, Counter.builder(MetricsNames.DISCOVERY_EVENTS_TOTAL)
                .tag(MetricsTags.TYPE, type.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));
        }
    }

    public DiscoveryWatcher(IRegistryConnector connector, IBackendDirectory directory,
                            Duration reconnectDelay, MeterRegistry meterRegistry) {
        this(connector, directory, reconnectDelay, BackendRing.DEFAULT_REPLICAS, meterRegistry);
    }

    /**
     * Performs the initial scan and starts the background watch loop.
     *
     * @return Mono completing once every function listed at startup has been loaded,
     * or erroring with {@link DiscoveryException}
     */
    public Mono<Void> start() {
        return connector.connect()
            .doOnNext(client -> this.dataClient = client)
            .then(Mono.defer(() -> loadAll(false)))
            .doOnSuccess(ignored -> {
                log.info("Initial scan complete: {} functions", directory.size());
                watchLoop = superviseWatch().subscribe();
            })
            .onErrorMap(err -> !(err instanceof DiscoveryException),
                err -> new DiscoveryException("Initial backend discovery failed", err));
    }

    /**
     * Stops the watch loop and closes the data session.
     */
    public void stop() {
        if (watchLoop != null) {
            watchLoop.dispose();
        }
        if (dataClient != null) {
            dataClient.close();
        }
        log.info("Discovery watcher stopped");
    }

    /**
     * Restarts {@link #watchOnce()} after a fixed delay whenever it fails, regardless of the error.
     */
    Mono<Void> superviseWatch() {
        return Mono.defer(this::watchOnce)
            .doOnError(err -> {
                restarts.increment();
                log.error("Error in watch loop, reconnecting in {}", reconnectDelay, err);
            })
            .retryWhen(Retry.fixedDelay(Long.MAX_VALUE, reconnectDelay))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * One watch iteration: fresh session, watch, resync, then apply events until failure.
     * <p>
     * Never completes normally. Contains no retry logic of its own.
     * </p>
     */
    Mono<Void> watchOnce() {
        return Mono.usingWhen(
            connector.connect(),
            client -> client.watch(FunctionPaths.FUNCTION_ROOT)
                .flatMap(events -> {
                    log.info("Watching {} for backend changes", FunctionPaths.FUNCTION_ROOT);
                    // Events that arrive while resyncing are buffered and applied afterwards
                    return loadAll(true)
                        .thenMany(events.concatMap(event -> Mono.defer(() -> onEvent(event))))
                        .then();
                })
                .then(Mono.<Void>error(new DiscoveryException("ZooKeeper watch stream ended"))),
            client -> Mono.fromRunnable(client::close)
        ).onErrorMap(err -> !(err instanceof DiscoveryException),
            err -> new DiscoveryException("Watch iteration failed", err));
    }

    private Mono<Void> onEvent(RegistryEvent event) {
        log.trace("ZooKeeper event: {}", event);
        eventCounters.get(event.type()).increment();

        if (event.isSessionTerminal()) {
            log.error("ZooKeeper session {}", event.sessionState());
            return Mono.error(new DiscoveryException("ZooKeeper session " + event.sessionState()));
        }

        if (event.type() == RegistryEvent.Type.SESSION || !FunctionPaths.isBackendsPath(event.path())) {
            return Mono.empty();
        }

        switch (event.type()) {
            case NODE_CREATED: {
                UUID functionId = FunctionPaths.functionIdOf(event.path());
                log.debug("Function {} created", functionId);
                return loadBackends(functionId);
            }
            case NODE_DATA_CHANGED: {
                UUID functionId = FunctionPaths.functionIdOf(event.path());
                log.debug("Function {} backends updated", functionId);
                return loadBackends(functionId);
            }
            case NODE_DELETED: {
                UUID functionId = FunctionPaths.functionIdOf(event.path());
                log.debug("Function {} deleted", functionId);
                directory.remove(functionId);
                return Mono.empty();
            }
            default:
                log.warn("Unexpected ZooKeeper event: {}", event);
                return Mono.empty();
        }
    }

    /**
     * Lists {@code /function} and loads every function sequentially.
     *
     * @param prune also drop directory entries for functions no longer listed
     */
    Mono<Void> loadAll(boolean prune) {
        return dataClient.listChildren(FunctionPaths.FUNCTION_ROOT)
            .flatMap(children -> {
                List<UUID> functionIds = new ArrayList<>(children.size());
                for (String child : children) {
                    functionIds.add(FunctionPaths.parseFunctionId(child));
                }

                return Flux.fromIterable(functionIds)
                    .concatMap(this::loadBackends)
                    .then(Mono.<Void>fromRunnable(() -> {
                        if (prune) {
                            pruneExcept(new HashSet<>(functionIds));
                        }
                        log.debug("Loaded {} functions from {}", functionIds.size(), FunctionPaths.FUNCTION_ROOT);
                    }));
            });
    }

    /**
     * Fetches, decodes and installs one function's backends, replacing any previous ring.
     * <p>
     * If the backends node does not exist (not created yet, or deleted since the
     * notification), the function is dropped from the directory.
     * </p>
     */
    Mono<Void> loadBackends(UUID functionId) {
        String path = FunctionPaths.backendsPath(functionId);
        return dataClient.getData(path)
            .doOnNext(data -> installRing(functionId, data))
            .switchIfEmpty(Mono.<VersionedData>fromRunnable(() -> {
                log.debug("No backends node for function {}", functionId);
                directory.remove(functionId);
            }))
            .onErrorMap(err -> !(err instanceof DiscoveryException),
                err -> new DiscoveryException("Error loading backends of function " + functionId, err))
            .then();
    }

    private void installRing(UUID functionId, VersionedData data) {
        List<Backend> backends = BackendCodec.decode(data.data());
        BackendRing ring = BackendRing.fromBackends(backends, replicas);

        log.trace("Updating backends for function {}: old={}, new={} (version {})",
            functionId,
            directory.get(functionId).map(BackendRing::getBackendCount).orElse(0),
            ring.getBackendCount(),
            data.version());

        directory.put(functionId, ring);
    }

    private void pruneExcept(Set<UUID> listed) {
        for (UUID functionId : directory.functionIds()) {
            if (!listed.contains(functionId)) {
                log.info("Function {} disappeared while disconnected, removing", functionId);
                directory.remove(functionId);
            }
        }
    }
}
