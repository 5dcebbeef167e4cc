package com.fnmesh.router.registry;

import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.state.ConnectionState;
import org.apache.curator.framework.state.ConnectionStateListener;
import org.apache.zookeeper.AddWatchMode;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.WatchedEvent;
import org.apache.zookeeper.Watcher;
import org.apache.zookeeper.data.Stat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link IRegistryClient} over a started, connected {@link CuratorFramework}.
 * <p>
 * Curator's synchronous API blocks, so every call runs on the bounded-elastic scheduler.
 * Calls through one client are serialized: a ZooKeeper handle is shared by the watcher
 * and by on-demand reads, and reads are issued one at a time.
 * </p>
 */
public class CuratorRegistryClient implements IRegistryClient {
    private static final Logger log = LoggerFactory.getLogger(CuratorRegistryClient.class);

    private final CuratorFramework curator;
    private final Object lock = new Object();
    private final List<Sinks.Many<RegistryEvent>> watchSinks = new CopyOnWriteArrayList<>();
    private final List<ConnectionStateListener> stateListeners = new CopyOnWriteArrayList<>();

    public CuratorRegistryClient(CuratorFramework curator) {
        this.curator = curator;
    }

    @Override
    public Mono<List<String>> listChildren(String path) {
        return Mono.fromCallable(() -> {
                synchronized (lock) {
                    return curator.getChildren().forPath(path);
                }
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(err -> new RegistryException("Error listing children of " + path, err));
    }

    @Override
    public Mono<VersionedData> getData(String path) {
        return Mono.fromCallable(() -> {
                synchronized (lock) {
                    Stat stat = new Stat();
                    try {
                        byte[] data = curator.getData().storingStatIn(stat).forPath(path);
                        return new VersionedData(data != null ? data : new byte[0], stat.getVersion());
                    } catch (KeeperException.NoNodeException e) {
                        log.debug("Node {} does not exist", path);
                        return null; // completes empty
                    }
                }
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(err -> new RegistryException("Error getting data of " + path, err));
    }

    @Override
    public Mono<Flux<RegistryEvent>> watch(String path) {
        return Mono.fromCallable(() -> {
                Sinks.Many<RegistryEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
                ConnectionStateListener stateListener = (client, state) -> emit(sink, fromConnectionState(state));

                synchronized (lock) {
                    watchSinks.add(sink);
                    stateListeners.add(stateListener);
                    curator.getConnectionStateListenable().addListener(stateListener);
                    curator.watchers()
                        .add()
                        .withMode(AddWatchMode.PERSISTENT_RECURSIVE)
                        .usingWatcher((Watcher) event -> emit(sink, fromWatchedEvent(event)))
                        .forPath(path);
                }

                log.debug("Persistent recursive watch registered on {}", path);
                return sink.asFlux();
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(err -> new RegistryException("Error watching " + path, err));
    }

    @Override
    public void close() {
        stateListeners.forEach(listener -> curator.getConnectionStateListenable().removeListener(listener));
        stateListeners.clear();
        watchSinks.forEach(sink -> {
            synchronized (sink) {
                sink.tryEmitComplete();
            }
        });
        watchSinks.clear();
        curator.close();
        log.debug("ZooKeeper session closed");
    }

    private static void emit(Sinks.Many<RegistryEvent> sink, RegistryEvent event) {
        Sinks.EmitResult result;
        // ZooKeeper's event thread and Curator's state thread both emit here
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure()) {
            log.debug("Dropped registry event {} ({})", event, result);
        }
    }

    static RegistryEvent fromWatchedEvent(WatchedEvent event) {
        String path = event.getPath() != null ? event.getPath() : "";
        switch (event.getType()) {
            case None:
                return RegistryEvent.session(fromKeeperState(event.getState()));
            case NodeCreated:
                return RegistryEvent.node(RegistryEvent.Type.NODE_CREATED, path);
            case NodeDeleted:
                return RegistryEvent.node(RegistryEvent.Type.NODE_DELETED, path);
            case NodeDataChanged:
                return RegistryEvent.node(RegistryEvent.Type.NODE_DATA_CHANGED, path);
            default:
                return RegistryEvent.node(RegistryEvent.Type.OTHER, path);
        }
    }

    static RegistryEvent.SessionState fromKeeperState(Watcher.Event.KeeperState state) {
        switch (state) {
            case SyncConnected:
            case ConnectedReadOnly:
                return RegistryEvent.SessionState.CONNECTED;
            case Disconnected:
                return RegistryEvent.SessionState.DISCONNECTED;
            case Expired:
                return RegistryEvent.SessionState.EXPIRED;
            case Closed:
                return RegistryEvent.SessionState.CLOSED;
            default:
                return RegistryEvent.SessionState.OTHER;
        }
    }

    static RegistryEvent fromConnectionState(ConnectionState state) {
        switch (state) {
            case CONNECTED:
            case RECONNECTED:
                return RegistryEvent.session(RegistryEvent.SessionState.CONNECTED);
            case SUSPENDED:
                return RegistryEvent.session(RegistryEvent.SessionState.DISCONNECTED);
            case LOST:
                return RegistryEvent.session(RegistryEvent.SessionState.EXPIRED);
            default:
                return RegistryEvent.session(RegistryEvent.SessionState.OTHER);
        }
    }
}
