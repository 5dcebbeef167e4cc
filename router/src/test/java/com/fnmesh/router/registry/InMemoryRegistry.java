package com.fnmesh.router.registry;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory ZooKeeper stand-in for tests.
 * <p>
 * Mutations notify every open watch whose root covers the changed node, the way a persistent
 * recursive watch would. {@link #suspendEvents()} lets a test change the tree without
 * notifications, as if the changes happened while the router was disconnected.
 * </p>
 */
public class InMemoryRegistry implements IRegistryConnector {

    private final NavigableMap<String, Node> nodes = new TreeMap<>();
    private final List<Client> clients = new CopyOnWriteArrayList<>();
    private final AtomicInteger connects = new AtomicInteger();
    private volatile boolean eventsSuspended;

    @Override
    public Mono<IRegistryClient> connect() {
        return Mono.fromCallable(() -> {
            Client client = new Client();
            clients.add(client);
            connects.incrementAndGet();
            return client;
        });
    }

    /**
     * Creates a node, and any missing parents with empty data.
     */
    public void create(String path, byte[] data) {
        List<String> created = new ArrayList<>();
        synchronized (nodes) {
            if (nodes.containsKey(path)) {
                throw new IllegalStateException("Node exists: " + path);
            }
            for (String parent = parentOf(path); !parent.isEmpty() && !nodes.containsKey(parent); parent = parentOf(parent)) {
                created.add(0, parent);
            }
            for (String parent : created) {
                nodes.put(parent, new Node(new byte[0], 0));
            }
            nodes.put(path, new Node(data, 0));
            created.add(path);
        }
        created.forEach(p -> fire(RegistryEvent.node(RegistryEvent.Type.NODE_CREATED, p)));
    }

    public void setData(String path, byte[] data) {
        synchronized (nodes) {
            Node node = nodes.get(path);
            if (node == null) {
                throw new IllegalStateException("No node: " + path);
            }
            nodes.put(path, new Node(data, node.version + 1));
        }
        fire(RegistryEvent.node(RegistryEvent.Type.NODE_DATA_CHANGED, path));
    }

    /**
     * Deletes a node and its subtree, children first.
     */
    public void deleteRecursive(String path) {
        List<String> deleted = new ArrayList<>();
        synchronized (nodes) {
            List<String> subtree = new ArrayList<>(nodes.subMap(path + "/", true, path + "/\uffff", true).keySet());
            for (int i = subtree.size() - 1; i >= 0; i--) {
                nodes.remove(subtree.get(i));
                deleted.add(subtree.get(i));
            }
            if (nodes.remove(path) != null) {
                deleted.add(path);
            }
        }
        deleted.forEach(p -> fire(RegistryEvent.node(RegistryEvent.Type.NODE_DELETED, p)));
    }

    public void suspendEvents() {
        eventsSuspended = true;
    }

    public void resumeEvents() {
        eventsSuspended = false;
    }

    /**
     * Reports an expired session on every open watch.
     */
    public void expireSessions() {
        for (Client client : clients) {
            client.emit(RegistryEvent.session(RegistryEvent.SessionState.EXPIRED));
        }
    }

    /**
     * Emits an arbitrary event on every open watch.
     */
    public void emit(RegistryEvent event) {
        for (Client client : clients) {
            client.emit(event);
        }
    }

    public int connectCount() {
        return connects.get();
    }

    public int openClientCount() {
        return clients.size();
    }

    public int activeWatchCount() {
        return clients.stream().mapToInt(client -> client.watches.size()).sum();
    }

    private void fire(RegistryEvent event) {
        if (eventsSuspended) {
            return;
        }
        for (Client client : clients) {
            client.emit(event);
        }
    }

    private static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash <= 0 ? "" : path.substring(0, slash);
    }

    private record Node(byte[] data, int version) {
    }

    private record Watch(String root, Sinks.Many<RegistryEvent> sink) {
        boolean covers(RegistryEvent event) {
            return event.type() == RegistryEvent.Type.SESSION
                || event.path().equals(root)
                || event.path().startsWith(root + "/");
        }
    }

    private class Client implements IRegistryClient {
        private final List<Watch> watches = new CopyOnWriteArrayList<>();
        private volatile boolean closed;

        @Override
        public Mono<List<String>> listChildren(String path) {
            return Mono.fromCallable(() -> {
                checkOpen();
                synchronized (nodes) {
                    if (!nodes.containsKey(path)) {
                        throw new RegistryException("No node: " + path);
                    }
                    List<String> children = new ArrayList<>();
                    for (String key : nodes.subMap(path + "/", true, path + "/\uffff", true).keySet()) {
                        String name = key.substring(path.length() + 1);
                        if (!name.contains("/")) {
                            children.add(name);
                        }
                    }
                    return children;
                }
            });
        }

        @Override
        public Mono<VersionedData> getData(String path) {
            return Mono.fromCallable(() -> {
                checkOpen();
                synchronized (nodes) {
                    Node node = nodes.get(path);
                    return node == null ? null : new VersionedData(node.data, node.version);
                }
            });
        }

        @Override
        public Mono<Flux<RegistryEvent>> watch(String path) {
            return Mono.fromCallable(() -> {
                checkOpen();
                Sinks.Many<RegistryEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
                watches.add(new Watch(path, sink));
                return sink.asFlux();
            });
        }

        @Override
        public void close() {
            closed = true;
            clients.remove(this);
            for (Watch watch : watches) {
                synchronized (watch.sink) {
                    watch.sink.tryEmitComplete();
                }
            }
            watches.clear();
        }

        void emit(RegistryEvent event) {
            for (Watch watch : watches) {
                if (watch.covers(event)) {
                    synchronized (watch.sink) {
                        watch.sink.tryEmitNext(event);
                    }
                }
            }
        }

        private void checkOpen() {
            if (closed) {
                throw new RegistryException("Session closed");
            }
        }
    }
}
