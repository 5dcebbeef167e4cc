package com.fnmesh.router.registry;

import com.fnmesh.router.config.RouterConfig;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.TimeUnit;

/**
 * Opens Curator sessions whose namespace is the configured environment, so every
 * path the router uses is relative to {@code /{env}}.
 */
public class CuratorRegistryConnector implements IRegistryConnector {
    private static final Logger log = LoggerFactory.getLogger(CuratorRegistryConnector.class);

    private static final int MAX_OPERATION_RETRIES = 3;

    private final RouterConfig config;

    public CuratorRegistryConnector(RouterConfig config) {
        this.config = config;
    }

    @Override
    public Mono<IRegistryClient> connect() {
        return Mono.fromCallable(this::connectBlocking)
            .subscribeOn(Schedulers.boundedElastic());
    }

    private IRegistryClient connectBlocking() throws InterruptedException {
        CuratorFramework curator = CuratorFrameworkFactory.builder()
            .connectString(config.getZookeeper())
            .namespace(config.getZookeeperEnv())
            .sessionTimeoutMs((int) config.getZkSessionTimeout().toMillis())
            .connectionTimeoutMs((int) config.getZkConnectionTimeout().toMillis())
            .retryPolicy(new ExponentialBackoffRetry(
                (int) config.getReconnectDelay().toMillis(), MAX_OPERATION_RETRIES))
            .build();
        curator.start();

        boolean connected;
        try {
            connected = curator.blockUntilConnected(
                (int) config.getZkConnectionTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            curator.close();
            throw e;
        }

        if (!connected) {
            curator.close();
            throw new RegistryException("Timed out connecting to ZooKeeper at " + config.getZookeeper());
        }

        log.info("Connected to ZooKeeper {} (env={})", config.getZookeeper(), config.getZookeeperEnv());
        return new CuratorRegistryClient(curator);
    }
}
