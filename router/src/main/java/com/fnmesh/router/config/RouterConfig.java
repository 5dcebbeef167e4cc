package com.fnmesh.router.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the router, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class RouterConfig {

    String nodeId;

    // ZooKeeper
    String zookeeper;           // host:port[,host:port...]
    String zookeeperEnv;        // environment root, e.g. "dev", "test", "default"
    Duration zkSessionTimeout;
    Duration zkConnectionTimeout;
    Duration reconnectDelay;    // fixed delay between watch loop restarts

    // HTTP
    String bindHost;
    int httpPort;
    int backendPort;            // port every backend instance listens on
    Duration upstreamConnectTimeout;
    Duration upstreamResponseTimeout;

    public static RouterConfig fromEnv() {
        return RouterConfig.builder()
            .nodeId(getEnv("NODE_ID", "fn-router-1"))
            .zookeeper(getEnv("ZOOKEEPER", "127.0.0.1:2181"))
            .zookeeperEnv(getEnv("ZOOKEEPER_ENV", "default"))
            .zkSessionTimeout(Duration.ofMillis(Long.parseLong(getEnv("ZK_SESSION_TIMEOUT_MS", "15000"))))
            .zkConnectionTimeout(Duration.ofMillis(Long.parseLong(getEnv("ZK_CONNECTION_TIMEOUT_MS", "5000"))))
            .reconnectDelay(Duration.ofMillis(Long.parseLong(getEnv("RECONNECT_DELAY_MS", "1000"))))
            .bindHost(getEnv("BIND_HOST", "0.0.0.0"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8000")))
            .backendPort(Integer.parseInt(getEnv("BACKEND_PORT", "8001")))
            .upstreamConnectTimeout(Duration.ofMillis(Long.parseLong(getEnv("UPSTREAM_CONNECT_TIMEOUT_MS", "5000"))))
            .upstreamResponseTimeout(Duration.ofMillis(Long.parseLong(getEnv("UPSTREAM_RESPONSE_TIMEOUT_MS", "60000"))))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
