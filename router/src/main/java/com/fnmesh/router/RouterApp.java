package com.fnmesh.router;

import com.fnmesh.router.config.RouterConfig;
import com.fnmesh.router.directory.BackendDirectory;
import com.fnmesh.router.discovery.DiscoveryWatcher;
import com.fnmesh.router.http.HttpServer;
import com.fnmesh.router.http.InvokeProxy;
import com.fnmesh.router.http.TracePropagation;
import com.fnmesh.router.metrics.PrometheusMetricsExporter;
import com.fnmesh.router.registry.CuratorRegistryConnector;
import com.fnmesh.router.routing.FunctionRouter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.baggage.propagation.W3CBaggagePropagator;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.context.propagation.TextMapPropagator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.netty.DisposableServer;

/**
 * Main entry point for the function router.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Discover function backends under {@code /{env}/function} in ZooKeeper</li>
 *   <li>Keep one consistent-hash ring per function, updated from watch notifications</li>
 *   <li>Proxy {@code /invoke/{functionId}/...} to the backend owning the client address</li>
 *   <li>Expose /healthz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class RouterApp {
    private static final Logger log = LoggerFactory.getLogger(RouterApp.class);

    public static void main(String[] args) {
        RouterConfig config = RouterConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting function router: {}", config.getNodeId());
        log.info("  ZooKeeper: {} (env={})", config.getZookeeper(), config.getZookeeperEnv());
        log.info("  Backend port: {}", config.getBackendPort());

        // Setup metrics registry with Prometheus support
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MeterRegistry registry = metricsExporter.getRegistry();

        BackendDirectory directory = new BackendDirectory(registry);
        DiscoveryWatcher watcher = new DiscoveryWatcher(
            new CuratorRegistryConnector(config),
            directory,
            config.getReconnectDelay(),
            registry
        );

        // Initial scan must succeed before serving traffic
        try {
            watcher.start().block();
        } catch (RuntimeException e) {
            log.error("Backend discovery failed, exiting", e);
            watcher.stop();
            System.exit(1);
            return;
        }

        FunctionRouter router = new FunctionRouter(directory);
        InvokeProxy proxy = new InvokeProxy(config, router, new TracePropagation(w3cPropagation()), registry);
        HttpServer httpServer = new HttpServer(config, directory, router, proxy, metricsExporter);

        DisposableServer server = httpServer.start();

        log.info("Function router {} is ready", config.getNodeId());

        handleShutdown(config, watcher, httpServer);

        server.onDispose().block();
    }

    private static OpenTelemetry w3cPropagation() {
        return OpenTelemetry.propagating(ContextPropagators.create(TextMapPropagator.composite(
            W3CTraceContextPropagator.getInstance(),
            W3CBaggagePropagator.getInstance()
        )));
    }

    private static void handleShutdown(RouterConfig config, DiscoveryWatcher watcher, HttpServer httpServer) {
        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            MDC.put("nodeId", config.getNodeId());

            httpServer.stop();

            watcher.stop();

            log.info("Shutdown complete");
        }));
    }
}
