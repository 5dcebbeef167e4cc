package com.fnmesh.router.http;

import com.fnmesh.core.hash.BackendRing;
import com.fnmesh.core.model.Backend;
import com.fnmesh.core.util.JsonUtils;
import com.fnmesh.router.config.RouterConfig;
import com.fnmesh.router.directory.IBackendDirectory;
import com.fnmesh.router.metrics.PrometheusMetricsExporter;
import com.fnmesh.router.routing.FunctionRouter;
import com.fnmesh.router.routing.RoutingException;
import com.fnmesh.router.routing.RoutingFailure;
import com.google.common.net.InetAddresses;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP server for the router: the invoke proxy plus health, metrics and operator endpoints.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final RouterConfig config;
    private final IBackendDirectory directory;
    private final FunctionRouter router;
    private final InvokeProxy proxy;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(
        RouterConfig config,
        IBackendDirectory directory,
        FunctionRouter router,
        InvokeProxy proxy,
        PrometheusMetricsExporter metricsExporter
    ) {
        this.config = config;
        this.directory = directory;
        this.router = router;
        this.proxy = proxy;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .host(config.getBindHost())
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on {}:{}", config.getBindHost(), bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            // Health check
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            // Metrics endpoint
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            )
            // Known functions and their rings
            .get("/api/v1/functions", (req, res) ->
                Mono.fromCallable(this::describeFunctions)
                    .flatMap(json -> sendJson(res, HttpResponseStatus.OK, json))
            )
            // Backend that a client address would be routed to
            .get("/api/v1/resolve", (req, res) ->
                Mono.fromCallable(() -> resolve(new QueryStringDecoder(req.uri())))
                    .flatMap(json -> sendJson(res, HttpResponseStatus.OK, json))
                    .onErrorResume(RoutingException.class, err -> sendError(res, err))
            )
            // Function invocations, any method
            .route(req -> req.uri().startsWith(InvokePath.PREFIX), (req, res) ->
                proxy.forward(req, res)
                    .onErrorResume(RoutingException.class, err -> {
                        if (res.hasSentHeaders()) {
                            log.warn("Invocation {} failed after response started: {}", req.uri(), err.getMessage());
                            return Mono.error(err);
                        }
                        return sendError(res, err);
                    })
            );
    }

    private String describeFunctions() {
        List<Map<String, Object>> functions = new ArrayList<>();
        for (UUID functionId : directory.functionIds()) {
            directory.get(functionId).ifPresent(ring -> functions.add(describeRing(functionId, ring)));
        }
        return JsonUtils.writeValueAsString(functions);
    }

    private static Map<String, Object> describeRing(UUID functionId, BackendRing ring) {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("functionId", functionId);
        function.put("backends", ring.getBackends());
        function.put("vnodes", ring.getVnodeCount());
        return function;
    }

    private String resolve(QueryStringDecoder decoder) {
        UUID functionId = parseFunctionIdParam(param(decoder, "functionId"));
        InetAddress client = parseClientIpParam(param(decoder, "clientIp"));

        Backend backend = router.pickBackend(functionId, client);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("functionId", functionId);
        response.put("ip", backend.getIp());
        response.put("containerId", backend.getContainerId());
        return JsonUtils.writeValueAsString(response);
    }

    private static String param(QueryStringDecoder decoder, String name) {
        List<String> values = decoder.parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isEmpty()) {
            throw new RoutingException(RoutingFailure.BAD_REQUEST, "Missing " + name + " parameter");
        }
        return values.get(0);
    }

    private static UUID parseFunctionIdParam(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new RoutingException(RoutingFailure.BAD_REQUEST, "Invalid functionId: " + value, e);
        }
    }

    private static InetAddress parseClientIpParam(String value) {
        try {
            return InetAddresses.forString(value);
        } catch (IllegalArgumentException e) {
            throw new RoutingException(RoutingFailure.BAD_REQUEST, "Invalid clientIp: " + value, e);
        }
    }

    private static Mono<Void> sendError(HttpServerResponse res, RoutingException err) {
        log.debug("Routing failed ({}): {}", err.getFailure(), err.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", err.getMessage());
        body.put("failure", err.getFailure().name());
        return sendJson(res, err.getFailure().status(), JsonUtils.writeValueAsString(body));
    }

    private static Mono<Void> sendJson(HttpServerResponse res, HttpResponseStatus status, String json) {
        return res.status(status)
            .header("Content-Type", "application/json")
            .sendString(Mono.just(json))
            .then();
    }
}
