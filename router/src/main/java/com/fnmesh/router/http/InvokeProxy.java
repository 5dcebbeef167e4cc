package com.fnmesh.router.http;

import com.fnmesh.core.metrics.MetricsNames;
import com.fnmesh.core.metrics.MetricsTags;
import com.fnmesh.core.model.Backend;
import com.fnmesh.router.config.RouterConfig;
import com.fnmesh.router.routing.FunctionRouter;
import com.fnmesh.router.routing.RoutingException;
import com.fnmesh.router.routing.RoutingFailure;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Forwards {@code /invoke/...} requests to the backend picked by {@link FunctionRouter}.
 * <p>
 * Method, headers and body are passed through (except {@code Host}), the path is rewritten to
 * the backend container, and the upstream status, headers and body are streamed back as is.
 * Upstream failures are not retried.
 * </p>
 */
public class InvokeProxy {
    private static final Logger log = LoggerFactory.getLogger(InvokeProxy.class);

    private final FunctionRouter router;
    private final TracePropagation tracing;
    private final HttpClient client;
    private final int backendPort;

    private final MeterRegistry meterRegistry;
    private final Timer upstreamLatency;
    private final Counter okRequests;
    private final Map<RoutingFailure, Counter> failedRequests = new EnumMap<>(RoutingFailure.class);

    public InvokeProxy(
        RouterConfig config,
        FunctionRouter router,
        TracePropagation tracing,
        MeterRegistry meterRegistry
    ) {
        this.router = router;
        this.tracing = tracing;
        this.backendPort = config.getBackendPort();
        this.client = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getUpstreamConnectTimeout().toMillis())
            .responseTimeout(config.getUpstreamResponseTimeout());

        this.meterRegistry = meterRegistry;
        this.upstreamLatency = Timer.builder(MetricsNames.ROUTER_UPSTREAM_LATENCY)
            .description("Time from forwarding a request until the backend response completes")
            .register(meterRegistry);
        this.okRequests = requestCounter("ok");
        for (RoutingFailure failure : RoutingFailure.values()) {
            failedRequests.put(failure, requestCounter(failure.name().toLowerCase(Locale.ROOT)));
        }
    }

    /**
     * Routes and forwards one request.
     *
     * @return Mono completing when the response has been sent, or erroring with
     * {@link RoutingException} if it could not be
     */
    public Mono<Void> forward(HttpServerRequest req, HttpServerResponse res) {
        return Mono.defer(() -> {
                InvokePath path = InvokePath.parse(req.uri());
                Backend backend = router.pickBackend(path.functionId(), clientAddress(req));
                String target = path.targetUri(backend, backendPort);

                log.debug("{} {} -> {}", req.method(), req.uri(), target);
                return proxy(req, res, path, target);
            })
            .doOnSuccess(ignored -> okRequests.increment())
            .doOnError(RoutingException.class, err -> failedRequests.get(err.getFailure()).increment());
    }

    private Mono<Void> proxy(HttpServerRequest req, HttpServerResponse res, InvokePath path, String target) {
        Context parent = tracing.extract(req.requestHeaders());
        Span span = tracing.startClientSpan(parent, req.method().name(), path.functionId());
        Timer.Sample sample = Timer.start(meterRegistry);

        return client
            .headers(outbound -> copyRequestHeaders(req.requestHeaders(), outbound, parent, span))
            .request(req.method())
            .uri(target)
            .send(req.receive().retain())
            .response((upstream, body) -> {
                span.setAttribute("http.response.status_code", upstream.status().code());
                return res.status(upstream.status())
                    .headers(upstream.responseHeaders())
                    .send(body.retain());
            })
            .then()
            .onErrorMap(err -> !(err instanceof RoutingException), err -> {
                log.warn("Upstream {} failed: {}", target, err.toString());
                return new RoutingException(RoutingFailure.UPSTREAM_ERROR, "Upstream request failed: " + target, err);
            })
            .doOnError(err -> span.setStatus(StatusCode.ERROR, err.getMessage()))
            .doFinally(signal -> {
                sample.stop(upstreamLatency);
                span.end();
            });
    }

    private void copyRequestHeaders(HttpHeaders inbound, HttpHeaders outbound, Context parent, Span span) {
        outbound.set(inbound);
        outbound.remove(HttpHeaderNames.HOST);
        tracing.inject(parent, span, outbound);
    }

    private static InetAddress clientAddress(HttpServerRequest req) {
        InetSocketAddress remote = req.remoteAddress();
        if (remote == null || remote.getAddress() == null) {
            throw new RoutingException(RoutingFailure.BAD_REQUEST, "Client address unavailable");
        }
        return remote.getAddress();
    }

    private Counter requestCounter(String outcome) {
        return Counter.builder(MetricsNames.ROUTER_REQUESTS_TOTAL)
            .tag(MetricsTags.OUTCOME, outcome)
            .register(meterRegistry);
    }
}
