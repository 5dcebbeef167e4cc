package com.fnmesh.router.http;

import io.netty.handler.codec.http.HttpHeaders;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;

import java.util.UUID;

/**
 * Continues the caller's trace across the proxy hop.
 * <p>
 * The trace context is extracted from the inbound headers, a client span is started under it,
 * and the resulting context is injected into the outbound headers. Header format is whatever
 * the configured propagators write ({@code traceparent}/{@code tracestate} for W3C).
 * </p>
 */
public class TracePropagation {

    private static final String INSTRUMENTATION_NAME = "com.fnmesh.router";

    private static final TextMapGetter<HttpHeaders> GETTER = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(HttpHeaders carrier) {
            return carrier.names();
        }

        @Override
        public String get(HttpHeaders carrier, String key) {
            return carrier == null ? null : carrier.get(key);
        }
    };

    private static final TextMapSetter<HttpHeaders> SETTER = (carrier, key, value) -> {
        if (carrier != null) {
            carrier.set(key, value);
        }
    };

    private final TextMapPropagator propagator;
    private final Tracer tracer;

    public TracePropagation(OpenTelemetry openTelemetry) {
        this.propagator = openTelemetry.getPropagators().getTextMapPropagator();
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }

    /**
     * Context carried by the inbound request headers, or the current context if they carry none.
     */
    public Context extract(HttpHeaders inbound) {
        return propagator.extract(Context.current(), inbound, GETTER);
    }

    /**
     * Starts the span covering the outbound call. The caller ends it.
     */
    public Span startClientSpan(Context parent, String method, UUID functionId) {
        return tracer.spanBuilder("invoke " + functionId)
            .setParent(parent)
            .setSpanKind(SpanKind.CLIENT)
            .setAttribute("http.request.method", method)
            .setAttribute("faas.invoked_name", functionId.toString())
            .startSpan();
    }

    /**
     * Writes the context of {@code span} into the outbound headers, replacing any trace headers copied
     * from the inbound request.
     */
    public void inject(Context parent, Span span, HttpHeaders outbound) {
        propagator.inject(parent.with(span), outbound, SETTER);
    }
}
