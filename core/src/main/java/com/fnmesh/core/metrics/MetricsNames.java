package com.fnmesh.core.metrics;

/**
 * Micrometer metric names used by the router.
 * <p>
 * <b>Naming convention:</b> {@code fnrouter.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Number of functions currently present in the backend directory.
     */
    public static final String DIRECTORY_FUNCTIONS = "fnrouter.directory.functions";

    /**
     * Counter: Watch loop iterations that ended in an error and were restarted.
     */
    public static final String DISCOVERY_RESTARTS_TOTAL = "fnrouter.discovery.restarts.total";

    /**
     * Counter: Registry notifications received by the watch loop.
     * <p>
     * Tags: type
     * </p>
     */
    public static final String DISCOVERY_EVENTS_TOTAL = "fnrouter.discovery.events.total";

    /**
     * Counter: Invoke requests handled.
     * <p>
     * Tags: outcome
     * </p>
     */
    public static final String ROUTER_REQUESTS_TOTAL = "fnrouter.router.requests.total";

    /**
     * Timer: Time until the selected backend answered with response headers.
     */
    public static final String ROUTER_UPSTREAM_LATENCY = "fnrouter.router.upstream.latency";
}
