package com.fnmesh.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for router instance identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for registry event type (created/deleted/data_changed/session/other).
     */
    public static final String TYPE = "type";

    /**
     * Tag key for request outcome (ok/not_found/unavailable/upstream_error/bad_request).
     */
    public static final String OUTCOME = "outcome";

}
