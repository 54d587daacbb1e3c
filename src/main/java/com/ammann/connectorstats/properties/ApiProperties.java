/* (C)2026 */
package com.ammann.connectorstats.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used by the JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Connector statistics graph endpoints
     */
    public static final class Statistics {
        private Statistics() {}

        public static final String BASE = "/statistics";
        public static final String SOURCE_GRAPH = "/sources/graph";
        public static final String SINK_GRAPH = "/sinks/graph";
        public static final String AXIS_TICKS = "/axis-ticks";
    }
}
