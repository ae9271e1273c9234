/* (C)2026 */
package com.ammann.petrophysics.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Well registration and per-well analysis endpoints
     */
    public static final class Wells {
        private Wells() {}

        public static final String BASE = "/wells";
        public static final String WELL = BASE + "/{wellName}";
        public static final String POROSITY = WELL + "/porosity";
        public static final String SHALE = WELL + "/shale";
        public static final String SATURATION = WELL + "/saturation";
    }

    /**
     * Multi-well endpoints
     */
    public static final class Field {
        private Field() {}

        public static final String BASE = "/field";
        public static final String POROSITY = BASE + "/porosity";
    }

    /**
     * Standalone statistics endpoints
     */
    public static final class Statistics {
        private Statistics() {}

        public static final String BASE = "/statistics";
    }
}
