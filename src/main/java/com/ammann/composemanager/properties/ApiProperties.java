package com.ammann.composemanager.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralised path constants for the REST API.
 *
 * <p>Resource classes reference these constants to keep URL construction consistent.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1 endpoints. */
    public static final String BASE_URL_V1 = "/api/v1";

    /** Path constants for compose discovery endpoints. */
    public static final class Compose {
        private Compose() {}

        public static final String BASE = "/compose";
        public static final String PROJECTS = "/projects";
        public static final String FILES = "/files";
        public static final String FILE_BY_PATH = FILES + "/by-path";
        public static final String CONFLICTS = "/conflicts";
        public static final String REFRESH = "/refresh";
    }
}
