/* (C)2026 */
package com.ammann.composemanager.config;

import io.smallrye.config.ConfigMapping;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration mapping for the live project view read from the Docker daemon.
 *
 * <p>Hidden projects are never reported by the runtime provider, so they appear neither as
 * running projects nor as a reason to suppress a discovered file. Sourced from the
 * {@code compose.runtime.hidden-projects} configuration property.
 */
@ConfigMapping(prefix = "compose.runtime")
public interface ComposeRuntimeConfig {

    /**
     * Returns the set of hidden compose project names.
     *
     * @return an optional set of project names, empty if none are configured
     */
    Optional<Set<String>> hiddenProjects();

    /**
     * Determines whether a compose project is hidden. Names are compared case-insensitively.
     *
     * @param projectName the compose project name as reported by Docker
     * @return {@code true} if the project appears in the hidden set
     */
    default boolean isHidden(String projectName) {
        if (projectName == null) {
            return false;
        }
        return hiddenProjects()
                .map(set -> set.stream().anyMatch(projectName::equalsIgnoreCase))
                .orElse(false);
    }
}
