/* (C)2026 */
package com.ammann.composemanager.dto;

import java.util.List;

/**
 * A compose project observed on the Docker daemon.
 *
 * @param name        the compose project name
 * @param path        the working directory recorded by Docker Compose, may be {@code null}
 * @param state       the aggregated project state ("running", "stopped", "paused", "degraded")
 * @param services    the project's containers
 * @param configFiles the compose files Docker Compose was started with, as host paths
 */
public record LiveProjectDTO(
        String name,
        String path,
        String state,
        List<ServiceInfoDTO> services,
        List<String> configFiles) {

    public LiveProjectDTO {
        services = services == null ? List.of() : List.copyOf(services);
        configFiles = configFiles == null ? List.of() : List.copyOf(configFiles);
    }
}
