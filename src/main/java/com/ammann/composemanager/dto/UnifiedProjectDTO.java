/* (C)2026 */
package com.ammann.composemanager.dto;

import java.util.List;
import java.util.Map;

/**
 * A compose project as presented to clients, merged from the Docker daemon and the discovered
 * compose files.
 *
 * @param name               the project name
 * @param path               the project directory
 * @param state              the project state, {@code not-started} when only a file exists
 * @param hasDefinitionFile  whether a compose file is known for the project
 * @param definitionFilePath the compose file path, {@code null} when none is known
 * @param services           the project's services
 * @param warning            an optional warning for the operator
 * @param availableActions   every compose action mapped to whether it may currently run
 */
public record UnifiedProjectDTO(
        String name,
        String path,
        String state,
        boolean hasDefinitionFile,
        String definitionFilePath,
        List<ServiceInfoDTO> services,
        String warning,
        Map<String, Boolean> availableActions) {

    public UnifiedProjectDTO {
        services = List.copyOf(services);
    }
}
