/* (C)2026 */
package com.ammann.composemanager.dto;

import java.util.List;

/**
 * Summary of one service of a compose project.
 *
 * <p>For live projects each entry corresponds to a Docker container. For projects known only
 * from their compose file the entry is synthesized from the service name and carries no
 * image or health information.
 *
 * @param id     the container identifier, or {@code <project>_<service>} for synthesized entries
 * @param name   the compose service name
 * @param image  the image reference, {@code null} when unknown
 * @param state  the container state (e.g. "running", "exited", "paused")
 * @param status a human-readable status string (e.g. "Up 5 hours")
 * @param ports  published ports formatted as {@code ip:public->private/type}
 * @param health the health status ("healthy", "unhealthy", "starting"), {@code null} if none
 */
public record ServiceInfoDTO(
        String id,
        String name,
        String image,
        String state,
        String status,
        List<String> ports,
        String health) {

    public ServiceInfoDTO {
        ports = ports == null ? List.of() : List.copyOf(ports);
    }
}
