/* (C)2026 */
package com.ammann.composemanager.service;

import com.ammann.composemanager.dto.LiveProjectDTO;
import java.util.List;

/**
 * Source of the compose projects that currently exist on the container runtime.
 *
 * <p>Implementations return only the projects the given user may see. Failures are not
 * masked; they propagate to the caller of {@link ProjectMatchingService}.
 */
public interface RuntimeProjectProvider {

    /**
     * Lists the live compose projects visible to a user.
     *
     * @param userId the calling user
     * @return the live projects, never {@code null}
     */
    List<LiveProjectDTO> getProjectsForUser(String userId);
}
