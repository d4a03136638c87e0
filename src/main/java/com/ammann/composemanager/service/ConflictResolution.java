/* (C)2026 */
package com.ammann.composemanager.service;

import com.ammann.composemanager.dto.ConflictErrorDTO;
import com.ammann.composemanager.dto.DiscoveredFileDTO;
import java.util.List;

/**
 * Outcome of one conflict resolution pass.
 *
 * @param resolvedFiles  at most one file per project name, in first-seen order
 * @param conflictErrors one entry per project with more than one active file
 */
public record ConflictResolution(
        List<DiscoveredFileDTO> resolvedFiles, List<ConflictErrorDTO> conflictErrors) {

    public ConflictResolution {
        resolvedFiles = List.copyOf(resolvedFiles);
        conflictErrors = List.copyOf(conflictErrors);
    }

    public boolean hasConflicts() {
        return !conflictErrors.isEmpty();
    }
}
