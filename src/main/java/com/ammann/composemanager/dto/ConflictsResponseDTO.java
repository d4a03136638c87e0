/* (C)2026 */
package com.ammann.composemanager.dto;

import java.util.List;

/**
 * Response body of the conflicts endpoint.
 *
 * @param conflicts    all conflicts detected in the current scan
 * @param hasConflicts whether {@code conflicts} is non-empty
 */
public record ConflictsResponseDTO(List<ConflictErrorDTO> conflicts, boolean hasConflicts) {

    public static ConflictsResponseDTO of(List<ConflictErrorDTO> conflicts) {
        return new ConflictsResponseDTO(List.copyOf(conflicts), !conflicts.isEmpty());
    }
}
