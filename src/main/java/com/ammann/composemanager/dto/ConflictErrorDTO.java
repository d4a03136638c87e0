/* (C)2026 */
package com.ammann.composemanager.dto;

import java.util.List;

/**
 * An unresolved naming collision between compose files.
 *
 * @param projectName      the project name shared by the conflicting files
 * @param conflictingFiles every file of the project, sorted alphabetically
 * @param message          a human-readable description of the conflict
 * @param resolutionSteps  instructions for resolving the conflict
 */
public record ConflictErrorDTO(
        String projectName,
        List<String> conflictingFiles,
        String message,
        List<String> resolutionSteps) {

    public ConflictErrorDTO {
        conflictingFiles = List.copyOf(conflictingFiles);
        resolutionSteps = List.copyOf(resolutionSteps);
    }
}
