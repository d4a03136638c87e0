/* (C)2026 */
package com.ammann.composemanager.dto;

import java.time.Instant;
import java.util.List;

/**
 * A compose file found on disk by the scanner.
 *
 * <p>Instances only exist for files that parsed successfully and declare at least one service.
 * They are never mutated; a rescan replaces the whole list.
 *
 * @param filePath      absolute path of the compose file, unique within one scan
 * @param projectName   project name taken from the {@code name} attribute or derived from the
 *                      directory and file name
 * @param directoryPath absolute path of the directory containing the file
 * @param lastModified  last modification time reported by the filesystem
 * @param isValid       whether the file is valid YAML with a non-empty {@code services} mapping
 * @param isDisabled    whether the file carries {@code x-disabled: true}
 * @param services      service names in declaration order, without duplicates
 */
public record DiscoveredFileDTO(
        String filePath,
        String projectName,
        String directoryPath,
        Instant lastModified,
        boolean isValid,
        boolean isDisabled,
        List<String> services) {

    public DiscoveredFileDTO {
        services = services == null ? List.of() : List.copyOf(services);
    }
}
