/* (C)2026 */
package com.ammann.composemanager.service;

import com.ammann.composemanager.dto.ConflictErrorDTO;
import com.ammann.composemanager.dto.DiscoveredFileDTO;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Picks the single active compose file for each project name.
 *
 * <p>Files are grouped by their exact project name. A group yields its one active file; a group
 * of disabled files yields nothing; a group with several active files yields nothing and is
 * reported as a {@link ConflictErrorDTO} so the operator can disable the extras. The service
 * holds no state between calls.
 */
@ApplicationScoped
public class ConflictResolutionService {

    @Inject Logger logger;

    /**
     * Resolves naming conflicts among discovered files.
     *
     * @param files the discovered files, possibly containing several files per project
     * @return the resolved files together with the conflicts found in this call
     */
    public ConflictResolution resolve(List<DiscoveredFileDTO> files) {
        Map<String, List<DiscoveredFileDTO>> byProject = new LinkedHashMap<>();
        for (DiscoveredFileDTO file : files) {
            byProject.computeIfAbsent(file.projectName(), name -> new ArrayList<>()).add(file);
        }

        List<DiscoveredFileDTO> resolved = new ArrayList<>();
        List<ConflictErrorDTO> conflicts = new ArrayList<>();

        for (Map.Entry<String, List<DiscoveredFileDTO>> group : byProject.entrySet()) {
            String projectName = group.getKey();
            List<DiscoveredFileDTO> members = group.getValue();

            if (members.size() == 1) {
                resolved.add(members.get(0));
                continue;
            }

            List<DiscoveredFileDTO> active =
                    members.stream().filter(file -> !file.isDisabled()).toList();

            if (active.size() == 1) {
                logger.debugf(
                        "Project %s: using %s, %d disabled files ignored",
                        projectName, active.get(0).filePath(), members.size() - 1);
                resolved.add(active.get(0));
            } else if (active.isEmpty()) {
                logger.warnf(
                        "Project %s: all %d compose files are disabled, project ignored",
                        projectName, members.size());
            } else {
                ConflictErrorDTO conflict = conflictFor(projectName, members);
                logger.warnf(
                        "Project %s: %d active compose files found: %s",
                        projectName, active.size(), conflict.conflictingFiles());
                conflicts.add(conflict);
            }
        }

        return new ConflictResolution(resolved, conflicts);
    }

    static ConflictErrorDTO conflictFor(String projectName, List<DiscoveredFileDTO> members) {
        List<String> paths =
                members.stream().map(DiscoveredFileDTO::filePath).sorted().toList();
        return new ConflictErrorDTO(
                projectName,
                paths,
                String.format(
                        "Multiple active compose files found for project '%s'. Mark unused"
                                + " files with 'x-disabled: true'.",
                        projectName),
                List.of(
                        "Open each conflicting compose file",
                        "Add 'x-disabled: true' at the root level of files you want to ignore",
                        String.format("Keep only one file active for project '%s'", projectName),
                        "Wait for the next scan cycle or restart the application"));
    }
}
