/* (C)2026 */
package com.ammann.composemanager.service;

import com.ammann.composemanager.config.ComposeDiscoveryConfig;
import com.ammann.composemanager.dto.ConflictErrorDTO;
import com.ammann.composemanager.dto.DiscoveredFileDTO;
import com.ammann.composemanager.dto.LiveProjectDTO;
import com.ammann.composemanager.dto.ServiceInfoDTO;
import com.ammann.composemanager.dto.UnifiedProjectDTO;
import com.ammann.composemanager.model.ProjectState;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Merges live compose projects with the compose files discovered on disk.
 *
 * <p>Live projects are matched to resolved files by case-insensitive project name, falling
 * back to the config files Docker Compose recorded for the project, first by translated path and
 * then by file and directory name. A file is given to at most one live project. Matched and
 * unmatched live projects are returned first, followed by one {@code not-started} entry for every
 * file no live project claimed. Each entry carries the actions it currently allows.
 */
@ApplicationScoped
public class ProjectMatchingService {

    static final String NO_FILE_WARNING = "No compose file found for this project";
    static final String DISABLED_WARNING = "Project is disabled (x-disabled: true)";

    @Inject ComposeFileCacheService cacheService;

    @Inject ConflictResolutionService conflictService;

    @Inject RuntimeProjectProvider runtimeProvider;

    @Inject ComposeDiscoveryConfig config;

    @Inject Logger logger;

    /**
     * Builds the unified project list for a user.
     *
     * <p>Live projects and discovered files are fetched concurrently on the worker pool. A
     * failure of either source fails the returned {@link Uni}.
     *
     * @param userId the calling user, passed to the runtime provider
     * @return the unified projects
     */
    public Uni<List<UnifiedProjectDTO>> getUnifiedProjects(String userId) {
        Uni<List<LiveProjectDTO>> live =
                Uni.createFrom()
                        .item(() -> runtimeProvider.getProjectsForUser(userId))
                        .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
        Uni<List<DiscoveredFileDTO>> files =
                Uni.createFrom()
                        .item(() -> cacheService.getOrScan())
                        .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());

        return Uni.combine()
                .all()
                .unis(live, files)
                .asTuple()
                .map(tuple -> merge(tuple.getItem1(), tuple.getItem2()));
    }

    /**
     * Merges already fetched live projects and discovered files.
     *
     * @param liveProjects    the projects reported by the runtime
     * @param discoveredFiles the files found on disk, conflicts not yet resolved
     * @return live entries in provider order followed by not-started entries in file order
     */
    List<UnifiedProjectDTO> merge(
            List<LiveProjectDTO> liveProjects, List<DiscoveredFileDTO> discoveredFiles) {
        ConflictResolution resolution = conflictService.resolve(discoveredFiles);
        for (ConflictErrorDTO conflict : resolution.conflictErrors()) {
            logger.warnf(
                    "Compose file conflict for project %s: %s",
                    conflict.projectName(), conflict.conflictingFiles());
        }

        List<DiscoveredFileDTO> resolved = resolution.resolvedFiles();
        Map<String, List<DiscoveredFileDTO>> byName = new HashMap<>();
        Map<String, DiscoveredFileDTO> byPath = new HashMap<>();
        for (DiscoveredFileDTO file : resolved) {
            byName.computeIfAbsent(fold(file.projectName()), name -> new ArrayList<>()).add(file);
            byPath.putIfAbsent(fold(file.filePath()), file);
        }

        Set<String> claimedPaths = new HashSet<>();
        List<UnifiedProjectDTO> unified = new ArrayList<>();

        for (LiveProjectDTO project : liveProjects) {
            Optional<DiscoveredFileDTO> match =
                    matchByName(project, byName, claimedPaths)
                            .or(() -> matchByConfigFiles(project, byPath, claimedPaths))
                            .or(
                                    () ->
                                            matchByFileAndDirectoryName(
                                                    project, resolved, claimedPaths));

            if (match.isPresent()) {
                DiscoveredFileDTO file = match.get();
                claimedPaths.add(file.filePath());
                unified.add(fromLiveWithFile(project, file));
            } else {
                logger.debugf("No compose file found for live project %s", project.name());
                unified.add(fromLiveOnly(project));
            }
        }

        for (DiscoveredFileDTO file : resolved) {
            if (!claimedPaths.contains(file.filePath())) {
                unified.add(fromFileOnly(file));
            }
        }

        logger.debugf(
                "Unified %d projects from %d live projects and %d resolved files",
                unified.size(), liveProjects.size(), resolved.size());
        return unified;
    }

    private UnifiedProjectDTO fromLiveWithFile(LiveProjectDTO project, DiscoveredFileDTO file) {
        List<ServiceInfoDTO> services =
                project.services().isEmpty()
                        ? synthesizeServices(project.name(), file, ProjectState.UNKNOWN)
                        : project.services();
        return new UnifiedProjectDTO(
                project.name(),
                project.path() != null ? project.path() : file.directoryPath(),
                project.state(),
                true,
                file.filePath(),
                services,
                file.isDisabled() ? DISABLED_WARNING : null,
                ActionClassifier.computeActions(true, project.state()));
    }

    private UnifiedProjectDTO fromLiveOnly(LiveProjectDTO project) {
        return new UnifiedProjectDTO(
                project.name(),
                project.path(),
                project.state(),
                false,
                null,
                project.services(),
                NO_FILE_WARNING,
                ActionClassifier.computeActions(false, project.state()));
    }

    private UnifiedProjectDTO fromFileOnly(DiscoveredFileDTO file) {
        String state = ProjectState.NOT_STARTED.value();
        return new UnifiedProjectDTO(
                file.projectName(),
                file.directoryPath(),
                state,
                true,
                file.filePath(),
                synthesizeServices(file.projectName(), file, ProjectState.NOT_STARTED),
                file.isDisabled() ? DISABLED_WARNING : null,
                ActionClassifier.computeActions(true, state));
    }

    private Optional<DiscoveredFileDTO> matchByName(
            LiveProjectDTO project,
            Map<String, List<DiscoveredFileDTO>> byName,
            Set<String> claimedPaths) {
        return byName.getOrDefault(fold(project.name()), List.of()).stream()
                .filter(file -> !claimedPaths.contains(file.filePath()))
                .findFirst();
    }

    private Optional<DiscoveredFileDTO> matchByConfigFiles(
            LiveProjectDTO project,
            Map<String, DiscoveredFileDTO> byPath,
            Set<String> claimedPaths) {
        for (String configFile : project.configFiles()) {
            String translated = translateHostPath(configFile);
            DiscoveredFileDTO file = byPath.get(fold(translated));
            if (file != null && !claimedPaths.contains(file.filePath())) {
                logger.debugf(
                        "Matched live project %s to %s via its config files",
                        project.name(), file.filePath());
                return Optional.of(file);
            }
        }
        return Optional.empty();
    }

    /**
     * Last resort for host paths that cannot be translated, such as Windows paths reported by
     * Docker Desktop: the first config file matches a discovered file with the same file name in
     * a directory of the same name.
     */
    private Optional<DiscoveredFileDTO> matchByFileAndDirectoryName(
            LiveProjectDTO project, List<DiscoveredFileDTO> resolved, Set<String> claimedPaths) {
        if (project.configFiles().isEmpty()) {
            return Optional.empty();
        }
        String configFile = project.configFiles().get(0);
        String fileName = fileName(configFile);
        String directoryName = parentDirectoryName(configFile);
        if (fileName == null || directoryName == null) {
            return Optional.empty();
        }

        for (DiscoveredFileDTO file : resolved) {
            if (!claimedPaths.contains(file.filePath())
                    && fileName.equalsIgnoreCase(fileName(file.filePath()))
                    && directoryName.equalsIgnoreCase(fileName(file.directoryPath()))) {
                logger.debugf(
                        "Matched live project %s to %s by file name %s in %s",
                        project.name(), file.filePath(), fileName, directoryName);
                return Optional.of(file);
            }
        }
        return Optional.empty();
    }

    /**
     * Translates a host path reported by Docker into the path under the compose root.
     *
     * @param hostPath the path as seen by the Docker daemon
     * @return the translated path, or the input when no mapping applies
     */
    String translateHostPath(String hostPath) {
        Optional<String> mapping = config.hostPathMapping().filter(m -> !m.isBlank());
        if (mapping.isEmpty()) {
            return hostPath;
        }
        try {
            Path host = Path.of(mapping.get()).normalize();
            Path candidate = Path.of(hostPath).normalize();
            if (!candidate.startsWith(host)) {
                return hostPath;
            }
            Path root = Path.of(config.rootPath()).toAbsolutePath().normalize();
            return root.resolve(host.relativize(candidate)).normalize().toString();
        } catch (InvalidPathException e) {
            logger.debugf("Cannot translate config file path %s: %s", hostPath, e.getMessage());
            return hostPath;
        }
    }

    private static List<ServiceInfoDTO> synthesizeServices(
            String projectName, DiscoveredFileDTO file, ProjectState state) {
        return file.services().stream()
                .map(
                        service ->
                                new ServiceInfoDTO(
                                        projectName + "_" + service,
                                        service,
                                        null,
                                        state.value(),
                                        "",
                                        List.of(),
                                        null))
                .toList();
    }

    /**
     * Returns the last segment of a path, accepting both {@code /} and {@code \} separators.
     *
     * @param path the path
     * @return the last segment, or {@code null} if there is none
     */
    static String fileName(String path) {
        String trimmed = trimSeparators(path);
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    /**
     * Returns the name of the directory that contains a path, accepting both {@code /} and
     * {@code \} separators.
     *
     * @param path the path
     * @return the parent directory name, or {@code null} if the path has no parent
     */
    static String parentDirectoryName(String path) {
        String trimmed = trimSeparators(path);
        int lastSeparator = trimmed.lastIndexOf('/');
        if (lastSeparator <= 0) {
            return null;
        }
        return fileName(trimmed.substring(0, lastSeparator));
    }

    private static String trimSeparators(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.replace('\\', '/');
        int end = normalized.length();
        while (end > 0 && normalized.charAt(end - 1) == '/') {
            end--;
        }
        return normalized.substring(0, end);
    }

    private static String fold(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
