/* (C)2026 */
package com.ammann.composemanager.service;

import com.ammann.composemanager.config.ComposeRuntimeConfig;
import com.ammann.composemanager.dto.LiveProjectDTO;
import com.ammann.composemanager.dto.ServiceInfoDTO;
import com.ammann.composemanager.model.ProjectState;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Reads live compose projects from the Docker daemon.
 *
 * <p>Containers are grouped by the labels Docker Compose attaches to them. The daemon has no
 * notion of users, so every caller sees the same set of projects minus the ones configured as
 * hidden.
 */
@ApplicationScoped
public class DockerRuntimeProjectProvider implements RuntimeProjectProvider {

    static final String PROJECT_LABEL = "com.docker.compose.project";
    static final String SERVICE_LABEL = "com.docker.compose.service";
    static final String WORKING_DIR_LABEL = "com.docker.compose.project.working_dir";
    static final String CONFIG_FILES_LABEL = "com.docker.compose.project.config_files";

    @Inject DockerClient dockerClient;

    @Inject ComposeRuntimeConfig runtimeConfig;

    @Inject Logger logger;

    @Override
    public List<LiveProjectDTO> getProjectsForUser(String userId) {
        List<Container> containers =
                dockerClient
                        .listContainersCmd()
                        .withShowAll(true)
                        .withLabelFilter(List.of(PROJECT_LABEL))
                        .exec();

        Map<String, List<Container>> byProject = new TreeMap<>();
        for (Container container : containers) {
            String project = label(container, PROJECT_LABEL);
            if (project == null || project.isBlank()) {
                continue;
            }
            if (runtimeConfig.isHidden(project)) {
                logger.debugf("Skipping hidden project %s", project);
                continue;
            }
            byProject.computeIfAbsent(project, name -> new ArrayList<>()).add(container);
        }

        List<LiveProjectDTO> projects = new ArrayList<>();
        for (Map.Entry<String, List<Container>> entry : byProject.entrySet()) {
            projects.add(toProject(entry.getKey(), entry.getValue()));
        }

        logger.debugf(
                "Found %d live compose projects (%d containers) for user %s",
                projects.size(), containers.size(), userId);
        return projects;
    }

    private LiveProjectDTO toProject(String name, List<Container> containers) {
        List<ServiceInfoDTO> services = containers.stream().map(this::toService).toList();

        String workingDir = null;
        List<String> configFiles = List.of();
        for (Container container : containers) {
            if (workingDir == null) {
                workingDir = label(container, WORKING_DIR_LABEL);
            }
            if (configFiles.isEmpty()) {
                configFiles = splitConfigFiles(label(container, CONFIG_FILES_LABEL));
            }
        }

        return new LiveProjectDTO(
                name, workingDir, aggregateState(containers).value(), services, configFiles);
    }

    private ServiceInfoDTO toService(Container container) {
        String serviceName = label(container, SERVICE_LABEL);
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = containerName(container);
        }
        return new ServiceInfoDTO(
                container.getId(),
                serviceName,
                container.getImage(),
                container.getState(),
                container.getStatus(),
                formatPorts(container.getPorts()),
                parseHealth(container.getStatus()));
    }

    /**
     * Aggregates container states into a project state.
     *
     * @param containers the project's containers, at least one
     * @return {@code running} if all run, {@code degraded} if only some run or any restarts,
     *     {@code paused} if any is paused, otherwise {@code stopped}
     */
    static ProjectState aggregateState(List<Container> containers) {
        long running = 0;
        boolean restarting = false;
        boolean paused = false;
        for (Container container : containers) {
            String state =
                    container.getState() == null
                            ? ""
                            : container.getState().toLowerCase(Locale.ROOT);
            switch (state) {
                case "running" -> running++;
                case "restarting" -> restarting = true;
                case "paused" -> paused = true;
                default -> {}
            }
        }

        if (running == containers.size()) {
            return ProjectState.RUNNING;
        }
        if (running > 0 || restarting) {
            return ProjectState.DEGRADED;
        }
        if (paused) {
            return ProjectState.PAUSED;
        }
        return ProjectState.STOPPED;
    }

    static String parseHealth(String status) {
        if (status == null) {
            return null;
        }
        if (status.contains("(healthy)")) {
            return "healthy";
        }
        if (status.contains("(unhealthy)")) {
            return "unhealthy";
        }
        if (status.contains("(health: starting)")) {
            return "starting";
        }
        return null;
    }

    static List<String> formatPorts(ContainerPort[] ports) {
        if (ports == null) {
            return List.of();
        }
        List<String> formatted = new ArrayList<>();
        for (ContainerPort port : ports) {
            if (port.getPrivatePort() == null) {
                continue;
            }
            String type = port.getType() == null ? "tcp" : port.getType();
            if (port.getPublicPort() == null) {
                formatted.add(port.getPrivatePort() + "/" + type);
            } else {
                String ip = port.getIp() == null ? "" : port.getIp() + ":";
                formatted.add(
                        ip + port.getPublicPort() + "->" + port.getPrivatePort() + "/" + type);
            }
        }
        return formatted;
    }

    private static List<String> splitConfigFiles(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(file -> !file.isEmpty())
                .toList();
    }

    private static String containerName(Container container) {
        String[] names = container.getNames();
        if (names == null || names.length == 0) {
            return container.getId();
        }
        String name = names[0];
        return name.startsWith("/") ? name.substring(1) : name;
    }

    private static String label(Container container, String key) {
        Map<String, String> labels =
                container.getLabels() == null ? Collections.emptyMap() : container.getLabels();
        return labels.get(key);
    }
}
