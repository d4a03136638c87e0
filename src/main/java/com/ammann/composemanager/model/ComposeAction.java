/* (C)2026 */
package com.ammann.composemanager.model;

import static com.ammann.composemanager.model.ProjectState.DEGRADED;
import static com.ammann.composemanager.model.ProjectState.NOT_STARTED;
import static com.ammann.composemanager.model.ProjectState.PAUSED;
import static com.ammann.composemanager.model.ProjectState.RUNNING;
import static com.ammann.composemanager.model.ProjectState.STOPPED;
import static com.ammann.composemanager.model.ProjectState.UNKNOWN;

import java.util.EnumSet;
import java.util.Set;

/**
 * Compose actions exposed to clients, each with the condition under which it is available.
 *
 * <p>Every constant is one row of the availability table: whether a compose file is required
 * and in which project states the action may run. Declaration order is the order of the keys
 * in every computed action map.
 */
public enum ComposeAction {
    UP("up", true, anyState()),
    CREATE("create", true, EnumSet.of(NOT_STARTED)),
    BUILD("build", true, anyState()),
    PULL("pull", true, anyState()),
    PUSH("push", true, anyState()),
    CONFIG("config", true, anyState()),
    START("start", false, EnumSet.of(STOPPED)),
    STOP("stop", false, EnumSet.of(RUNNING, DEGRADED)),
    RESTART("restart", false, EnumSet.of(RUNNING, DEGRADED, STOPPED, PAUSED)),
    PAUSE("pause", false, EnumSet.of(RUNNING, DEGRADED)),
    UNPAUSE("unpause", false, EnumSet.of(PAUSED)),
    PS("ps", false, containersExist()),
    LOGS("logs", false, containersExist()),
    TOP("top", false, containersExist()),
    DOWN("down", false, containersExist()),
    RM("rm", false, EnumSet.of(STOPPED)),
    KILL("kill", false, containersExist());

    private final String key;
    private final boolean requiresFile;
    private final Set<ProjectState> permittedStates;

    ComposeAction(String key, boolean requiresFile, Set<ProjectState> permittedStates) {
        this.key = key;
        this.requiresFile = requiresFile;
        this.permittedStates = permittedStates;
    }

    /**
     * Returns the action name as used by {@code docker compose} and in action maps.
     *
     * @return the lower-case action key
     */
    public String key() {
        return key;
    }

    /**
     * Returns whether the action needs the project's compose file.
     *
     * @return {@code true} if the action cannot run with the project name alone
     */
    public boolean requiresFile() {
        return requiresFile;
    }

    /**
     * Evaluates this row of the table.
     *
     * @param hasFile whether a compose file is available for the project
     * @param state   the normalized project state
     * @return {@code true} if the action is currently available
     */
    public boolean isAvailable(boolean hasFile, ProjectState state) {
        return (hasFile || !requiresFile) && permittedStates.contains(state);
    }

    private static Set<ProjectState> anyState() {
        return EnumSet.allOf(ProjectState.class);
    }

    private static Set<ProjectState> containersExist() {
        return EnumSet.of(RUNNING, DEGRADED, STOPPED, PAUSED, UNKNOWN);
    }
}
