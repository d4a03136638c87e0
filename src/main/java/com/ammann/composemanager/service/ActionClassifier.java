/* (C)2026 */
package com.ammann.composemanager.service;

import com.ammann.composemanager.model.ComposeAction;
import com.ammann.composemanager.model.ProjectState;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decides which compose actions are available for a project.
 *
 * <p>Availability depends only on whether a compose file is known and on the normalized project
 * state; the table itself lives in {@link ComposeAction}. Results always contain every action
 * key, in declaration order.
 *
 * <p>Two fixed command sets classify raw {@code docker compose} sub-commands for callers that
 * authorize or dispatch them:
 * <ul>
 *   <li>{@link #REQUIRES_DEFINITION_FILE}: commands that read service definitions and cannot run
 *       with a project name alone.</li>
 *   <li>{@link #WORKS_WITHOUT_FILE}: commands that operate on existing containers via
 *       {@code docker compose -p <project>}.</li>
 * </ul>
 */
public final class ActionClassifier {

    private ActionClassifier() {}

    public static final List<String> REQUIRES_DEFINITION_FILE =
            List.of("up", "create", "run", "build", "pull", "push", "config", "convert");

    // 'down' is safe without a file only as long as '-v' is not passed.
    public static final List<String> WORKS_WITHOUT_FILE =
            List.of(
                    "start", "stop", "restart", "pause", "unpause", "ps", "logs", "top", "down",
                    "rm", "kill");

    /**
     * Computes the available actions for a project.
     *
     * @param hasFile whether a compose file is available for the project
     * @param state   the project state, normalized via {@link ProjectState#normalize(String)}
     * @return an unmodifiable map from every action key to its availability
     */
    public static Map<String, Boolean> computeActions(boolean hasFile, String state) {
        ProjectState projectState = ProjectState.normalize(state);

        Map<String, Boolean> actions = new LinkedHashMap<>();
        for (ComposeAction action : ComposeAction.values()) {
            actions.put(action.key(), action.isAvailable(hasFile, projectState));
        }
        return Collections.unmodifiableMap(actions);
    }

    /**
     * Checks whether a compose command needs the compose file.
     *
     * @param command the sub-command name, case-insensitive
     * @return {@code true} if the command is in {@link #REQUIRES_DEFINITION_FILE}
     */
    public static boolean requiresDefinitionFile(String command) {
        return command != null && REQUIRES_DEFINITION_FILE.contains(command.toLowerCase(Locale.ROOT));
    }

    /**
     * Checks whether a compose command can run with the project name alone.
     *
     * @param command the sub-command name, case-insensitive
     * @return {@code true} if the command is in {@link #WORKS_WITHOUT_FILE}
     */
    public static boolean worksWithoutFile(String command) {
        return command != null && WORKS_WITHOUT_FILE.contains(command.toLowerCase(Locale.ROOT));
    }
}
