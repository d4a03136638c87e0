/* (C)2026 */
package com.ammann.composemanager.model;

import java.util.Locale;

/**
 * Normalized state of a compose project.
 *
 * <p>The core only observes these states; transitions belong to the Docker daemon.
 * {@link #DEGRADED} (some services running, others not) is gated exactly like
 * {@link #RUNNING}. {@link #UNKNOWN} covers values outside the vocabulary: containers exist
 * but their state is not recognised.
 */
public enum ProjectState {
    RUNNING("running"),
    STOPPED("stopped"),
    PAUSED("paused"),
    DEGRADED("degraded"),
    NOT_STARTED("not-started"),
    UNKNOWN("unknown");

    private final String value;

    ProjectState(String value) {
        this.value = value;
    }

    /**
     * Returns the wire value of this state.
     *
     * @return the lower-case state name
     */
    public String value() {
        return value;
    }

    /**
     * Normalizes a free-form state string. Matching is case-insensitive and ignores
     * surrounding whitespace; {@code null} and blank values mean {@link #NOT_STARTED}.
     *
     * @param state the state reported by the runtime, may be {@code null}
     * @return the normalized state, never {@code null}
     */
    public static ProjectState normalize(String state) {
        if (state == null || state.isBlank()) {
            return NOT_STARTED;
        }
        String candidate = state.trim().toLowerCase(Locale.ROOT);
        for (ProjectState projectState : values()) {
            if (projectState.value.equals(candidate)) {
                return projectState;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return value;
    }
}
