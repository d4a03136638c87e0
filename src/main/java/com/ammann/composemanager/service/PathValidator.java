/* (C)2026 */
package com.ammann.composemanager.service;

import com.ammann.composemanager.config.ComposeDiscoveryConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOError;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import org.jboss.logging.Logger;

/**
 * Confirms that a user-supplied path stays inside the configured compose root.
 *
 * <p>Paths are resolved to their absolute, normalized form before the containment check, so
 * {@code root/sub/../docker-compose.yml} is accepted while {@code root/../etc/passwd} is
 * rejected. Containment is checked per path segment: {@code /srv/compose-extra} does not lie
 * within {@code /srv/compose}. Every rejection is logged as a warning for security monitoring.
 */
@ApplicationScoped
public class PathValidator {

    /** Longest path accepted, matching PATH_MAX on Linux. */
    static final int MAX_PATH_LENGTH = 4096;

    static final boolean CASE_INSENSITIVE_FILESYSTEM = isCaseInsensitiveFilesystem();

    @Inject ComposeDiscoveryConfig config;

    @Inject Logger logger;

    /**
     * Checks whether the path lies within the compose root. Never throws.
     *
     * @param path the path to check, absolute or relative to the working directory
     * @return {@code true} if the resolved path is the root or lies below it
     */
    public boolean isValid(String path) {
        if (path == null || path.isBlank()) {
            logger.warn("Path validation failed: empty or null path");
            return false;
        }

        if (path.length() > MAX_PATH_LENGTH) {
            logger.warnf("Path validation failed: path too long (%d chars)", path.length());
            return false;
        }

        try {
            Path root = resolve(config.rootPath());
            Path candidate = resolve(path);

            if (!isWithin(candidate, root)) {
                logger.warnf("Path traversal attempt detected. Path: %s, Root: %s", path, root);
                return false;
            }
            return true;
        } catch (InvalidPathException | SecurityException | IOError e) {
            logger.warnf("Path validation failed for %s: %s", path, e.getMessage());
            return false;
        }
    }

    /**
     * Returns the absolute, normalized form of a path, as the scanner reports file paths.
     *
     * @param path a path that passed {@link #isValid(String)}
     * @return the normalized path
     */
    public String normalize(String path) {
        return resolve(path).toString();
    }

    private Path resolve(String path) {
        return Path.of(path).toAbsolutePath().normalize();
    }

    private boolean isWithin(Path candidate, Path root) {
        if (CASE_INSENSITIVE_FILESYSTEM) {
            return Path.of(candidate.toString().toLowerCase(Locale.ROOT))
                    .startsWith(Path.of(root.toString().toLowerCase(Locale.ROOT)));
        }
        return candidate.startsWith(root);
    }

    private static boolean isCaseInsensitiveFilesystem() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.contains("win") || os.contains("mac");
    }
}
