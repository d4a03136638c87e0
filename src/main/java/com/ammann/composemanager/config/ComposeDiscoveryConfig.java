/* (C)2026 */
package com.ammann.composemanager.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import java.util.Optional;

/**
 * Configuration mapping for compose file discovery.
 *
 * <p>All filesystem work performed by the scanner and the path validator is bounded by these
 * values. Sourced from the {@code compose.discovery.*} configuration properties.
 */
@ConfigMapping(prefix = "compose.discovery")
public interface ComposeDiscoveryConfig {

    /**
     * Returns the directory under which compose files are discovered.
     *
     * @return the root path, absolute or relative to the working directory
     */
    @WithDefault("/app/compose-files")
    String rootPath();

    /**
     * Returns the maximum directory depth below the root that is scanned. Files located in a
     * directory at exactly this depth are still discovered.
     *
     * @return the depth limit, the root itself being depth 0
     */
    @WithDefault("5")
    int scanDepthLimit();

    /**
     * Returns how long a scan result stays valid in the cache.
     *
     * @return the cache time-to-live in seconds
     */
    @WithDefault("10")
    int cacheDurationSeconds();

    /**
     * Returns the largest file size that is still parsed.
     *
     * @return the size limit in KiB
     */
    @WithName("max-file-size-kb")
    @WithDefault("1024")
    int maxFileSizeKb();

    /**
     * Returns the host directory that is mounted at {@link #rootPath()}.
     *
     * <p>The Docker daemon reports compose config files with host paths. When set, those paths
     * are translated to paths below the root before they are compared with discovered files.
     *
     * @return the host path prefix, empty when the service runs directly on the host
     */
    Optional<String> hostPathMapping();
}
