/* (C)2026 */
package com.ammann.composemanager.service;

import com.ammann.composemanager.config.ComposeDiscoveryConfig;
import com.ammann.composemanager.dto.DiscoveredFileDTO;
import com.ammann.composemanager.exception.ComposeScanException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.FileSystemLoopException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jboss.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Discovers compose files below the configured root directory.
 *
 * <p>The walk is bounded by {@link ComposeDiscoveryConfig#scanDepthLimit()} and skips
 * well-known dependency and build directories. Every {@code *.yml} / {@code *.yaml} file within
 * the size limit is parsed; files that are not valid YAML or that declare no services are left
 * out of the result without raising an error. Symbolic links to files and directories are
 * followed; a link that points back into its own ancestry is skipped.
 */
@ApplicationScoped
public class ComposeFileScanner {

    static final String DISABLED_ATTRIBUTE = "x-disabled";

    private static final Set<String> STANDARD_FILE_NAMES =
            Set.of("docker-compose.yml", "docker-compose.yaml", "compose.yml", "compose.yaml");

    private static final Set<String> EXCLUDED_DIRECTORIES =
            Set.of(
                    "node_modules",
                    ".git",
                    ".svn",
                    ".hg",
                    "vendor",
                    "__pycache__",
                    ".venv",
                    "venv",
                    "bin",
                    "obj",
                    ".vs",
                    ".idea",
                    "packages",
                    "target",
                    "dist",
                    "build",
                    ".next",
                    ".nuxt",
                    "coverage",
                    ".cache");

    @Inject ComposeDiscoveryConfig config;

    @Inject Logger logger;

    /**
     * Walks the compose root and returns every valid compose file, sorted by path.
     *
     * @return the discovered files, never {@code null}
     * @throws ComposeScanException if the root directory is missing, unreadable or the walk
     *     fails as a whole
     */
    public List<DiscoveredFileDTO> scan() {
        Path root = Path.of(config.rootPath()).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new ComposeScanException(root.toString(), "root directory does not exist");
        }
        if (!Files.isReadable(root)) {
            throw new ComposeScanException(root.toString(), "root directory is not readable");
        }

        logger.infof(
                "Scanning compose files in %s (depth limit %d)", root, config.scanDepthLimit());
        long started = System.nanoTime();

        List<DiscoveredFileDTO> discovered = new ArrayList<>();
        try {
            Files.walkFileTree(
                    root,
                    EnumSet.of(FileVisitOption.FOLLOW_LINKS),
                    config.scanDepthLimit() + 1,
                    new ComposeFileVisitor(root, discovered));
        } catch (IOException e) {
            throw new ComposeScanException(root.toString(), e.getMessage(), e);
        }

        discovered.sort(Comparator.comparing(DiscoveredFileDTO::filePath));

        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        logger.infof(
                "Compose scan finished in %d ms: %d valid compose files found",
                elapsedMs, discovered.size());
        return discovered;
    }

    /**
     * Parses a single compose file.
     *
     * @param file the file to parse
     * @return the discovered file, or {@code null} if the file is not valid YAML or declares no
     *     services
     */
    public DiscoveredFileDTO parseOne(Path file) {
        Object document;
        try (InputStream in = Files.newInputStream(file)) {
            document = newYaml().load(in);
        } catch (YAMLException e) {
            logger.debugf("Skipping %s: not valid YAML (%s)", file, e.getMessage());
            return null;
        } catch (IOException e) {
            logger.warnf("Skipping %s: cannot read file (%s)", file, e.getMessage());
            return null;
        }

        if (!(document instanceof Map)) {
            logger.debugf("Skipping %s: top level is not a mapping", file);
            return null;
        }
        Map<?, ?> content = (Map<?, ?>) document;

        Object servicesNode = content.get("services");
        if (!(servicesNode instanceof Map) || ((Map<?, ?>) servicesNode).isEmpty()) {
            logger.debugf("Skipping %s: no services declared", file);
            return null;
        }

        Set<String> services = new LinkedHashSet<>();
        for (Object key : ((Map<?, ?>) servicesNode).keySet()) {
            if (key != null) {
                services.add(key.toString());
            }
        }
        if (services.isEmpty()) {
            logger.debugf("Skipping %s: no services declared", file);
            return null;
        }

        Path absolute = file.toAbsolutePath().normalize();
        Path directory = absolute.getParent();
        Instant lastModified;
        try {
            lastModified = Files.getLastModifiedTime(absolute).toInstant();
        } catch (IOException e) {
            logger.warnf("Skipping %s: cannot read attributes (%s)", file, e.getMessage());
            return null;
        }

        return new DiscoveredFileDTO(
                absolute.toString(),
                resolveProjectName(content.get("name"), absolute),
                directory == null ? "" : directory.toString(),
                lastModified,
                true,
                isDisabled(content.get(DISABLED_ATTRIBUTE)),
                new ArrayList<>(services));
    }

    static String resolveProjectName(Object nameAttribute, Path file) {
        if (nameAttribute != null && !nameAttribute.toString().isBlank()) {
            return nameAttribute.toString().trim();
        }

        String fileName = file.getFileName().toString();
        Path parent = file.getParent();
        String directoryName =
                parent == null || parent.getFileName() == null
                        ? ""
                        : parent.getFileName().toString();

        if (STANDARD_FILE_NAMES.contains(fileName.toLowerCase(Locale.ROOT))) {
            return directoryName;
        }

        String stem = stripExtension(fileName);
        if (stem.equalsIgnoreCase(directoryName)) {
            return directoryName;
        }
        return directoryName + "-" + stem;
    }

    static boolean isDisabled(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value instanceof String && "true".equalsIgnoreCase(((String) value).trim());
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static boolean isComposeCandidate(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    private static Yaml newYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private final class ComposeFileVisitor extends SimpleFileVisitor<Path> {

        private final Path root;
        private final List<DiscoveredFileDTO> discovered;
        private final long maxFileSizeBytes;

        ComposeFileVisitor(Path root, List<DiscoveredFileDTO> discovered) {
            this.root = root;
            this.discovered = discovered;
            this.maxFileSizeBytes = config.maxFileSizeKb() * 1024L;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(root)
                    && EXCLUDED_DIRECTORIES.contains(
                            dir.getFileName().toString().toLowerCase(Locale.ROOT))) {
                logger.debugf("Skipping excluded directory %s", dir);
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            // directories one level below the depth limit arrive here as well
            if (!attrs.isRegularFile() || !isComposeCandidate(file)) {
                return FileVisitResult.CONTINUE;
            }
            if (attrs.size() > maxFileSizeBytes) {
                logger.warnf(
                        "Skipping %s: file size %d bytes exceeds limit of %d KB",
                        file, attrs.size(), config.maxFileSizeKb());
                return FileVisitResult.CONTINUE;
            }

            DiscoveredFileDTO parsed = parseOne(file);
            if (parsed != null) {
                logger.debugf(
                        "Discovered compose file %s (project %s, %d services)",
                        parsed.filePath(), parsed.projectName(), parsed.services().size());
                discovered.add(parsed);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            if (file.equals(root)) {
                throw new ComposeScanException(root.toString(), exc.getMessage(), exc);
            }
            if (exc instanceof FileSystemLoopException) {
                logger.debugf("Skipping %s: symbolic link cycle", file);
                return FileVisitResult.CONTINUE;
            }
            logger.warnf("Cannot access %s, skipping: %s", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }
    }
}
