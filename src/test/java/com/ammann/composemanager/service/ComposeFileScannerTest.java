/* (C)2026 */
package com.ammann.composemanager.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.ammann.composemanager.config.ComposeDiscoveryConfig;
import com.ammann.composemanager.config.TestDiscoveryConfig;
import com.ammann.composemanager.dto.DiscoveredFileDTO;
import com.ammann.composemanager.exception.ComposeScanException;
import java.io.IOException;
import java.lang.reflect.Field;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ComposeFileScanner")
class ComposeFileScannerTest {

    private static final String SIMPLE_COMPOSE =
            """
            services:
              web:
                image: nginx:latest
            """;

    @TempDir Path root;

    ComposeFileScanner scanner;

    @BeforeEach
    void setUp() throws Exception {
        scanner = createScanner(TestDiscoveryConfig.withRoot(root.toString()));
    }

    private ComposeFileScanner createScanner(ComposeDiscoveryConfig config) throws Exception {
        ComposeFileScanner instance = new ComposeFileScanner();
        injectField(instance, "config", config);
        injectField(instance, "logger", mock(Logger.class));
        return instance;
    }

    private void injectField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }

    private Path write(String relativePath, String content) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    @Nested
    @DisplayName("scan")
    class Scan {

        @Test
        @DisplayName("should return empty list for an empty root")
        void shouldReturnEmptyListForEmptyRoot() {
            assertThat(scanner.scan()).isEmpty();
        }

        @Test
        @DisplayName("should discover compose files in sub-directories")
        void shouldDiscoverComposeFiles() throws Exception {
            write("app/docker-compose.yml", SIMPLE_COMPOSE);
            write("db/compose.yaml", SIMPLE_COMPOSE);

            List<DiscoveredFileDTO> files = scanner.scan();

            assertThat(files).extracting(DiscoveredFileDTO::projectName).containsExactly("app", "db");
            assertThat(files).allMatch(DiscoveredFileDTO::isValid);
        }

        @Test
        @DisplayName("should sort results by file path")
        void shouldSortByPath() throws Exception {
            write("zeta/compose.yml", SIMPLE_COMPOSE);
            write("alpha/compose.yml", SIMPLE_COMPOSE);
            write("mid/compose.yml", SIMPLE_COMPOSE);

            assertThat(scanner.scan())
                    .extracting(DiscoveredFileDTO::projectName)
                    .containsExactly("alpha", "mid", "zeta");
        }

        @Test
        @DisplayName("should match extensions case-insensitively and ignore other files")
        void shouldMatchExtensionsCaseInsensitively() throws Exception {
            write("app/compose.YML", SIMPLE_COMPOSE);
            write("app/readme.md", SIMPLE_COMPOSE);
            write("app/settings.json", "{}");

            List<DiscoveredFileDTO> files = scanner.scan();

            assertThat(files).hasSize(1);
            assertThat(files.get(0).projectName()).isEqualTo("app");
        }

        @Test
        @DisplayName("should exclude files with an empty services mapping")
        void shouldExcludeEmptyServices() throws Exception {
            write("empty/compose.yml", "services: {}\n");
            write("app/compose.yml", SIMPLE_COMPOSE);

            assertThat(scanner.scan())
                    .extracting(DiscoveredFileDTO::projectName)
                    .containsExactly("app");
        }

        @Test
        @DisplayName("should skip invalid YAML without failing the scan")
        void shouldSkipInvalidYaml() throws Exception {
            write("broken/compose.yml", "services:\n  web: [unclosed\n");
            write("app/compose.yml", SIMPLE_COMPOSE);

            assertThat(scanner.scan())
                    .extracting(DiscoveredFileDTO::projectName)
                    .containsExactly("app");
        }

        @Test
        @DisplayName("should give non-standard files in one directory distinct names")
        void shouldNameNonStandardFilesDistinctly() throws Exception {
            write("pterodactyl/panel.yml", SIMPLE_COMPOSE);
            write("pterodactyl/wings.yml", SIMPLE_COMPOSE);

            assertThat(scanner.scan())
                    .extracting(DiscoveredFileDTO::projectName)
                    .containsExactly("pterodactyl-panel", "pterodactyl-wings");
        }

        @Test
        @DisplayName("should include files at the depth limit and exclude deeper ones")
        void shouldRespectDepthLimit() throws Exception {
            ComposeFileScanner limited =
                    createScanner(
                            new TestDiscoveryConfig(root.toString(), 3, 10, 1024, Optional.empty()));
            write("level1/level2/level3/compose.yml", SIMPLE_COMPOSE);
            write("level1/level2/level3/level4/compose.yml", SIMPLE_COMPOSE);

            List<DiscoveredFileDTO> files = limited.scan();

            assertThat(files).extracting(DiscoveredFileDTO::projectName).containsExactly("level3");
        }

        @Test
        @DisplayName("should include files directly in the root")
        void shouldIncludeRootFiles() throws Exception {
            write("stack.yml", SIMPLE_COMPOSE);

            List<DiscoveredFileDTO> files = scanner.scan();

            assertThat(files).hasSize(1);
            assertThat(files.get(0).filePath()).isEqualTo(root.resolve("stack.yml").toString());
        }

        @Test
        @DisplayName("should skip files larger than the size limit")
        void shouldSkipLargeFiles() throws Exception {
            ComposeFileScanner limited =
                    createScanner(
                            new TestDiscoveryConfig(root.toString(), 5, 10, 1, Optional.empty()));
            write("big/compose.yml", SIMPLE_COMPOSE + "# " + "x".repeat(2048) + "\n");
            write("small/compose.yml", SIMPLE_COMPOSE);

            assertThat(limited.scan())
                    .extracting(DiscoveredFileDTO::projectName)
                    .containsExactly("small");
        }

        @Test
        @DisplayName("should not descend into excluded directories")
        void shouldSkipExcludedDirectories() throws Exception {
            write("app/node_modules/pkg/compose.yml", SIMPLE_COMPOSE);
            write("app/.git/compose.yml", SIMPLE_COMPOSE);
            write("Target/compose.yml", SIMPLE_COMPOSE);
            write("app/compose.yml", SIMPLE_COMPOSE);

            assertThat(scanner.scan())
                    .extracting(DiscoveredFileDTO::projectName)
                    .containsExactly("app");
        }

        @Test
        @DisabledOnOs(OS.WINDOWS)
        @DisplayName("should follow symbolic links to files and directories")
        void shouldFollowSymbolicLinks(@TempDir Path outside) throws Exception {
            Path realFile = Files.writeString(outside.resolve("real.yml"), SIMPLE_COMPOSE);
            Path realProject = Files.createDirectories(outside.resolve("proj"));
            Files.writeString(realProject.resolve("compose.yml"), SIMPLE_COMPOSE);

            Files.createDirectories(root.resolve("linkedfile"));
            Files.createSymbolicLink(root.resolve("linkedfile/compose.yml"), realFile);
            Files.createSymbolicLink(root.resolve("linkeddir"), realProject);

            List<DiscoveredFileDTO> files = scanner.scan();

            assertThat(files)
                    .extracting(DiscoveredFileDTO::projectName)
                    .containsExactly("linkeddir", "linkedfile");
            assertThat(files)
                    .extracting(DiscoveredFileDTO::filePath)
                    .containsExactly(
                            root.resolve("linkeddir/compose.yml").toAbsolutePath().toString(),
                            root.resolve("linkedfile/compose.yml").toAbsolutePath().toString());
        }

        @Test
        @DisabledOnOs(OS.WINDOWS)
        @DisplayName("should skip a directory link that points to its own ancestor")
        void shouldSkipLinkCycles() throws Exception {
            write("app/compose.yml", SIMPLE_COMPOSE);
            Files.createSymbolicLink(root.resolve("app/loop"), root.resolve("app"));

            assertThat(scanner.scan())
                    .extracting(DiscoveredFileDTO::projectName)
                    .containsExactly("app");
        }

        @Test
        @DisplayName("should fail when the root does not exist")
        void shouldFailForMissingRoot() throws Exception {
            Path missing = root.resolve("missing");
            ComposeFileScanner broken =
                    createScanner(TestDiscoveryConfig.withRoot(missing.toString()));

            assertThatThrownBy(broken::scan)
                    .isInstanceOf(ComposeScanException.class)
                    .hasMessageContaining(missing.toString());
        }

        @Test
        @DisplayName("should fail when the root is a regular file")
        void shouldFailForFileRoot() throws Exception {
            Path file = write("compose.yml", SIMPLE_COMPOSE);
            ComposeFileScanner broken = createScanner(TestDiscoveryConfig.withRoot(file.toString()));

            assertThatThrownBy(broken::scan).isInstanceOf(ComposeScanException.class);
        }
    }

    @Nested
    @DisplayName("parseOne")
    class ParseOne {

        @Test
        @DisplayName("should extract metadata from a compose file")
        void shouldExtractMetadata() throws Exception {
            Path file =
                    write(
                            "shop/docker-compose.yml",
                            """
                            services:
                              web:
                                image: nginx
                              api:
                                image: shop-api
                              db:
                                image: postgres
                            """);

            DiscoveredFileDTO result = scanner.parseOne(file);

            assertThat(result).isNotNull();
            assertThat(result.filePath()).isEqualTo(file.toString());
            assertThat(result.directoryPath()).isEqualTo(root.resolve("shop").toString());
            assertThat(result.projectName()).isEqualTo("shop");
            assertThat(result.services()).containsExactly("web", "api", "db");
            assertThat(result.isValid()).isTrue();
            assertThat(result.isDisabled()).isFalse();
            assertThat(result.lastModified()).isEqualTo(Files.getLastModifiedTime(file).toInstant());
        }

        @Test
        @DisplayName("should prefer the name attribute")
        void shouldPreferNameAttribute() throws Exception {
            Path file = write("shop/compose.yml", "name: storefront\n" + SIMPLE_COMPOSE);

            assertThat(scanner.parseOne(file).projectName()).isEqualTo("storefront");
        }

        @Test
        @DisplayName("should ignore a blank name attribute")
        void shouldIgnoreBlankName() throws Exception {
            Path file = write("shop/compose.yml", "name: ''\n" + SIMPLE_COMPOSE);

            assertThat(scanner.parseOne(file).projectName()).isEqualTo("shop");
        }

        @Test
        @DisplayName("should use the directory name when the file is named after it")
        void shouldAvoidDuplicatedName() throws Exception {
            Path file = write("gitea/gitea.yml", SIMPLE_COMPOSE);

            assertThat(scanner.parseOne(file).projectName()).isEqualTo("gitea");
        }

        @Test
        @DisplayName("should read the x-disabled flag")
        void shouldReadDisabledFlag() throws Exception {
            Path disabled = write("a/compose.yml", "x-disabled: true\n" + SIMPLE_COMPOSE);
            Path quoted = write("b/compose.yml", "x-disabled: \"TRUE\"\n" + SIMPLE_COMPOSE);
            Path enabled = write("c/compose.yml", "x-disabled: false\n" + SIMPLE_COMPOSE);
            Path other = write("d/compose.yml", "x-disabled: nope\n" + SIMPLE_COMPOSE);

            assertThat(scanner.parseOne(disabled).isDisabled()).isTrue();
            assertThat(scanner.parseOne(quoted).isDisabled()).isTrue();
            assertThat(scanner.parseOne(enabled).isDisabled()).isFalse();
            assertThat(scanner.parseOne(other).isDisabled()).isFalse();
        }

        @Test
        @DisplayName("should tolerate unresolved variable placeholders")
        void shouldTolerateVariablePlaceholders() throws Exception {
            Path file =
                    write(
                            "app/compose.yml",
                            """
                            services:
                              web:
                                image: ${IMAGE:-nginx}:${TAG}
                                ports:
                                  - "${HTTP_PORT:-8080}:80"
                            """);

            DiscoveredFileDTO result = scanner.parseOne(file);

            assertThat(result).isNotNull();
            assertThat(result.services()).containsExactly("web");
        }

        @Test
        @DisplayName("should return null for invalid YAML")
        void shouldReturnNullForInvalidYaml() throws Exception {
            Path file = write("app/compose.yml", "services: [\n  web: {\n");

            assertThat(scanner.parseOne(file)).isNull();
        }

        @Test
        @DisplayName("should return null without a services mapping")
        void shouldReturnNullWithoutServices() throws Exception {
            Path noServices = write("a/compose.yml", "version: '3.8'\nvolumes:\n  data: {}\n");
            Path listServices = write("b/compose.yml", "services:\n  - web\n");
            Path scalar = write("c/compose.yml", "just a string\n");
            Path empty = write("d/compose.yml", "");

            assertThat(scanner.parseOne(noServices)).isNull();
            assertThat(scanner.parseOne(listServices)).isNull();
            assertThat(scanner.parseOne(scalar)).isNull();
            assertThat(scanner.parseOne(empty)).isNull();
        }

        @Test
        @DisplayName("should return null for a missing file")
        void shouldReturnNullForMissingFile() {
            assertThat(scanner.parseOne(root.resolve("missing.yml"))).isNull();
        }
    }

    @Nested
    @DisplayName("resolveProjectName")
    class ResolveProjectName {

        @Test
        @DisplayName("should use the directory for canonical file names")
        void shouldUseDirectoryForCanonicalNames() {
            for (String name :
                    List.of(
                            "docker-compose.yml",
                            "docker-compose.yaml",
                            "compose.yml",
                            "compose.yaml",
                            "Docker-Compose.YML")) {
                assertThat(ComposeFileScanner.resolveProjectName(null, Path.of("/srv/web", name)))
                        .isEqualTo("web");
            }
        }

        @Test
        @DisplayName("should combine directory and file stem for other names")
        void shouldCombineDirectoryAndStem() {
            assertThat(
                            ComposeFileScanner.resolveProjectName(
                                    null, Path.of("/srv/media/jellyfin.yaml")))
                    .isEqualTo("media-jellyfin");
        }

        @Test
        @DisplayName("should compare stem and directory case-insensitively")
        void shouldCompareStemCaseInsensitively() {
            assertThat(ComposeFileScanner.resolveProjectName(null, Path.of("/srv/Gitea/gitea.yml")))
                    .isEqualTo("Gitea");
        }

        @Test
        @DisplayName("should trim an explicit name")
        void shouldTrimExplicitName() {
            assertThat(ComposeFileScanner.resolveProjectName(" shop ", Path.of("/srv/x/compose.yml")))
                    .isEqualTo("shop");
        }
    }
}
