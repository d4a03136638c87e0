package com.ammann.composemanager.health;

import com.ammann.composemanager.config.ComposeDiscoveryConfig;
import com.github.dockerjava.api.DockerClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * MicroProfile Health readiness probe for compose discovery.
 *
 * <p>Reports ready only when the compose root directory can be read and the Docker daemon
 * answers a ping, since both sources are needed to build the project list.
 */
@Readiness
@ApplicationScoped
public class ComposeDiscoveryReadinessCheck implements HealthCheck {

    static final String NAME = "compose-discovery";

    @Inject ComposeDiscoveryConfig config;

    @Inject DockerClient dockerClient;

    @Inject Logger logger;

    @Override
    public HealthCheckResponse call() {
        boolean exists = false;
        boolean accessible = false;
        try {
            Path root = Path.of(config.rootPath());
            exists = Files.isDirectory(root);
            accessible = exists && Files.isReadable(root);
        } catch (InvalidPathException e) {
            logger.warnf("Invalid compose root path %s: %s", config.rootPath(), e.getMessage());
        }

        boolean dockerConnected = pingDocker();

        HealthCheckResponseBuilder builder =
                HealthCheckResponse.named(NAME)
                        .withData("rootPath", config.rootPath())
                        .withData("exists", exists)
                        .withData("accessible", accessible)
                        .withData("dockerConnected", dockerConnected);

        return builder.status(accessible && dockerConnected).build();
    }

    private boolean pingDocker() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (RuntimeException e) {
            logger.debugf("Docker daemon ping failed: %s", e.getMessage());
            return false;
        }
    }
}
