package com.ammann.composemanager.config;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer for the Docker API client used to read live compose projects.
 *
 * <p>Discovery only lists containers and pings the daemon, so the pool is small and the
 * timeouts are short enough for a readiness probe. Host and timeouts come from the
 * {@code docker.*} properties; a blank host falls back to the system default.
 */
@ApplicationScoped
public class DockerClientProducer {

    static final int MAX_CONNECTIONS = 20;

    @Inject Logger logger;

    @ConfigProperty(name = "docker.host")
    Optional<String> dockerHostOverride;

    @ConfigProperty(name = "docker.connection-timeout", defaultValue = "10s")
    Duration connectionTimeout;

    @ConfigProperty(name = "docker.response-timeout", defaultValue = "30s")
    Duration responseTimeout;

    /**
     * Produces an application-scoped {@link DockerClient} instance.
     *
     * @return a Docker client configured for read-only project discovery
     */
    @Produces
    @ApplicationScoped
    public DockerClient dockerClient() {
        DockerClientConfig config = clientConfig();
        logger.infof(
                "Connecting to Docker daemon at %s (connect %s, response %s)",
                config.getDockerHost(), connectionTimeout, responseTimeout);

        DockerHttpClient httpClient =
                new ApacheDockerHttpClient.Builder()
                        .dockerHost(config.getDockerHost())
                        .sslConfig(config.getSSLConfig())
                        .maxConnections(MAX_CONNECTIONS)
                        .connectionTimeout(connectionTimeout)
                        .responseTimeout(responseTimeout)
                        .build();

        return DockerClientImpl.getInstance(config, httpClient);
    }

    DockerClientConfig clientConfig() {
        DefaultDockerClientConfig.Builder builder =
                DefaultDockerClientConfig.createDefaultConfigBuilder();
        dockerHostOverride
                .map(String::trim)
                .filter(host -> !host.isEmpty())
                .ifPresent(builder::withDockerHost);
        return builder.build();
    }
}
