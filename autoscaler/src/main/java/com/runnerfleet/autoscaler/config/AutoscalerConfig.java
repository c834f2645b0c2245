package com.runnerfleet.autoscaler.config;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the autoscaler, loaded from environment variables.
 * <p>
 * The provider token is read once from the environment and is never written anywhere else.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class AutoscalerConfig {

    String nodeId;
    int httpPort;

    // GitHub API
    String githubApiUrl;
    String githubServerUrl;        // web URL runners register against
    @ToString.Exclude
    String githubToken;
    Duration apiTimeout;
    int rateLimitMaxRetries;
    Duration rateLimitBackoff;

    // Control loop
    Duration tickInterval;
    int maxConcurrentOperations;   // in-flight provision/destroy operations across all fleets
    int degradedAfterRounds;       // consecutive fully failed scale-up rounds before a fleet is degraded
    Duration onlineWaitTimeout;
    Duration onlinePollInterval;

    // Events
    String kafkaBootstrap;

    // Compute
    String kubernetesNamespace;
    String runnerImage;
    Duration podReadyTimeout;
    Duration registrationCommandTimeout;

    public static AutoscalerConfig fromEnv() {
        String token = System.getenv("GITHUB_TOKEN");
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("GITHUB_TOKEN must be set");
        }

        return AutoscalerConfig.builder()
            .nodeId(getEnv("NODE_ID", "autoscaler-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8090")))
            .githubApiUrl(getEnv("GITHUB_API_URL", "https://api.github.com"))
            .githubServerUrl(getEnv("GITHUB_SERVER_URL", "https://github.com"))
            .githubToken(token)
            .apiTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("API_TIMEOUT_SEC", "30"))))
            .rateLimitMaxRetries(Integer.parseInt(getEnv("RATE_LIMIT_MAX_RETRIES", "3")))
            .rateLimitBackoff(Duration.ofMillis(Long.parseLong(getEnv("RATE_LIMIT_BACKOFF_MS", "1000"))))
            .tickInterval(Duration.ofSeconds(Integer.parseInt(getEnv("TICK_INTERVAL_SEC", "60"))))
            .maxConcurrentOperations(Integer.parseInt(getEnv("MAX_CONCURRENT_OPERATIONS", "10")))
            .degradedAfterRounds(Integer.parseInt(getEnv("DEGRADED_AFTER_ROUNDS", "3")))
            .onlineWaitTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("ONLINE_WAIT_TIMEOUT_SEC", "300"))))
            .onlinePollInterval(Duration.ofSeconds(Integer.parseInt(getEnv("ONLINE_POLL_INTERVAL_SEC", "5"))))
            .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", ""))
            .kubernetesNamespace(getEnv("K8S_NAMESPACE", "ci-runners"))
            .runnerImage(getEnv("RUNNER_IMAGE", "ghcr.io/actions/actions-runner:latest"))
            .podReadyTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("POD_READY_TIMEOUT_SEC", "300"))))
            .registrationCommandTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("REGISTRATION_TIMEOUT_SEC", "300"))))
            .build();
    }

    public boolean isEventPublishingEnabled() {
        return kafkaBootstrap != null && !kafkaBootstrap.isBlank();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
