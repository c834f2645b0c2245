package com.runnerfleet.autoscaler.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.runnerfleet.autoscaler.compute.IComputeProvisioner;
import com.runnerfleet.core.error.ProvisioningException;
import com.runnerfleet.core.error.RegistrationTokenException;
import com.runnerfleet.core.error.WorkerDeregistrationException;
import com.runnerfleet.core.error.WorkerNotFoundException;
import com.runnerfleet.core.error.WorkerRegistrationException;
import com.runnerfleet.core.model.ComputeHandle;
import com.runnerfleet.core.model.FleetConfig;
import com.runnerfleet.core.model.RegistrationToken;
import com.runnerfleet.core.model.WorkerInfo;
import com.runnerfleet.core.util.SecretRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Repository-scoped self-hosted runner registration on GitHub.
 */
public class GitHubWorkerRegistry implements IWorkerRegistry {
    private static final Logger log = LoggerFactory.getLogger(GitHubWorkerRegistry.class);

    private final GitHubApiClient api;
    private final IComputeProvisioner compute;
    private final String serverUrl;
    private final Duration registrationTimeout;
    private final Clock clock;

    public GitHubWorkerRegistry(GitHubApiClient api, IComputeProvisioner compute, String serverUrl,
                                Duration registrationTimeout, Clock clock) {
        this.api = api;
        this.compute = compute;
        this.serverUrl = serverUrl;
        this.registrationTimeout = registrationTimeout;
        this.clock = clock;
    }

    @Override
    public Mono<RegistrationToken> getRegistrationToken(FleetConfig fleet) {
        String uri = String.format("/repos/%s/%s/actions/runners/registration-token",
            fleet.getRepoOwner(), fleet.getRepoName());

        return api.post("registration_token", uri)
            .flatMap(response -> {
                if (!response.is(201)) {
                    return Mono.error(new RegistrationTokenException(
                        "Failed to get registration token: " + response.status() + " - " + response.errorMessage()));
                }
                JsonNode json = response.json();
                String value = json.path("token").asText(null);
                if (value == null || value.isEmpty()) {
                    return Mono.error(new RegistrationTokenException("Registration token response has no token"));
                }
                String expiresAt = json.path("expires_at").asText(null);
                return Mono.just(RegistrationToken.builder()
                    .value(value)
                    .expiresAt(expiresAt != null ? Instant.parse(expiresAt) : null)
                    .build());
            })
            .doOnNext(token -> log.debug("Obtained registration token for {} (expires {})",
                fleet.getRepository(), token.getExpiresAt()))
            .onErrorMap(e -> !(e instanceof RegistrationTokenException), e -> new RegistrationTokenException(
                "Failed to get registration token for " + fleet.getRepository() + ": " + SecretRedactor.describe(e), e));
    }

    @Override
    public Mono<Long> register(ComputeHandle target, FleetConfig fleet, RegistrationToken token, String workerName) {
        return Mono.defer(() -> {
            if (token.isExpired(clock.instant())) {
                return Mono.error(new WorkerRegistrationException(
                    "Registration token for " + workerName + " expired at " + token.getExpiresAt()));
            }

            String script = RegistrationScript.render(serverUrl, fleet, token.getValue(), workerName);
            return compute.runCommand(target, script, registrationTimeout)
                .onErrorMap(e -> new WorkerRegistrationException(
                    "Registration command failed on " + target.getName() + ": "
                        + SecretRedactor.redact(SecretRedactor.describe(e), token.getValue()), e))
                .flatMap(result -> {
                    String output = SecretRedactor.redact(result.output(), token.getValue());
                    if (!result.isSuccess()) {
                        return Mono.error(new WorkerRegistrationException(
                            "Runner configuration exited with " + result.exitCode() + ": " + output.trim()));
                    }
                    return RegistrationScript.parseWorkerId(result.output())
                        .map(Mono::just)
                        .orElseGet(() -> Mono.error(new WorkerRegistrationException(
                            "Could not determine worker id of " + workerName + " from runner output")));
                });
        }).doOnNext(id -> log.info("Registered worker {} with id {} in {}", workerName, id, fleet.getRepository()));
    }

    @Override
    public Mono<Void> deregister(FleetConfig fleet, long workerId) {
        String uri = String.format("/repos/%s/%s/actions/runners/%d",
            fleet.getRepoOwner(), fleet.getRepoName(), workerId);

        return api.delete("deregister", uri)
            .flatMap(response -> {
                if (response.is(204)) {
                    log.info("Deregistered worker {} from {}", workerId, fleet.getRepository());
                    return Mono.<Void>empty();
                }
                if (response.is(404)) {
                    log.debug("Worker {} already deregistered", workerId);
                    return Mono.<Void>empty();
                }
                return Mono.<Void>error(new WorkerDeregistrationException(
                    "Failed to deregister worker " + workerId + ": " + response.status() + " - " + response.errorMessage()));
            })
            .onErrorMap(e -> !(e instanceof WorkerDeregistrationException), e -> new WorkerDeregistrationException(
                "Failed to deregister worker " + workerId + ": " + SecretRedactor.describe(e), e));
    }

    @Override
    public Mono<WorkerInfo> status(FleetConfig fleet, long workerId) {
        String uri = String.format("/repos/%s/%s/actions/runners/%d",
            fleet.getRepoOwner(), fleet.getRepoName(), workerId);

        return api.get("worker_status", uri).flatMap(response -> {
            if (response.is(404)) {
                return Mono.error(new WorkerNotFoundException(workerId));
            }
            if (!response.is(200)) {
                return Mono.error(new ProvisioningException(
                    "Failed to get worker " + workerId + ": " + response.status() + " - " + response.errorMessage()));
            }
            JsonNode json = response.json();
            List<String> labels = new ArrayList<>();
            json.path("labels").forEach(label -> labels.add(label.path("name").asText()));
            return Mono.just(WorkerInfo.builder()
                .workerId(json.path("id").asLong(workerId))
                .name(json.path("name").asText())
                .online("online".equals(json.path("status").asText()))
                .busy(json.path("busy").asBoolean(false))
                .labels(labels)
                .build());
        });
    }
}
