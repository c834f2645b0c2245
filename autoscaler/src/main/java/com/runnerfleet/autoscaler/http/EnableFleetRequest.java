package com.runnerfleet.autoscaler.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.runnerfleet.core.model.FleetConfig;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of an enable request.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnableFleetRequest {
    /**
     * {@code owner/name}
     */
    private String repository;

    private List<String> labels;
    private String runnerGroup;
    private ScalingRequest scaling;

    /**
     * @throws IllegalArgumentException if the repository or labels are invalid
     */
    public FleetConfig toFleetConfig(String fleetName) {
        if (repository == null || repository.indexOf('/') <= 0 || repository.indexOf('/') != repository.lastIndexOf('/')) {
            throw new IllegalArgumentException("repository must be in owner/name form: " + repository);
        }
        String[] parts = repository.split("/", 2);
        return FleetConfig.builder()
            .name(fleetName)
            .repoOwner(parts[0])
            .repoName(parts[1])
            .labels(labels != null ? labels : List.of())
            .runnerGroup(runnerGroup)
            .build();
    }
}
