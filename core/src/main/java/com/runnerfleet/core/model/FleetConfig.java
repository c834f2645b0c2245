package com.runnerfleet.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Identity of a runner fleet: the repository its workers register against,
 * the capability labels every worker advertises and an optional runner group.
 * <p>
 * Immutable after the fleet is enabled. Validated on construction so a misconfigured
 * fleet is rejected up front instead of failing inside the control loop.
 * </p>
 */
@Value
public class FleetConfig {
    private static final Pattern FLEET_NAME = Pattern.compile("^[a-z0-9]([-a-z0-9]{0,38}[a-z0-9])?$");
    private static final Pattern REPO_OWNER = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final Pattern REPO_NAME = Pattern.compile("^[a-zA-Z0-9._-]+$");
    private static final Pattern LABEL = Pattern.compile("^[a-zA-Z0-9._-]+$");

    /**
     * Unique fleet name. Also used as the prefix of worker and instance names,
     * so it must be a lowercase DNS label of at most 40 characters.
     */
    String name;

    String repoOwner;

    String repoName;

    /**
     * Labels every worker of this fleet advertises. A queued job counts towards
     * this fleet only if it requires all of them.
     */
    List<String> labels;

    /**
     * Runner group to register into, or {@code null} for the provider default.
     */
    String runnerGroup;

    @Builder(toBuilder = true)
    private FleetConfig(String name, String repoOwner, String repoName,
                        @Singular List<String> labels, String runnerGroup) {
        if (name == null || !FLEET_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid fleet name: " + name);
        }
        if (repoOwner == null || repoOwner.isEmpty()) {
            throw new IllegalArgumentException("Repository owner cannot be empty");
        }
        if (!REPO_OWNER.matcher(repoOwner).matches()) {
            throw new IllegalArgumentException("Invalid repository owner: " + repoOwner);
        }
        if (repoName == null || repoName.isEmpty()) {
            throw new IllegalArgumentException("Repository name cannot be empty");
        }
        if (!REPO_NAME.matcher(repoName).matches()) {
            throw new IllegalArgumentException("Invalid repository name: " + repoName);
        }
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("At least one runner label is required");
        }
        for (String label : labels) {
            if (label == null || !LABEL.matcher(label).matches()) {
                throw new IllegalArgumentException("Invalid label: " + label);
            }
        }
        if (runnerGroup != null && runnerGroup.isBlank()) {
            runnerGroup = null;
        }

        this.name = name;
        this.repoOwner = repoOwner;
        this.repoName = repoName;
        this.labels = List.copyOf(labels);
        this.runnerGroup = runnerGroup;
    }

    /**
     * @return {@code owner/name} of the repository
     */
    public String getRepository() {
        return repoOwner + "/" + repoName;
    }
}
