package com.runnerfleet.autoscaler.github;

import com.runnerfleet.core.model.FleetConfig;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shell script that installs, configures and starts an ephemeral actions runner.
 * <p>
 * The runner is downloaded only when the image does not already ship one. It is
 * configured with {@code --ephemeral} so it accepts exactly one job, started in the
 * background, and the script finally prints the {@code .runner} file so the assigned
 * worker id can be read from the output.
 * </p>
 */
final class RegistrationScript {
    static final String RUNNER_VERSION = "2.319.1";

    private static final String RUNNER_URL = "https://github.com/actions/runner/releases/download/v"
        + RUNNER_VERSION + "/actions-runner-linux-x64-" + RUNNER_VERSION + ".tar.gz";

    private static final Pattern CONFIGURED_ID = Pattern.compile("with ID:\\s*(\\d+)");
    private static final Pattern RUNNER_FILE_ID = Pattern.compile("\"(?:agentId|runnerId)\"\\s*:\\s*(\\d+)");

    private RegistrationScript() {
    }

    static String render(String serverUrl, FleetConfig fleet, String token, String workerName) {
        String repoUrl = serverUrl.replaceAll("/+$", "") + "/" + fleet.getRepository();

        StringBuilder config = new StringBuilder("./config.sh")
            .append(" --url ").append(quote(repoUrl))
            .append(" --token ").append(quote(token))
            .append(" --name ").append(quote(workerName))
            .append(" --labels ").append(quote(String.join(",", fleet.getLabels())))
            .append(" --ephemeral --unattended");
        if (fleet.getRunnerGroup() != null) {
            config.append(" --runnergroup ").append(quote(fleet.getRunnerGroup()));
        }

        return String.join("\n",
            "set -e",
            "cd ~",
            "if [ ! -x ./config.sh ]; then",
            "  mkdir -p actions-runner && cd actions-runner",
            "  if [ ! -x ./config.sh ]; then",
            "    curl -fsSL -o runner.tar.gz " + quote(RUNNER_URL),
            "    tar xzf runner.tar.gz",
            "  fi",
            "fi",
            config.toString(),
            "nohup ./run.sh > runner.log 2>&1 &",
            "cat .runner",
            "");
    }

    /**
     * Extracts the provider-assigned worker id from the script output.
     */
    static Optional<Long> parseWorkerId(String output) {
        if (output == null) {
            return Optional.empty();
        }
        for (Pattern pattern : new Pattern[]{CONFIGURED_ID, RUNNER_FILE_ID}) {
            Matcher matcher = pattern.matcher(output);
            if (matcher.find()) {
                return Optional.of(Long.parseLong(matcher.group(1)));
            }
        }
        return Optional.empty();
    }

    static String quote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
