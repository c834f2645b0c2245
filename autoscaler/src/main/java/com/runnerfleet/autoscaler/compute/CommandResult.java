package com.runnerfleet.autoscaler.compute;

/**
 * Exit code and captured output of a command run on a compute instance.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * stdout followed by stderr, for parsing and diagnostics.
     */
    public String output() {
        return (stdout == null ? "" : stdout) + (stderr == null || stderr.isEmpty() ? "" : "\n" + stderr);
    }
}
