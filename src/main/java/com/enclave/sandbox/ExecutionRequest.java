package com.enclave.sandbox;

import java.util.List;
import java.util.Map;

/**
 * A single command to exec inside a running container.
 *
 * @param containerId    target container, must be RUNNING
 * @param argv           program and arguments; never passed through a shell
 * @param envVars        extra environment for this exec only
 * @param timeoutMs      wall-clock limit, or null for the configured default
 * @param workingDir     container working directory, or null for the container default
 * @param maxOutputBytes per-stream capture limit, or null for the configured default
 * @param preserveOutput true to return the streams exactly as received, without
 *                       stripping the trailing line terminator
 */
public record ExecutionRequest(
    String containerId,
    List<String> argv,
    Map<String, String> envVars,
    Long timeoutMs,
    String workingDir,
    Long maxOutputBytes,
    boolean preserveOutput
) {

    public ExecutionRequest {
        argv = argv != null ? List.copyOf(argv) : List.of();
        envVars = envVars != null ? Map.copyOf(envVars) : Map.of();
    }

    public ExecutionRequest(String containerId, List<String> argv, Map<String, String> envVars,
                            Long timeoutMs, String workingDir) {
        this(containerId, argv, envVars, timeoutMs, workingDir, null, false);
    }

    public static ExecutionRequest of(String containerId, String... argv) {
        return new ExecutionRequest(containerId, List.of(argv), Map.of(), null, null);
    }

    public static ExecutionRequest of(String containerId, List<String> argv) {
        return new ExecutionRequest(containerId, argv, Map.of(), null, null);
    }

    public ExecutionRequest withTimeoutMs(long timeout) {
        return new ExecutionRequest(containerId, argv, envVars, timeout, workingDir, maxOutputBytes, preserveOutput);
    }

    public ExecutionRequest withEnv(Map<String, String> env) {
        return new ExecutionRequest(containerId, argv, env, timeoutMs, workingDir, maxOutputBytes, preserveOutput);
    }

    public ExecutionRequest withWorkingDir(String dir) {
        return new ExecutionRequest(containerId, argv, envVars, timeoutMs, dir, maxOutputBytes, preserveOutput);
    }

    public ExecutionRequest withMaxOutputBytes(long bytes) {
        return new ExecutionRequest(containerId, argv, envVars, timeoutMs, workingDir, bytes, preserveOutput);
    }

    public ExecutionRequest withPreservedOutput() {
        return new ExecutionRequest(containerId, argv, envVars, timeoutMs, workingDir, maxOutputBytes, true);
    }

    public String commandLine() {
        return String.join(" ", argv);
    }
}
