package com.enclave.sandbox;

import com.enclave.core.error.SandboxException;
import com.enclave.core.logging.MdcContext;
import com.enclave.core.metrics.EnclaveMetrics;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.InspectExecResponse;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands inside running sandbox containers and returns their captured output.
 *
 * <p>{@link #execute} blocks until the command finishes or its timeout elapses. On
 * timeout the exec'd process is killed and COMMAND_TIMEOUT is raised; the container
 * itself keeps running and stays registered for cleanup.
 *
 * <p>To make the kill possible, each command runs under a tiny {@code sh} wrapper that
 * records its PID in the container's tmpfs before {@code exec}-ing the real argv, so the
 * argv is never re-parsed by a shell.
 *
 * <p>Running several commands concurrently against the same container is not supported:
 * there is no ordering guarantee and no locking of the mounted directories.
 */
@Service
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    private static final int EXIT_CODE_POLL_ATTEMPTS = 20;
    private static final long EXIT_CODE_POLL_INTERVAL_MS = 25;
    private static final long KILL_TIMEOUT_SECONDS = 5;

    private final DockerClient dockerClient;
    private final ContainerLifecycleManager lifecycle;
    private final SandboxProperties properties;
    private final EnclaveMetrics metrics;

    @Autowired
    public CommandExecutor(DockerClient dockerClient, ContainerLifecycleManager lifecycle,
                           SandboxProperties properties, @Autowired(required = false) EnclaveMetrics metrics) {
        this.dockerClient = dockerClient;
        this.lifecycle = lifecycle;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Executes a command and waits for it to finish.
     *
     * <p>Each stream is captured up to the request's (or the configured) output limit;
     * anything beyond it is discarded and the result is marked truncated.
     *
     * @throws SandboxException COMMAND_EXECUTION when the container is missing or not running
     *                          or the runtime fails; COMMAND_TIMEOUT when the timeout elapses;
     *                          RESOURCE_LIMIT for a non-positive timeout or output limit
     */
    public ExecutionResult execute(ExecutionRequest request) {
        String containerId = request.containerId();
        Map<String, String> context = Map.of(
                "containerId", String.valueOf(containerId),
                "command", request.commandLine());
        if (request.argv().isEmpty()) {
            throw SandboxException.commandExecution("Empty command", context, null);
        }
        long timeoutMs = request.timeoutMs() != null ? request.timeoutMs() : properties.getCommandTimeoutMs();
        if (timeoutMs <= 0) {
            throw SandboxException.resourceLimit("Timeout must be positive: " + timeoutMs, context);
        }

        long maxOutputBytes = request.maxOutputBytes() != null
                ? request.maxOutputBytes() : properties.getMaxOutputBytes();
        if (maxOutputBytes <= 0) {
            throw SandboxException.resourceLimit("Output limit must be positive: " + maxOutputBytes, context);
        }

        MdcContext.setContainer(containerId, "exec");
        try {
            requireRunning(containerId, context);

            String token = UUID.randomUUID().toString().replace("-", "");
            String execId = createExec(request, token, context);

            var collector = new OutputCollector(maxOutputBytes);
            long startMs = System.currentTimeMillis();
            boolean completed;
            try {
                dockerClient.execStartCmd(execId).exec(collector);
                completed = collector.awaitCompletion(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                closeQuietly(collector);
                terminate(containerId, token);
                throw SandboxException.commandExecution("Interrupted while waiting for command", context, e);
            } catch (RuntimeException e) {
                recordExecution("failed", System.currentTimeMillis() - startMs);
                throw SandboxException.commandExecution("Command failed to run: " + e.getMessage(), context, e);
            }
            long elapsedMs = System.currentTimeMillis() - startMs;

            if (!completed) {
                closeQuietly(collector);
                terminate(containerId, token);
                recordExecution("timeout", elapsedMs);
                log.warn("Command '{}' in container {} timed out after {}ms", request.commandLine(), containerId, timeoutMs);
                throw SandboxException.commandTimeout(
                        "Command timed out after %dms: %s".formatted(timeoutMs, request.commandLine()),
                        Map.of("containerId", containerId,
                                "command", request.commandLine(),
                                "timeoutMs", String.valueOf(timeoutMs)));
            }

            int exitCode = awaitExitCode(execId, context);
            recordExecution("completed", elapsedMs);
            log.info("Command '{}' in container {} exited with {} in {}ms",
                    request.commandLine(), containerId, exitCode, elapsedMs);
            if (collector.truncated()) {
                log.warn("Output of '{}' in container {} exceeded {} bytes per stream and was truncated",
                        request.commandLine(), containerId, maxOutputBytes);
            }
            boolean strip = !request.preserveOutput();
            return new ExecutionResult(exitCode, collector.stdout(strip), collector.stderr(strip),
                    elapsedMs, collector.truncated());
        } finally {
            MdcContext.clearContainer();
        }
    }

    private void requireRunning(String containerId, Map<String, String> context) {
        ContainerStatus status;
        try {
            status = lifecycle.status(containerId);
        } catch (RuntimeException e) {
            throw SandboxException.commandExecution("Cannot inspect container " + containerId, context, e);
        }
        if (!status.isRunning()) {
            throw SandboxException.commandExecution(
                    "Container %s is not running (%s)".formatted(containerId, status), context, null);
        }
    }

    private String createExec(ExecutionRequest request, String token, Map<String, String> context) {
        var envList = new ArrayList<String>();
        request.envVars().forEach((k, v) -> envList.add(k + "=" + v));
        try {
            var cmd = dockerClient.execCreateCmd(request.containerId())
                    .withCmd(wrapForTermination(token, request.argv()))
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .withUser(properties.getContainerUser())
                    .withEnv(envList);
            if (request.workingDir() != null && !request.workingDir().isBlank()) {
                cmd = cmd.withWorkingDir(request.workingDir());
            }
            return cmd.exec().getId();
        } catch (NotFoundException e) {
            throw SandboxException.commandExecution("Container not found: " + request.containerId(), context, e);
        } catch (RuntimeException e) {
            throw SandboxException.commandExecution("Failed to create exec: " + e.getMessage(), context, e);
        }
    }

    private int awaitExitCode(String execId, Map<String, String> context) {
        for (int attempt = 0; attempt < EXIT_CODE_POLL_ATTEMPTS; attempt++) {
            InspectExecResponse inspect;
            try {
                inspect = dockerClient.inspectExecCmd(execId).exec();
            } catch (RuntimeException e) {
                throw SandboxException.commandExecution("Failed to read exit code: " + e.getMessage(), context, e);
            }
            Long exitCode = inspect.getExitCodeLong();
            if (exitCode != null && !Boolean.TRUE.equals(inspect.isRunning())) {
                return exitCode.intValue();
            }
            try {
                Thread.sleep(EXIT_CODE_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        throw SandboxException.commandExecution("Runtime did not report an exit code", context, null);
    }

    /**
     * Kills the exec'd process by the PID its wrapper recorded. Best effort: failures are
     * logged, and the timeout is reported to the caller either way.
     */
    private void terminate(String containerId, String token) {
        String pidFile = pidFile(token);
        try {
            String execId = dockerClient.execCreateCmd(containerId)
                    .withCmd("sh", "-c", "kill -KILL \"$(cat " + pidFile + ")\" 2>/dev/null; rm -f " + pidFile)
                    .withUser(properties.getContainerUser())
                    .exec()
                    .getId();
            dockerClient.execStartCmd(execId)
                    .exec(new ResultCallback.Adapter<Frame>())
                    .awaitCompletion(KILL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Killed timed-out process in container {}", containerId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while killing timed-out process in container {}", containerId);
        } catch (RuntimeException e) {
            log.warn("Could not kill timed-out process in container {}: {}", containerId, e.getMessage());
        }
    }

    static String[] wrapForTermination(String token, List<String> argv) {
        var cmd = new ArrayList<String>();
        cmd.add("sh");
        cmd.add("-c");
        cmd.add("{ echo $$ > " + pidFile(token) + "; } 2>/dev/null; exec \"$@\"");
        cmd.add("sh");
        cmd.addAll(argv);
        return cmd.toArray(new String[0]);
    }

    static String pidFile(String token) {
        return "/tmp/.enclave-" + token + ".pid";
    }

    static String stripTrailingNewline(String text) {
        if (text.endsWith("\r\n")) return text.substring(0, text.length() - 2);
        if (text.endsWith("\n")) return text.substring(0, text.length() - 1);
        return text;
    }

    private void recordExecution(String outcome, long ms) {
        if (metrics != null) {
            metrics.recordExecution(outcome, ms);
        }
    }

    private static void closeQuietly(ResultCallback<Frame> callback) {
        try {
            callback.close();
        } catch (IOException e) {
            log.debug("Error closing exec stream: {}", e.getMessage());
        }
    }

    /**
     * Buffers demultiplexed stdout/stderr frames as they arrive, keeping at most
     * {@code maxBytes} per stream. Frames past the limit are still consumed so the
     * process is not blocked on a full pipe, but their bytes are dropped.
     */
    static class OutputCollector extends ResultCallback.Adapter<Frame> {

        private final long maxBytes;
        private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        private boolean truncated;

        OutputCollector(long maxBytes) {
            this.maxBytes = maxBytes;
        }

        @Override
        public void onNext(Frame frame) {
            byte[] payload = frame.getPayload();
            if (payload == null) return;
            synchronized (this) {
                append(frame.getStreamType() == StreamType.STDERR ? stderr : stdout, payload);
            }
        }

        private void append(ByteArrayOutputStream target, byte[] payload) {
            long room = maxBytes - target.size();
            if (room >= payload.length) {
                target.writeBytes(payload);
                return;
            }
            if (room > 0) {
                target.write(payload, 0, (int) room);
            }
            truncated = true;
        }

        synchronized boolean truncated() {
            return truncated;
        }

        synchronized String stdout(boolean stripNewline) {
            String text = stdout.toString(StandardCharsets.UTF_8);
            return stripNewline ? stripTrailingNewline(text) : text;
        }

        synchronized String stderr(boolean stripNewline) {
            String text = stderr.toString(StandardCharsets.UTF_8);
            return stripNewline ? stripTrailingNewline(text) : text;
        }
    }
}
