package com.enclave.sandbox;

import com.enclave.core.error.SandboxException;
import com.enclave.core.logging.MdcContext;
import com.enclave.core.metrics.EnclaveMetrics;
import com.enclave.core.security.ContainerPaths;
import com.enclave.core.security.RepositoryUrlPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Clones remote repositories into dedicated containers and exposes read-only
 * listing and reading of their working trees.
 *
 * <p>Only HTTPS URLs are accepted. The clone container is the only kind of sandbox
 * that gets network access, and only through the configured repository network mode.
 * All list/read paths are resolved against the clone path and rejected if they
 * escape it, before any command runs.
 */
@Service
public class RepositoryOperations {

    private static final Logger log = LoggerFactory.getLogger(RepositoryOperations.class);

    static final String SESSION_PREFIX = "repo-";
    static final String OUTPUT_DIR = "repo";
    static final String SOURCE_DIR = "source";

    private static final Map<String, String> GIT_ENV = Map.of(
            "GIT_TERMINAL_PROMPT", "0",
            "HOME", "/tmp");

    private final ContainerLifecycleManager lifecycle;
    private final CommandExecutor executor;
    private final HostFileBridge fileBridge;
    private final SandboxProperties properties;
    private final EnclaveMetrics metrics;

    private final Map<String, RepositoryHandle> repositories = new ConcurrentHashMap<>();

    @Autowired
    public RepositoryOperations(ContainerLifecycleManager lifecycle, CommandExecutor executor,
                                HostFileBridge fileBridge, SandboxProperties properties,
                                @Autowired(required = false) EnclaveMetrics metrics) {
        this.lifecycle = lifecycle;
        this.executor = executor;
        this.fileBridge = fileBridge;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Shallow-clones {@code url} into a fresh container.
     *
     * @throws SandboxException SECURITY_VIOLATION for non-HTTPS URLs or unsafe branch names
     *                          (no container is created); COMMAND_EXECUTION when git fails,
     *                          with its stderr in the context; COMMAND_TIMEOUT when the clone
     *                          exceeds its timeout
     */
    public RepositoryHandle clone(String url, CloneOptions options) {
        CloneOptions opts = options != null ? options : CloneOptions.defaults();
        try {
            RepositoryUrlPolicy.requireSecureUrl(url);
            RepositoryUrlPolicy.requireSafeBranch(opts.branch());
        } catch (SandboxException e) {
            if (metrics != null) {
                metrics.recordSecurityViolation("repository_url");
            }
            throw e;
        }

        var repoConfig = properties.getRepository();
        String cloneRoot = ContainerPaths.normalize("/", repoConfig.getCloneRoot());
        String clonePath = ContainerPaths.join(cloneRoot, SOURCE_DIR);
        long timeoutMs = opts.timeoutMs() != null ? opts.timeoutMs() : repoConfig.getCloneTimeoutMs();
        String maskedUrl = RepositoryUrlPolicy.mask(url);

        Path session = fileBridge.createSessionDir(SESSION_PREFIX);
        String containerId = null;
        try {
            MdcContext.setSession(session.getFileName().toString());
            var outputMount = fileBridge.prepareOutputDirectory(session, OUTPUT_DIR, cloneRoot);
            containerId = lifecycle.createAndStart(new ContainerRequest(
                    repoConfig.getGitImage(), null, repoConfig.getNetworkMode(),
                    List.of(outputMount), Map.of(), session.getFileName().toString()));

            log.info("Cloning {} (branch: {}) into container {}", maskedUrl,
                    opts.branch() != null ? opts.branch() : "default", containerId);
            var result = executor.execute(new ExecutionRequest(containerId,
                    cloneCommand(url, opts.branch(), clonePath), GIT_ENV, timeoutMs, cloneRoot));
            if (result.exitCode() != 0) {
                throw SandboxException.commandExecution(
                        "git clone exited with code " + result.exitCode(),
                        Map.of("url", maskedUrl,
                                "exitCode", String.valueOf(result.exitCode()),
                                "stderr", RepositoryUrlPolicy.mask(result.errorOutput())),
                        null);
            }

            var handle = new RepositoryHandle(session, clonePath, containerId, opts.branch(),
                    resolveCommit(containerId, clonePath));
            repositories.put(containerId, handle);
            log.info("Cloned {} at {}", maskedUrl, handle.commit());
            return handle;
        } catch (RuntimeException e) {
            log.warn("Clone of {} failed, tearing down: {}", maskedUrl, e.getMessage());
            teardown(containerId, session);
            throw e;
        } finally {
            MdcContext.clearSession();
        }
    }

    /**
     * Lists regular files under {@code path}, relative to the clone path, excluding {@code .git/}.
     *
     * @param path container path below the clone path; null or blank lists the whole tree
     * @throws SandboxException SECURITY_VIOLATION when {@code path} escapes the clone,
     *                          FILE_SYSTEM when the directory does not exist
     */
    public List<String> listFiles(String containerId, String path) {
        var handle = requireRepository(containerId);
        String target = resolveWithinClone(handle, path == null || path.isBlank() ? handle.clonePath() : path);

        var result = executor.execute(ExecutionRequest.of(containerId,
                "find", target, "-type", "f", "-not", "-path", "*/.git/*"));
        if (result.exitCode() != 0 || result.errorOutput().contains("No such file")) {
            throw SandboxException.fileSystem("Cannot list " + target + ": " + result.errorOutput().strip(),
                    Map.of("containerId", containerId, "path", target,
                            "exitCode", String.valueOf(result.exitCode())), null);
        }

        String prefix = handle.clonePath().endsWith("/") ? handle.clonePath() : handle.clonePath() + "/";
        var files = new ArrayList<String>();
        for (String line : result.output().split("\n")) {
            String entry = line.strip();
            if (entry.isEmpty()) continue;
            files.add(entry.startsWith(prefix) ? entry.substring(prefix.length()) : entry);
        }
        files.sort(null);
        return files;
    }

    /**
     * Reads a file from the clone as UTF-8, exactly as stored (trailing newline included).
     * At most one byte more than the read cap is ever transferred.
     *
     * @param path container path, absolute or relative to the clone path
     * @throws SandboxException SECURITY_VIOLATION when {@code path} escapes the clone (no
     *                          command is run), FILE_SYSTEM when the file does not exist,
     *                          RESOURCE_LIMIT when it exceeds the configured read cap
     */
    public String readFile(String containerId, String path) {
        var handle = requireRepository(containerId);
        if (path == null || path.isBlank()) {
            throw SandboxException.fileSystem("File path is required", Map.of("containerId", containerId), null);
        }
        String target = resolveWithinClone(handle, path);
        long maxBytes = properties.getRepository().getMaxReadBytes();

        var result = executor.execute(ExecutionRequest.of(containerId, readCommand(target, maxBytes))
                .withMaxOutputBytes(maxBytes)
                .withPreservedOutput());
        if (result.exitCode() != 0) {
            throw SandboxException.fileSystem("Cannot read " + target + ": " + result.errorOutput().strip(),
                    Map.of("containerId", containerId, "path", target,
                            "exitCode", String.valueOf(result.exitCode())), null);
        }
        if (result.truncated()) {
            throw SandboxException.resourceLimit(
                    "File %s exceeds read limit of %d bytes".formatted(target, maxBytes),
                    Map.of("path", target, "limit", String.valueOf(maxBytes)));
        }
        return result.output();
    }

    public Optional<RepositoryHandle> find(String containerId) {
        return Optional.ofNullable(repositories.get(containerId));
    }

    /**
     * Tears down the clone's container and host directory together.
     */
    public void releaseRepository(RepositoryHandle handle) {
        repositories.remove(handle.containerId());
        teardown(handle.containerId(), handle.hostPath());
    }

    /**
     * Drops the bookkeeping for a container that was cleaned up elsewhere.
     */
    void forget(String containerId) {
        if (containerId != null && repositories.remove(containerId) != null) {
            log.debug("Forgot repository in container {}", containerId);
        }
    }

    static List<String> cloneCommand(String url, String branch, String clonePath) {
        var argv = new ArrayList<>(List.of("git", "clone", "--depth", "1"));
        if (branch != null && !branch.isBlank()) {
            argv.add("--branch");
            argv.add(branch);
        }
        argv.add("--");
        argv.add(url);
        argv.add(clonePath);
        return argv;
    }

    /** {@code head -c} stops the read one byte past the cap, which is enough to detect overflow. */
    static List<String> readCommand(String target, long maxBytes) {
        return List.of("head", "-c", String.valueOf(maxBytes + 1), "--", target);
    }

    private String resolveCommit(String containerId, String clonePath) {
        try {
            var result = executor.execute(new ExecutionRequest(containerId,
                    List.of("git", "-C", clonePath, "rev-parse", "HEAD"), GIT_ENV, null, null));
            if (result.exitCode() == 0 && !result.output().isBlank()) {
                return result.output().strip();
            }
            log.warn("Could not resolve HEAD in {}: {}", clonePath, result.errorOutput());
        } catch (SandboxException e) {
            log.warn("Could not resolve HEAD in {}: {}", clonePath, e.getMessage());
        }
        return null;
    }

    private RepositoryHandle requireRepository(String containerId) {
        var handle = repositories.get(containerId);
        if (handle == null) {
            throw SandboxException.commandExecution("No repository cloned in container " + containerId,
                    Map.of("containerId", String.valueOf(containerId)), null);
        }
        return handle;
    }

    private String resolveWithinClone(RepositoryHandle handle, String path) {
        String resolved = ContainerPaths.normalize(handle.clonePath(), path);
        if (!ContainerPaths.isWithin(handle.clonePath(), resolved)) {
            if (metrics != null) {
                metrics.recordSecurityViolation("repository_path");
            }
            throw SandboxException.securityViolation("Path escapes repository: " + path,
                    Map.of("path", path, "clonePath", handle.clonePath()));
        }
        return resolved;
    }

    private void teardown(String containerId, Path session) {
        if (containerId != null) {
            try {
                lifecycle.stop(containerId);
                lifecycle.remove(containerId);
            } catch (RuntimeException e) {
                log.warn("Failed to remove repository container {}: {}", containerId, e.getMessage());
                if (metrics != null) {
                    metrics.recordCleanupFailure("container");
                }
            }
        }
        try {
            fileBridge.cleanupSessionDir(session);
        } catch (SandboxException e) {
            log.warn("Failed to remove repository session {}: {}", session, e.getMessage());
            if (metrics != null) {
                metrics.recordCleanupFailure("session");
            }
        }
    }
}
