package com.enclave.sandbox;

import com.enclave.core.error.SandboxErrorKind;
import com.enclave.core.error.SandboxException;
import com.enclave.core.metrics.EnclaveMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Tears down containers and session directories.
 *
 * <p>Every operation here is idempotent and best effort: runtime and filesystem
 * failures are logged and counted, never thrown, and a sweep keeps going past
 * individual failures. The one exception is a session path outside the temp root,
 * which is refused with SECURITY_VIOLATION. A container is always dropped from the registry once its
 * cleanup was attempted.
 */
@Service
public class SandboxCleaner {

    private static final Logger log = LoggerFactory.getLogger(SandboxCleaner.class);

    private final ContainerLifecycleManager lifecycle;
    private final HostFileBridge fileBridge;
    private final RepositoryOperations repositories;
    private final SandboxProperties properties;
    private final EnclaveMetrics metrics;

    @Autowired
    public SandboxCleaner(ContainerLifecycleManager lifecycle, HostFileBridge fileBridge,
                          RepositoryOperations repositories, SandboxProperties properties,
                          @Autowired(required = false) EnclaveMetrics metrics) {
        this.lifecycle = lifecycle;
        this.fileBridge = fileBridge;
        this.repositories = repositories;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Stops and removes a container, then forgets it. Calling it again for the same
     * id, or for an id that was never tracked, is a no-op that does not throw.
     *
     * @return true when the runtime confirmed removal (or the container was already gone)
     */
    public boolean cleanupContainer(String containerId) {
        if (containerId == null || containerId.isBlank()) {
            return true;
        }
        boolean removed = true;
        try {
            lifecycle.stop(containerId);
        } catch (RuntimeException e) {
            log.warn("Failed to stop container {}: {}", containerId, e.getMessage());
        }
        try {
            lifecycle.remove(containerId);
        } catch (RuntimeException e) {
            removed = false;
            log.warn("Failed to remove container {}: {}", containerId, e.getMessage());
            recordFailure("container");
        }
        lifecycle.registry().remove(containerId);
        repositories.forget(containerId);
        return removed;
    }

    /**
     * Removes a session directory; an already-absent directory is fine.
     *
     * @return false when deletion failed part way
     * @throws SandboxException SECURITY_VIOLATION when the path is outside the temp root;
     *                          nothing is deleted
     */
    public boolean cleanupSessionDir(Path sessionDir) {
        try {
            fileBridge.cleanupSessionDir(sessionDir);
            return true;
        } catch (SandboxException e) {
            if (e.kind() == SandboxErrorKind.SECURITY_VIOLATION) {
                throw e;
            }
            log.warn("Failed to remove session directory {}: {}", sessionDir, e.getMessage());
            recordFailure("session");
            return false;
        } catch (RuntimeException e) {
            log.warn("Failed to remove session directory {}: {}", sessionDir, e.getMessage());
            recordFailure("session");
            return false;
        }
    }

    /**
     * Sweeps every tracked container, then every active session directory.
     *
     * @return number of resources that could not be cleaned
     */
    public int cleanupAll() {
        var containerIds = lifecycle.registry().ids();
        var sessions = fileBridge.activeSessions();
        if (containerIds.isEmpty() && sessions.isEmpty()) {
            return 0;
        }
        log.info("Cleanup sweep: {} containers, {} session directories", containerIds.size(), sessions.size());

        int failures = 0;
        for (String id : containerIds) {
            if (!cleanupContainer(id)) failures++;
        }
        for (Path session : sessions) {
            if (!cleanupSessionDir(session)) failures++;
        }
        if (failures > 0) {
            log.warn("Cleanup sweep finished with {} failures", failures);
        } else {
            log.info("Cleanup sweep finished");
        }
        return failures;
    }

    @PreDestroy
    void cleanupOnShutdown() {
        if (properties.isCleanupOnShutdown()) {
            cleanupAll();
        }
    }

    private void recordFailure(String resource) {
        if (metrics != null) {
            metrics.recordCleanupFailure(resource);
        }
    }
}
