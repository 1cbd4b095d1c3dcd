package com.enclave.sandbox;

import com.enclave.core.error.SandboxException;
import com.enclave.sandbox.tools.ToolRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Asynchronous entry point used by orchestrators.
 *
 * <p>Each operation runs on a bounded pool owned by this manager and returns a
 * {@link CompletableFuture}. Failures complete the future with the
 * {@link SandboxException} itself, so callers can switch on
 * {@link SandboxException#kind()} without unwrapping.
 *
 * <p>Typical flow:
 * <pre>
 *   createSession → prepareFiles → createAndStartContainer → executeCommand
 *       → collectOutputFiles → cleanupContainer → cleanupSessionDir
 * </pre>
 */
@Service
public class SandboxManager {

    private static final Logger log = LoggerFactory.getLogger(SandboxManager.class);

    private final HostFileBridge fileBridge;
    private final ContainerLifecycleManager lifecycle;
    private final CommandExecutor commandExecutor;
    private final RepositoryOperations repositories;
    private final SandboxCleaner cleaner;
    private final ToolRegistry tools;
    private final SandboxProperties properties;
    private final ExecutorService executor;

    @Autowired
    public SandboxManager(HostFileBridge fileBridge, ContainerLifecycleManager lifecycle,
                          CommandExecutor commandExecutor, RepositoryOperations repositories,
                          SandboxCleaner cleaner, ToolRegistry tools, SandboxProperties properties) {
        this.fileBridge = fileBridge;
        this.lifecycle = lifecycle;
        this.commandExecutor = commandExecutor;
        this.repositories = repositories;
        this.cleaner = cleaner;
        this.tools = tools;
        this.properties = properties;
        var threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getAsyncPoolSize()), r -> {
            Thread t = new Thread(r, "enclave-sandbox-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<Path> createSession() {
        return createSession(properties.getSessionPrefix());
    }

    public CompletableFuture<Path> createSession(String prefix) {
        return submit(() -> fileBridge.createSessionDir(prefix));
    }

    public CompletableFuture<List<MountSpec>> prepareFiles(Path sessionDir, Map<String, String> files) {
        return submit(() -> fileBridge.prepareFilesForMount(sessionDir, files));
    }

    public CompletableFuture<MountSpec> prepareOutputDirectory(Path sessionDir, String relativeDir, String containerPath) {
        return submit(() -> fileBridge.prepareOutputDirectory(sessionDir, relativeDir, containerPath));
    }

    public CompletableFuture<Map<String, String>> collectOutputFiles(Path sessionDir, String relativeDir) {
        return submit(() -> fileBridge.collectOutputFiles(sessionDir, relativeDir));
    }

    public CompletableFuture<String> createAndStartContainer(ContainerRequest request) {
        return submit(() -> lifecycle.createAndStart(request));
    }

    public CompletableFuture<ExecutionResult> executeCommand(ExecutionRequest request) {
        return submit(() -> commandExecutor.execute(request));
    }

    public CompletableFuture<RepositoryHandle> cloneRepository(String url, CloneOptions options) {
        return submit(() -> repositories.clone(url, options));
    }

    public CompletableFuture<List<String>> listRepositoryFiles(String containerId, String path) {
        return submit(() -> repositories.listFiles(containerId, path));
    }

    public CompletableFuture<String> readRepositoryFile(String containerId, String path) {
        return submit(() -> repositories.readFile(containerId, path));
    }

    public CompletableFuture<Void> releaseRepository(RepositoryHandle handle) {
        return submit(() -> {
            repositories.releaseRepository(handle);
            return null;
        });
    }

    public CompletableFuture<ExecutionResult> runTool(String toolName, String containerId, String workdir) {
        return submit(() -> tools.get(toolName).run(containerId, workdir));
    }

    public CompletableFuture<Boolean> cleanupContainer(String containerId) {
        return submit(() -> cleaner.cleanupContainer(containerId));
    }

    public CompletableFuture<Boolean> cleanupSessionDir(Path sessionDir) {
        return submit(() -> cleaner.cleanupSessionDir(sessionDir));
    }

    public CompletableFuture<Integer> cleanupAll() {
        return submit(cleaner::cleanupAll);
    }

    public int activeContainerCount() {
        return lifecycle.registry().size();
    }

    private <T> CompletableFuture<T> submit(Supplier<T> work) {
        var future = new CompletableFuture<T>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(work.get());
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(SandboxException.commandExecution(
                    "Sandbox manager is shut down", Map.of(), e));
        }
        return future;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Sandbox manager executor stopped");
    }
}
