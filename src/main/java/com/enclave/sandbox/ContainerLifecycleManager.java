package com.enclave.sandbox;

import com.enclave.core.error.SandboxException;
import com.enclave.core.logging.MdcContext;
import com.enclave.core.metrics.EnclaveMetrics;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Capability;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Creates, starts, inspects, stops and removes sandbox containers.
 *
 * <p>Every container is created with the same hardening, regardless of request:
 * <ul>
 *   <li>Network mode from configuration (default {@code none}); only an explicit
 *       {@link ContainerRequest#networkOverride()} changes it</li>
 *   <li>Numeric non-root user from configuration</li>
 *   <li>All capabilities dropped, {@code no-new-privileges}</li>
 *   <li>Read-only root filesystem with a small {@code tmpfs} at /tmp</li>
 *   <li>CPU quota, memory (swap pinned to memory) and pids limits always set</li>
 *   <li>Labels {@code enclave.managed=true} and {@code enclave.session} for orphan discovery</li>
 * </ul>
 *
 * <p>The manager owns the {@link ContainerRegistry} of live containers. Containers are
 * kept alive with a no-op main process so commands can be exec'd into them.
 */
@Service
public class ContainerLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ContainerLifecycleManager.class);

    public static final String MANAGED_LABEL = "enclave.managed";
    public static final String SESSION_LABEL = "enclave.session";

    static final String[] KEEP_ALIVE_ENTRYPOINT = {"tail", "-f", "/dev/null"};
    static final String TMPFS_OPTIONS = "rw,noexec,nosuid,size=64m";

    private final DockerClient dockerClient;
    private final SandboxProperties properties;
    private final EnclaveMetrics metrics;
    private final ContainerRegistry registry = new ContainerRegistry();

    @Autowired
    public ContainerLifecycleManager(DockerClient dockerClient, SandboxProperties properties,
                                     @Autowired(required = false) EnclaveMetrics metrics) {
        this.dockerClient = dockerClient;
        this.properties = properties;
        this.metrics = metrics;
        if (metrics != null) {
            metrics.bindActiveContainers(registry::size);
        }
    }

    public ContainerRegistry registry() {
        return registry;
    }

    /**
     * Creates and starts a hardened container.
     *
     * @return the runtime container id, registered as RUNNING
     * @throws SandboxException CONTAINER_CREATION on any runtime failure (missing image,
     *                          exhausted resources, invalid config); RESOURCE_LIMIT for bad limits
     */
    public String createAndStart(ContainerRequest request) {
        String image = request.image() != null && !request.image().isBlank()
                ? request.image()
                : properties.getBaseImage();
        ResourceLimits limits = request.limits() != null ? request.limits() : properties.resolveDefaultLimits();
        String networkMode = request.networkOverride() != null && !request.networkOverride().isBlank()
                ? request.networkOverride()
                : properties.getDefaultNetworkMode();
        String user = properties.getContainerUser();

        ensureImage(image);

        var labels = new LinkedHashMap<String, String>();
        labels.put(MANAGED_LABEL, "true");
        if (request.sessionId() != null) {
            labels.put(SESSION_LABEL, request.sessionId());
        }

        var envList = new ArrayList<String>();
        request.envVars().forEach((k, v) -> envList.add(k + "=" + v));

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(toBinds(request.mounts()))
                .withNetworkMode(networkMode)
                .withNanoCPUs(limits.nanoCpus())
                .withMemory(limits.memoryBytes())
                .withMemorySwap(limits.memoryBytes())
                .withPidsLimit(properties.getPidsLimit())
                .withCapDrop(Capability.ALL)
                .withSecurityOpts(List.of("no-new-privileges"))
                .withReadonlyRootfs(true)
                .withTmpFs(Map.of("/tmp", TMPFS_OPTIONS));

        String containerId;
        try {
            var response = dockerClient.createContainerCmd(image)
                    .withHostConfig(hostConfig)
                    .withUser(user)
                    .withEnv(envList)
                    .withLabels(labels)
                    .withWorkingDir(properties.getContainerWorkdir())
                    .withEntrypoint(KEEP_ALIVE_ENTRYPOINT)
                    .withNetworkDisabled("none".equals(networkMode))
                    .exec();
            containerId = response.getId();
        } catch (RuntimeException e) {
            recordFailure("create");
            throw SandboxException.containerCreation("Failed to create container from " + image + ": " + e.getMessage(),
                    Map.of("image", image), e);
        }

        var handle = new ContainerHandle(containerId, image, limits, networkMode, user,
                request.mounts(), ContainerStatus.CREATED);
        registry.register(handle);

        try {
            MdcContext.setContainer(containerId, "start");
            dockerClient.startContainerCmd(containerId).exec();
        } catch (RuntimeException e) {
            registry.updateStatus(containerId, ContainerStatus.FAILED);
            recordFailure("start");
            log.warn("Container {} failed to start, removing it", containerId, e);
            if (forceRemoveQuietly(containerId)) {
                registry.remove(containerId);
            }
            throw SandboxException.containerCreation("Failed to start container: " + e.getMessage(),
                    Map.of("containerId", containerId, "image", image), e);
        } finally {
            MdcContext.clearContainer();
        }

        registry.updateStatus(containerId, ContainerStatus.RUNNING);
        if (metrics != null) {
            metrics.recordContainerCreated(image);
        }
        log.info("Container {} started (image: {}, network: {}, cpus: {}, memory: {} bytes)",
                containerId, image, networkMode, limits.cpus(), limits.memoryBytes());
        if (log.isDebugEnabled()) {
            log.debug("Mounts for {}: {}", containerId,
                    request.mounts().stream().map(MountSpec::toBindString).toList());
        }
        return containerId;
    }

    /**
     * Queries the runtime for the container's state. A container the runtime no longer
     * knows is {@link ContainerStatus#REMOVED}.
     */
    public ContainerStatus status(String containerId) {
        InspectContainerResponse inspect;
        try {
            inspect = dockerClient.inspectContainerCmd(containerId).exec();
        } catch (NotFoundException e) {
            return ContainerStatus.REMOVED;
        }
        var state = inspect.getState();
        if (state == null) {
            return ContainerStatus.STOPPED;
        }
        if (Boolean.TRUE.equals(state.getRunning())) {
            return ContainerStatus.RUNNING;
        }
        if ("created".equals(state.getStatus())) {
            return ContainerStatus.CREATED;
        }
        return ContainerStatus.STOPPED;
    }

    /**
     * Stops the container. "Already stopped" and "not found" both count as success.
     */
    public void stop(String containerId) {
        try {
            dockerClient.stopContainerCmd(containerId).withTimeout(2).exec();
            log.debug("Container {} stopped", containerId);
        } catch (NotModifiedException e) {
            log.debug("Container {} was not running", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} already gone", containerId);
        }
        registry.updateStatus(containerId, ContainerStatus.STOPPED);
    }

    /**
     * Force-removes the container and unregisters it. "Not found" counts as success.
     */
    public void remove(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).withRemoveVolumes(true).exec();
            log.info("Container {} removed", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
        } catch (ConflictException e) {
            log.debug("Removal of container {} already in progress", containerId);
        }
        registry.remove(containerId);
    }

    /**
     * Lists every container, running or not, labelled as managed by this engine.
     * Not called automatically; a caller that suspects orphans from a crashed
     * process invokes it and decides what to reap.
     */
    public List<String> listManagedContainers() {
        List<Container> containers = dockerClient.listContainersCmd()
                .withShowAll(true)
                .withLabelFilter(Map.of(MANAGED_LABEL, "true"))
                .exec();
        return containers.stream().map(Container::getId).toList();
    }

    private void ensureImage(String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
            return;
        } catch (NotFoundException e) {
            if (!properties.isPullMissingImages()) {
                recordFailure("image_missing");
                throw SandboxException.containerCreation("Image not available locally: " + image,
                        Map.of("image", image), e);
            }
        } catch (RuntimeException e) {
            recordFailure("image_inspect");
            throw SandboxException.containerCreation("Failed to inspect image " + image + ": " + e.getMessage(),
                    Map.of("image", image), e);
        }

        log.info("Image {} not found locally, pulling", image);
        try {
            boolean completed = dockerClient.pullImageCmd(image)
                    .exec(new PullImageResultCallback())
                    .awaitCompletion(properties.getImagePullTimeoutSeconds(), TimeUnit.SECONDS);
            if (!completed) {
                recordFailure("image_pull");
                throw SandboxException.containerCreation("Timed out pulling image " + image,
                        Map.of("image", image), null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SandboxException.containerCreation("Interrupted while pulling image " + image,
                    Map.of("image", image), e);
        } catch (SandboxException e) {
            throw e;
        } catch (RuntimeException e) {
            recordFailure("image_pull");
            throw SandboxException.containerCreation("Failed to pull image " + image + ": " + e.getMessage(),
                    Map.of("image", image), e);
        }
    }

    /**
     * @return true when the container is gone; a container that could not be removed
     *         stays registered as FAILED so a cleanup sweep can retry it
     */
    private boolean forceRemoveQuietly(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            return true;
        } catch (NotFoundException e) {
            return true;
        } catch (RuntimeException e) {
            log.warn("Could not remove failed container {}: {}", containerId, e.getMessage());
            return false;
        }
    }

    private void recordFailure(String reason) {
        if (metrics != null) {
            metrics.recordContainerFailed(reason);
        }
    }

    static Bind[] toBinds(List<MountSpec> mounts) {
        return mounts.stream()
                .map(m -> new Bind(m.hostPath().toString(), new Volume(m.containerPath()),
                        m.readOnly() ? AccessMode.ro : AccessMode.rw))
                .toArray(Bind[]::new);
    }
}
