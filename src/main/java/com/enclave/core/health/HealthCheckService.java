package com.enclave.core.health;

import com.enclave.sandbox.ContainerLifecycleManager;
import com.enclave.sandbox.SandboxProperties;
import com.github.dockerjava.api.DockerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DockerClient dockerClient;
    private final SandboxProperties properties;
    private final ContainerLifecycleManager lifecycle;

    public HealthCheckService(
            @Autowired(required = false) DockerClient dockerClient,
            SandboxProperties properties,
            @Autowired(required = false) ContainerLifecycleManager lifecycle) {
        this.dockerClient = dockerClient;
        this.properties = properties;
        this.lifecycle = lifecycle;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDocker());
        results.add(checkScratchDirectory());
        results.add(checkRegistry());
        return results;
    }

    private HealthStatus checkDocker() {
        if (dockerClient == null) {
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "No Docker client configured", Map.of());
        }
        try {
            dockerClient.pingCmd().exec();
            return new HealthStatus("docker", HealthStatus.Status.UP,
                    "Docker daemon reachable", Map.of());
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Docker error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkScratchDirectory() {
        var root = properties.getTempHostDir();
        try {
            Files.createDirectories(root);
            var marker = Files.createTempFile(root, ".health", ".tmp");
            Files.delete(marker);
            return new HealthStatus("scratch", HealthStatus.Status.UP,
                    "Temp root writable", Map.of("path", root.toString()));
        } catch (IOException | SecurityException e) {
            log.warn("Scratch directory health check failed: {}", e.getMessage());
            return new HealthStatus("scratch", HealthStatus.Status.DOWN,
                    "Temp root not writable: " + e.getMessage(), Map.of("path", root.toString()));
        }
    }

    private HealthStatus checkRegistry() {
        if (lifecycle == null) {
            return new HealthStatus("registry", HealthStatus.Status.DEGRADED,
                    "Lifecycle manager not available", Map.of());
        }
        int active = lifecycle.registry().size();
        return new HealthStatus("registry", HealthStatus.Status.UP,
                active + " active container" + (active != 1 ? "s" : ""),
                Map.of("activeContainers", String.valueOf(active)));
    }
}
