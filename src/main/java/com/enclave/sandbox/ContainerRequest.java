package com.enclave.sandbox;

import java.util.List;
import java.util.Map;

/**
 * Everything a caller may choose when creating a sandbox container.
 *
 * <p>The process user, capability set and filesystem hardening are not here: they are
 * policy applied uniformly by {@link ContainerLifecycleManager}. Null fields fall back
 * to the configured defaults.
 *
 * @param image           image reference, or null for the configured base image
 * @param limits          CPU/memory quota, or null for the configured defaults
 * @param networkOverride network mode, or null for the default isolated network
 * @param mounts          bind mounts, typically from {@link HostFileBridge}
 * @param envVars         environment for the container's main process
 * @param sessionId       session this container serves, used for labelling (nullable)
 */
public record ContainerRequest(
    String image,
    ResourceLimits limits,
    String networkOverride,
    List<MountSpec> mounts,
    Map<String, String> envVars,
    String sessionId
) {

    public ContainerRequest {
        mounts = mounts != null ? List.copyOf(mounts) : List.of();
        envVars = envVars != null ? Map.copyOf(envVars) : Map.of();
    }

    public static ContainerRequest withMounts(String image, List<MountSpec> mounts) {
        return new ContainerRequest(image, null, null, mounts, Map.of(), null);
    }

    public static ContainerRequest defaults() {
        return new ContainerRequest(null, null, null, List.of(), Map.of(), null);
    }
}
