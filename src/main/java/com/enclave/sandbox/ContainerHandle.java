package com.enclave.sandbox;

import java.util.List;

/**
 * A container owned by the {@link ContainerLifecycleManager}: the runtime id plus the
 * policy it was created with. Other components refer to it by {@link #id()} only.
 */
public record ContainerHandle(
    String id,
    String image,
    ResourceLimits limits,
    String networkMode,
    String user,
    List<MountSpec> mounts,
    ContainerStatus status
) {

    public ContainerHandle withStatus(ContainerStatus newStatus) {
        return new ContainerHandle(id, image, limits, networkMode, user, mounts, newStatus);
    }
}
