package com.enclave.sandbox;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live containers that still need cleanup, keyed by container id.
 *
 * <p>Owned by a single {@link ContainerLifecycleManager}. Safe for concurrent
 * insert, remove and iteration; iteration works on a snapshot.
 */
public class ContainerRegistry {

    private final ConcurrentHashMap<String, ContainerHandle> containers = new ConcurrentHashMap<>();

    void register(ContainerHandle handle) {
        containers.put(handle.id(), handle);
    }

    void updateStatus(String containerId, ContainerStatus status) {
        containers.computeIfPresent(containerId, (id, handle) -> handle.withStatus(status));
    }

    /**
     * @return the removed handle, or empty when the id was not tracked
     */
    Optional<ContainerHandle> remove(String containerId) {
        return Optional.ofNullable(containers.remove(containerId));
    }

    public Optional<ContainerHandle> get(String containerId) {
        return Optional.ofNullable(containers.get(containerId));
    }

    public boolean contains(String containerId) {
        return containers.containsKey(containerId);
    }

    public List<String> ids() {
        return List.copyOf(containers.keySet());
    }

    public int size() {
        return containers.size();
    }
}
