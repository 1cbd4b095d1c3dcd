package com.enclave.sandbox;

/**
 * Lifecycle states of a sandbox container.
 *
 * <p>{@code CREATED -> RUNNING -> STOPPED -> REMOVED}; {@code FAILED} is terminal and
 * only reachable from {@code CREATED} when the container cannot be started.
 */
public enum ContainerStatus {
    CREATED,
    RUNNING,
    STOPPED,
    REMOVED,
    FAILED;

    public boolean isRunning() {
        return this == RUNNING;
    }
}
