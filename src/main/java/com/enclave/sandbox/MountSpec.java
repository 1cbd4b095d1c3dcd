package com.enclave.sandbox;

import java.nio.file.Path;

/**
 * Binds a host path into a container.
 *
 * @param hostPath      absolute path on the host
 * @param containerPath absolute POSIX path inside the container
 * @param readOnly      true for staged inputs; only output directories are writable
 */
public record MountSpec(Path hostPath, String containerPath, boolean readOnly) {

    public static MountSpec readOnly(Path hostPath, String containerPath) {
        return new MountSpec(hostPath, containerPath, true);
    }

    public static MountSpec writable(Path hostPath, String containerPath) {
        return new MountSpec(hostPath, containerPath, false);
    }

    /** Docker bind notation, e.g. {@code /tmp/s/main.py:/workspace/main.py:ro}. */
    public String toBindString() {
        return hostPath + ":" + containerPath + (readOnly ? ":ro" : ":rw");
    }
}
