package com.enclave.sandbox;

import java.nio.file.Path;

/**
 * A cloned repository living in its own container.
 *
 * @param hostPath    session directory holding the clone on the host
 * @param clonePath   container-side path of the working tree; every list/read must stay below it
 * @param containerId container the clone was made in
 * @param branch      requested branch, or null for the remote default
 * @param commit      resolved HEAD commit, or null when it could not be determined
 */
public record RepositoryHandle(
    Path hostPath,
    String clonePath,
    String containerId,
    String branch,
    String commit
) {}
