package com.enclave.sandbox.tools;

import com.enclave.sandbox.ExecutionResult;

/**
 * A named test or lint tool that can be run against code mounted in a sandbox.
 * The exit code is returned as-is; interpreting it is the caller's job.
 */
public interface ToolRunner {

    String name();

    ExecutionResult run(String containerId, String workdir);
}
