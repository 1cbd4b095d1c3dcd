package com.enclave.sandbox.tools;

import com.enclave.sandbox.CommandExecutor;
import com.enclave.sandbox.ExecutionRequest;
import com.enclave.sandbox.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Base for tools that are a single fixed command run in the target working directory.
 */
public abstract class AbstractToolRunner implements ToolRunner {

    private static final Logger log = LoggerFactory.getLogger(AbstractToolRunner.class);

    private final CommandExecutor executor;

    protected AbstractToolRunner(CommandExecutor executor) {
        this.executor = executor;
    }

    protected abstract List<String> command();

    @Override
    public ExecutionResult run(String containerId, String workdir) {
        log.info("Running {} in container {} ({})", name(), containerId, workdir);
        var request = ExecutionRequest.of(containerId, command());
        if (workdir != null && !workdir.isBlank()) {
            request = request.withWorkingDir(workdir);
        }
        return executor.execute(request);
    }
}
