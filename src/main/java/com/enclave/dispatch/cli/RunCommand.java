package com.enclave.dispatch.cli;

import com.enclave.core.error.SandboxException;
import com.enclave.sandbox.ContainerRequest;
import com.enclave.sandbox.ExecutionRequest;
import com.enclave.sandbox.ExecutionResult;
import com.enclave.sandbox.ResourceLimits;
import com.enclave.sandbox.SandboxManager;
import com.enclave.sandbox.SandboxProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: enclave run [--image img] [--file f]... -- argv...
 * <p>
 * Stages local files into a fresh sandbox, runs one command against them and tears
 * everything down again. Exits with the command's own exit code.
 */
@Command(name = "run", mixinStandardHelpOptions = true,
        description = "Run a command against local files in a throwaway sandbox")
@Component
public class RunCommand implements Callable<Integer> {

    static final int SANDBOX_FAILURE = 125;

    @Option(names = {"--image", "-i"}, description = "Container image (default: configured base image)")
    private String image;

    @Option(names = {"--file", "-f"}, description = "Local file to mount read-only into the workdir")
    private List<Path> files = new ArrayList<>();

    @Option(names = "--timeout-ms", description = "Command timeout in milliseconds")
    private Long timeoutMs;

    @Option(names = "--cpus", description = "CPU quota, e.g. 0.5")
    private Double cpus;

    @Option(names = "--memory", description = "Memory limit, e.g. 256m")
    private String memory;

    @Option(names = "--json", description = "Print the execution result as JSON")
    private boolean json;

    @Parameters(arity = "1..*", description = "Command and arguments to run")
    private List<String> argv = new ArrayList<>();

    private final SandboxManager sandboxManager;
    private final SandboxProperties properties;
    private final ObjectMapper objectMapper;

    public RunCommand(SandboxManager sandboxManager, SandboxProperties properties, ObjectMapper objectMapper) {
        this.sandboxManager = sandboxManager;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        Map<String, String> contents;
        try {
            contents = readLocalFiles();
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read input file: " + e.getMessage());
            return SANDBOX_FAILURE;
        }

        Path session = null;
        String containerId = null;
        try {
            session = ConsoleOutput.await(sandboxManager.createSession());
            var mounts = ConsoleOutput.await(sandboxManager.prepareFiles(session, contents));
            containerId = ConsoleOutput.await(sandboxManager.createAndStartContainer(new ContainerRequest(
                    image, resolveLimits(), null, mounts, Map.of(), session.getFileName().toString())));
            if (!json) {
                ConsoleOutput.sandbox("Container " + containerId.substring(0, Math.min(12, containerId.length()))
                        + " started, running: " + String.join(" ", argv));
            }

            ExecutionResult result = ConsoleOutput.await(sandboxManager.executeCommand(new ExecutionRequest(
                    containerId, argv, Map.of(), timeoutMs, properties.getContainerWorkdir())));
            if (json) {
                System.out.println(objectMapper.writeValueAsString(result));
            } else {
                ConsoleOutput.executionResult(result);
            }
            return result.exitCode();
        } catch (SandboxException e) {
            ConsoleOutput.failure(e);
            return SANDBOX_FAILURE;
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Cannot serialize result: " + e.getOriginalMessage());
            return SANDBOX_FAILURE;
        } finally {
            if (containerId != null) {
                ConsoleOutput.await(sandboxManager.cleanupContainer(containerId));
            }
            if (session != null) {
                ConsoleOutput.await(sandboxManager.cleanupSessionDir(session));
            }
        }
    }

    private Map<String, String> readLocalFiles() throws IOException {
        var contents = new LinkedHashMap<String, String>();
        for (Path file : files) {
            contents.put(file.getFileName().toString(), Files.readString(file, StandardCharsets.UTF_8));
        }
        return contents;
    }

    private ResourceLimits resolveLimits() {
        if (cpus == null && memory == null) {
            return null;
        }
        var defaults = properties.getDefaultResourceLimits();
        return ResourceLimits.of(cpus != null ? cpus : defaults.getCpus(),
                memory != null ? memory : defaults.getMemory());
    }
}
