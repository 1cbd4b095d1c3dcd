package com.enclave.sandbox.tools;

import com.enclave.core.error.SandboxException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Looks up {@link ToolRunner} beans by name.
 */
@Component
public class ToolRegistry {

    private final Map<String, ToolRunner> runners = new TreeMap<>();

    public ToolRegistry(List<ToolRunner> runners) {
        for (var runner : runners) {
            this.runners.put(runner.name(), runner);
        }
    }

    /**
     * @throws SandboxException COMMAND_EXECUTION for an unknown tool name
     */
    public ToolRunner get(String name) {
        var runner = name != null ? runners.get(name) : null;
        if (runner == null) {
            throw SandboxException.commandExecution("Unknown tool: " + name,
                    Map.of("tool", String.valueOf(name), "available", String.join(",", runners.keySet())), null);
        }
        return runner;
    }

    public List<String> names() {
        return List.copyOf(runners.keySet());
    }
}
