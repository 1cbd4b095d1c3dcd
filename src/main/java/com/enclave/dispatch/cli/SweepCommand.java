package com.enclave.dispatch.cli;

import com.enclave.sandbox.ContainerLifecycleManager;
import com.enclave.sandbox.SandboxManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: enclave sweep [--orphans]
 * <p>
 * Cleans up every tracked sandbox. With {@code --orphans} it also removes containers
 * labelled as managed by Enclave that a previous, crashed process left behind.
 */
@Command(name = "sweep", mixinStandardHelpOptions = true, description = "Remove sandbox containers and scratch directories")
@Component
public class SweepCommand implements Callable<Integer> {

    @Option(names = "--orphans", description = "Also remove labelled containers not tracked by this process")
    private boolean orphans;

    private final SandboxManager sandboxManager;
    private final ContainerLifecycleManager lifecycle;

    public SweepCommand(SandboxManager sandboxManager, ContainerLifecycleManager lifecycle) {
        this.sandboxManager = sandboxManager;
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        int failures = ConsoleOutput.await(sandboxManager.cleanupAll());

        if (orphans) {
            var ids = lifecycle.listManagedContainers();
            ConsoleOutput.info("Found " + ids.size() + " labelled container" + (ids.size() != 1 ? "s" : ""));
            for (String id : ids) {
                boolean removed = ConsoleOutput.await(sandboxManager.cleanupContainer(id));
                if (removed) {
                    ConsoleOutput.success("Removed " + id.substring(0, Math.min(12, id.length())));
                } else {
                    ConsoleOutput.error("Could not remove " + id.substring(0, Math.min(12, id.length())));
                    failures++;
                }
            }
        }

        if (failures > 0) {
            ConsoleOutput.error("Sweep finished with " + failures + " failure" + (failures != 1 ? "s" : ""));
            return 1;
        }
        ConsoleOutput.success("Sweep complete");
        return 0;
    }
}
