package com.enclave.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Enclave.
 * Routes to subcommands: run, repo, health, sweep.
 */
@Command(
        name = "enclave",
        mixinStandardHelpOptions = true,
        version = "Enclave 0.1.0",
        description = "Run untrusted code in hardened Docker sandboxes",
        subcommands = {
                RunCommand.class,
                RepoCommand.class,
                HealthCommand.class,
                SweepCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class EnclaveCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
