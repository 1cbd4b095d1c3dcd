package com.enclave.dispatch.cli;

import com.enclave.core.error.SandboxException;
import com.enclave.core.security.RepositoryUrlPolicy;
import com.enclave.sandbox.CloneOptions;
import com.enclave.sandbox.RepositoryHandle;
import com.enclave.sandbox.SandboxManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: enclave repo &lt;url&gt; [--branch b] [--read path]
 * <p>
 * Clones a repository into a sandbox, then lists its files or prints one of them.
 */
@Command(name = "repo", mixinStandardHelpOptions = true, description = "Clone a repository and inspect it")
@Component
public class RepoCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "HTTPS repository URL")
    private String url;

    @Option(names = {"--branch", "-b"}, description = "Branch or tag to clone")
    private String branch;

    @Option(names = {"--read", "-r"}, description = "File to print, relative to the repository root")
    private String readPath;

    @Option(names = "--path", description = "Directory to list, relative to the repository root")
    private String listPath;

    private final SandboxManager sandboxManager;

    public RepoCommand(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Cloning " + RepositoryUrlPolicy.mask(url) + (branch != null ? " @ " + branch : ""));

        RepositoryHandle handle = null;
        try {
            handle = ConsoleOutput.await(sandboxManager.cloneRepository(url, new CloneOptions(branch, null)));
            ConsoleOutput.success("Cloned at " + (handle.commit() != null ? handle.commit() : "unknown commit"));

            if (readPath != null) {
                System.out.println(ConsoleOutput.await(
                        sandboxManager.readRepositoryFile(handle.containerId(), readPath)));
            } else {
                var files = ConsoleOutput.await(
                        sandboxManager.listRepositoryFiles(handle.containerId(), listPath));
                files.forEach(f -> System.out.println("  " + f));
                ConsoleOutput.info(files.size() + " file" + (files.size() != 1 ? "s" : ""));
            }
            return 0;
        } catch (SandboxException e) {
            ConsoleOutput.failure(e);
            return 1;
        } finally {
            if (handle != null) {
                ConsoleOutput.await(sandboxManager.releaseRepository(handle));
            }
        }
    }
}
