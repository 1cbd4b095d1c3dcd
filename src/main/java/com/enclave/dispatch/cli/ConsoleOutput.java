package com.enclave.dispatch.cli;

import com.enclave.core.error.SandboxException;
import com.enclave.sandbox.ExecutionResult;
import picocli.CommandLine;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * ANSI-colored terminal output utilities for the Enclave CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ENCLAVE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ENCLAVE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void sandbox(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [SANDBOX]|@ " + message));
    }

    public static void failure(SandboxException e) {
        error(e.code() + " (" + e.severity() + "): " + e.getMessage());
    }

    public static void executionResult(ExecutionResult result) {
        String status = result.exitCode() == 0
                ? "@|fg(green) exit 0|@"
                : "@|fg(red) exit " + result.exitCode() + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [SANDBOX]|@ " + status + " in " + formatDuration(result.durationMs())));
        if (!result.output().isEmpty()) {
            System.out.println(result.output());
        }
        if (!result.errorOutput().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) stderr:|@"));
            System.out.println(result.errorOutput());
        }
    }

    /**
     * Waits for a sandbox operation, rethrowing its failure unwrapped.
     */
    static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
