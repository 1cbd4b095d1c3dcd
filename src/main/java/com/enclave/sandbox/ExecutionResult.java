package com.enclave.sandbox;

/**
 * Outcome of a completed exec. The exit code is reported verbatim; deciding whether
 * it means success is up to the caller.
 *
 * @param exitCode    process exit status as reported by the runtime
 * @param output      captured stdout, UTF-8, one trailing line terminator removed
 *                    unless the request asked for preserved output
 * @param errorOutput captured stderr, decoded the same way
 * @param durationMs  wall-clock time from exec start to completion
 * @param truncated   true when either stream exceeded the capture limit; the
 *                    streams then hold only their first bytes
 */
public record ExecutionResult(
    int exitCode,
    String output,
    String errorOutput,
    long durationMs,
    boolean truncated
) {

    public ExecutionResult(int exitCode, String output, String errorOutput, long durationMs) {
        this(exitCode, output, errorOutput, durationMs, false);
    }
}
