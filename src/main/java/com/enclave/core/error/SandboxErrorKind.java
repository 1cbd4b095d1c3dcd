package com.enclave.core.error;

/**
 * Tag identifying what went wrong in the sandbox engine.
 *
 * <p>Callers branch on the kind rather than on exception types: security and
 * file-system failures mean "fix the input", timeouts and resource limits mean
 * "retry with modified parameters", the rest mean "abort and escalate".
 */
public enum SandboxErrorKind {

    CONTAINER_CREATION("CONTAINER_CREATION_ERROR", Severity.CRITICAL),
    COMMAND_EXECUTION("COMMAND_EXECUTION_ERROR", Severity.CRITICAL),
    COMMAND_TIMEOUT("COMMAND_TIMEOUT_ERROR", Severity.RECOVERABLE_WITH_MODIFICATION),
    FILE_SYSTEM("FILE_SYSTEM_ERROR", Severity.CRITICAL),
    SECURITY_VIOLATION("SECURITY_VIOLATION_ERROR", Severity.FATAL),
    RESOURCE_LIMIT("RESOURCE_LIMIT_ERROR", Severity.RECOVERABLE_WITH_MODIFICATION);

    public enum Severity { RECOVERABLE_WITH_MODIFICATION, CRITICAL, FATAL }

    private final String code;
    private final Severity severity;

    SandboxErrorKind(String code, Severity severity) {
        this.code = code;
        this.severity = severity;
    }

    public String code() { return code; }

    public Severity severity() { return severity; }
}
