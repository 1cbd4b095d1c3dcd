package com.enclave.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown by every sandbox engine operation that cannot complete.
 *
 * <p>The {@link SandboxErrorKind} says what failed; {@link #context()} carries the
 * structured details (container id, path, command, url) for logging.
 */
public class SandboxException extends RuntimeException {

    private final SandboxErrorKind kind;
    private final Map<String, String> context;

    public SandboxException(SandboxErrorKind kind, String message, Map<String, String> context, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.context = context != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                : Map.of();
    }

    public SandboxException(SandboxErrorKind kind, String message, Map<String, String> context) {
        this(kind, message, context, null);
    }

    public static SandboxException containerCreation(String message, Map<String, String> context, Throwable cause) {
        return new SandboxException(SandboxErrorKind.CONTAINER_CREATION, message, context, cause);
    }

    public static SandboxException commandExecution(String message, Map<String, String> context, Throwable cause) {
        return new SandboxException(SandboxErrorKind.COMMAND_EXECUTION, message, context, cause);
    }

    public static SandboxException commandTimeout(String message, Map<String, String> context) {
        return new SandboxException(SandboxErrorKind.COMMAND_TIMEOUT, message, context);
    }

    public static SandboxException fileSystem(String message, Map<String, String> context, Throwable cause) {
        return new SandboxException(SandboxErrorKind.FILE_SYSTEM, message, context, cause);
    }

    public static SandboxException securityViolation(String message, Map<String, String> context) {
        return new SandboxException(SandboxErrorKind.SECURITY_VIOLATION, message, context);
    }

    public static SandboxException resourceLimit(String message, Map<String, String> context) {
        return new SandboxException(SandboxErrorKind.RESOURCE_LIMIT, message, context);
    }

    public SandboxErrorKind kind() { return kind; }

    public String code() { return kind.code(); }

    public SandboxErrorKind.Severity severity() { return kind.severity(); }

    public Map<String, String> context() { return context; }

    public boolean isRetryableWithModification() {
        return kind.severity() == SandboxErrorKind.Severity.RECOVERABLE_WITH_MODIFICATION;
    }

    @Override
    public String toString() {
        return "SandboxException[" + kind.code() + "] " + getMessage() + (context.isEmpty() ? "" : " " + context);
    }
}
