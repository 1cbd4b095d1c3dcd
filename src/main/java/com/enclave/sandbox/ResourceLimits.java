package com.enclave.sandbox;

import com.enclave.core.error.SandboxException;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CPU and memory quota applied to a container. Both are always positive, CPU at
 * least {@link #MIN_CPUS}; there is no "unlimited" value.
 *
 * @param cpus        fractional CPU quota (0.5 = half a core)
 * @param memoryBytes hard memory limit in bytes
 */
public record ResourceLimits(double cpus, long memoryBytes) {

    /** Docker's smallest CPU quota; NanoCPUs of 0 would mean no limit at all. */
    public static final double MIN_CPUS = 0.01;

    private static final Pattern MEMORY = Pattern.compile("^(\\d+)([bkmg]?)$");

    public ResourceLimits {
        if (!(cpus >= MIN_CPUS) || Double.isInfinite(cpus)) {
            throw SandboxException.resourceLimit("CPU limit must be at least " + MIN_CPUS + ": " + cpus,
                    Map.of("cpus", String.valueOf(cpus)));
        }
        if (memoryBytes <= 0) {
            throw SandboxException.resourceLimit("Memory limit must be positive: " + memoryBytes,
                    Map.of("memory", String.valueOf(memoryBytes)));
        }
    }

    public static ResourceLimits of(double cpus, String memory) {
        return new ResourceLimits(cpus, parseMemory(memory));
    }

    /** Docker's NanoCPUs value for this quota. */
    public long nanoCpus() {
        return Math.round(cpus * 1_000_000_000L);
    }

    /**
     * Parses a memory string such as {@code 512m}, {@code 1g}, {@code 64k} or a
     * plain byte count.
     *
     * @throws SandboxException RESOURCE_LIMIT when the format is not recognised
     */
    public static long parseMemory(String memory) {
        if (memory == null) {
            throw SandboxException.resourceLimit("Memory limit is required", Map.of());
        }
        Matcher m = MEMORY.matcher(memory.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw SandboxException.resourceLimit("Invalid memory limit format: " + memory,
                    Map.of("memory", memory));
        }
        long value;
        try {
            value = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            throw SandboxException.resourceLimit("Memory limit out of range: " + memory,
                    Map.of("memory", memory));
        }
        long multiplier = switch (m.group(2)) {
            case "k" -> 1024L;
            case "m" -> 1024L * 1024;
            case "g" -> 1024L * 1024 * 1024;
            default -> 1L;
        };
        try {
            return Math.multiplyExact(value, multiplier);
        } catch (ArithmeticException e) {
            throw SandboxException.resourceLimit("Memory limit out of range: " + memory,
                    Map.of("memory", memory));
        }
    }
}
