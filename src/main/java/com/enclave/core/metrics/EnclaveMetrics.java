package com.enclave.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for sandbox container and command activity.
 */
@Service
public class EnclaveMetrics {

    private final MeterRegistry registry;

    public EnclaveMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordContainerCreated(String image) {
        Counter.builder("enclave.containers.created")
                .tag("image", image)
                .register(registry)
                .increment();
    }

    public void recordContainerFailed(String reason) {
        Counter.builder("enclave.containers.failed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records the wall-clock time of a single exec.
     *
     * @param outcome "completed", "timeout" or "failed"
     * @param ms      elapsed milliseconds
     */
    public void recordExecution(String outcome, long ms) {
        Timer.builder("enclave.exec.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSecurityViolation(String reason) {
        Counter.builder("enclave.security.violations")
                .description("Operations rejected before any side effect")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordCleanupFailure(String resource) {
        Counter.builder("enclave.cleanup.failures")
                .tag("resource", resource)
                .register(registry)
                .increment();
    }

    /**
     * Registers a gauge that reports the number of tracked live containers.
     */
    public void bindActiveContainers(Supplier<Number> activeCount) {
        Gauge.builder("enclave.containers.active", activeCount)
                .description("Containers currently tracked for cleanup")
                .register(registry);
    }
}
