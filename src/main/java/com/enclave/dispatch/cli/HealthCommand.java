package com.enclave.dispatch.cli;

import com.enclave.core.health.HealthCheckService;
import com.enclave.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: enclave health
 * <p>
 * Checks the Docker daemon, the host scratch directory and the container registry.
 * Exits non-zero when any component is not UP.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check sandbox health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        var checks = healthCheckService.checkAll();
        long notUp = checks.stream().filter(c -> c.status() != HealthStatus.Status.UP).count();

        for (var check : checks) {
            String label = check.component() + ": " + check.detail() + describe(check);
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.info(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (notUp == 0) {
            ConsoleOutput.success("Overall: sandbox ready");
            return 0;
        }
        ConsoleOutput.error("Overall: " + notUp + " component" + (notUp != 1 ? "s" : "") + " degraded or down");
        return 1;
    }

    private static String describe(HealthStatus check) {
        if (check.metadata() == null || check.metadata().isEmpty()) return "";
        return check.metadata().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", " (", ")"));
    }
}
