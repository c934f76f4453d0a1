package com.helmsman.dispatch.cli;

import com.helmsman.core.health.HealthCheckService;
import com.helmsman.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: helmsman health
 * <p>
 * Reports the loaded pattern catalog and the result of a pipeline self-test.
 * Exits with 1 when any component is not UP.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
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

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.info(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            check.metadata().forEach((key, value) -> System.out.println("    " + key + " = " + value));
        }

        boolean allUp = checks.stream().allMatch(HealthStatus::isUp);
        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: ready to process documents");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more components degraded or down");
        return 1;
    }
}
