package com.helmsman.core.health;

import java.util.Map;

/**
 * Outcome of one component health check.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public boolean isUp() {
        return status == Status.UP;
    }
}
