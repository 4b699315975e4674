package com.z254.butterfly.conclave.health;

import com.z254.butterfly.conclave.registry.Registry;
import com.z254.butterfly.conclave.store.SharedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for CONCLAVE.
 * Reports the shared store backend and its reachability, and the directory sizes.
 */
@Component
@Slf4j
public class ConclaveHealthIndicator implements HealthIndicator {

    private final SharedStore sharedStore;
    private final Registry registry;

    public ConclaveHealthIndicator(SharedStore sharedStore, Registry registry) {
        this.sharedStore = sharedStore;
        this.registry = registry;
    }

    @Override
    public Health health() {
        try {
            boolean available = sharedStore.isAvailable();
            Health.Builder builder = available ? Health.up() : Health.down();
            builder.withDetail("backend", sharedStore.backend());
            builder.withDetail("store", available ? "UP" : "DOWN");
            if (available) {
                builder.withDetail("agents", registry.getAgents().size());
                builder.withDetail("contexts", registry.getContextNames().size());
                builder.withDetail("tools", registry.getTools().size());
            }
            return builder.build();
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return Health.down()
                    .withDetail("backend", sharedStore.backend())
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
