package com.vigil.agent.infrastructure.health;

import com.vigil.agent.domain.AgentNotReadyException;
import com.vigil.agent.domain.ClusterAgent;
import com.vigil.status.SystemStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Exposes the last published cluster status under {@code /actuator/health/cluster}.
 */
public class ClusterHealthIndicator implements HealthIndicator {

    private final ClusterAgent agent;

    public ClusterHealthIndicator(ClusterAgent agent) {
        this.agent = agent;
    }

    @Override
    public Health health() {
        SystemStatus status;
        try {
            status = agent.currentStatus();
        } catch (AgentNotReadyException e) {
            return Health.unknown()
                    .withDetail("state", agent.state().name())
                    .withDetail("reason", e.getMessage())
                    .build();
        }
        Health.Builder builder = switch (status.statusType()) {
            case RUNNING -> Health.up();
            case DEGRADED -> Health.down().withDetail("summary", status.summary());
            case UNKNOWN -> Health.unknown().withDetail("summary", status.summary());
        };
        return builder
                .withDetail("status", status.statusType().name())
                .withDetail("nodes", status.nodes().size())
                .build();
    }
}
