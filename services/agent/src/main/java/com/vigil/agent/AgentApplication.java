package com.vigil.agent;

import com.vigil.agent.config.AgentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Vigil cluster health agent.
 * <p>
 * One agent runs on every node. It joins the gossip cluster, collects the health of its own node
 * on a fixed period, gathers the statuses of its peers and publishes the aggregated cluster status
 * through:
 * <ul>
 *   <li>the REST API under {@code /api/v1}
 *   <li>the actuator health and Prometheus endpoints
 *   <li>the event timeline, when {@code vigil.timeline.enabled=true}
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(AgentProperties.class)
public class AgentApplication {

    private static final Logger log = LoggerFactory.getLogger(AgentApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AgentApplication.class, args);
        log.info("Vigil agent started");
    }
}
