package com.vigil.agent.api;

import com.vigil.agent.config.AgentProperties;
import com.vigil.agent.domain.ClusterAgent;
import com.vigil.membership.ClusterMember;
import com.vigil.membership.MemberNotFoundException;
import com.vigil.status.NodeStatus;
import com.vigil.status.StatusType;
import com.vigil.status.SystemStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the agent: cluster status, local node status and agent info.
 * <p>
 * Status endpoints answer 503 with the status as body when the status is not running, so that
 * load balancers and scripts can rely on the HTTP code alone.
 */
@RestController
@RequestMapping("/api/v1")
public class StatusController {

    private final ClusterAgent agent;
    private final AgentProperties properties;
    private final Clock clock;

    public StatusController(ClusterAgent agent, AgentProperties properties, Clock clock) {
        this.agent = agent;
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/status")
    public ResponseEntity<SystemStatus> clusterStatus() {
        SystemStatus status = agent.currentStatus();
        return ResponseEntity.status(httpStatus(status.statusType())).body(status);
    }

    /** Status of this node only; peers call this endpoint during their collection cycle. */
    @GetMapping("/status/local")
    public ResponseEntity<NodeStatus> localStatus() {
        NodeStatus status = agent.localStatus();
        HttpStatus code = status.statusType() == StatusType.DEGRADED ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(code).body(status);
    }

    @GetMapping("/status/history")
    public List<SystemStatus> statusHistory() {
        return agent.statusHistory();
    }

    @GetMapping("/time")
    public Map<String, Object> time() {
        return Map.of("timestamp", clock.instant().toString());
    }

    @GetMapping("/info")
    public Map<String, Object> agentInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("role", properties.role());
        info.put("state", agent.state().name());
        info.put("statusPeriod", properties.statusPeriod().toString());
        try {
            ClusterMember member = agent.member(properties.name());
            info.put("member", member);
        } catch (MemberNotFoundException e) {
            info.put("member", null);
        }
        info.put("timestamp", clock.instant().toString());
        return info;
    }

    private static HttpStatus httpStatus(StatusType type) {
        return type == StatusType.RUNNING ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
    }
}
