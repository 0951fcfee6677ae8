package com.vigil.agent.api;

import com.vigil.agent.domain.ClusterAgent;
import com.vigil.membership.ClusterMember;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cluster membership as seen by this agent.
 */
@RestController
@RequestMapping("/api/v1/members")
public class MembershipController {

    private final ClusterAgent agent;

    public MembershipController(ClusterAgent agent) {
        this.agent = agent;
    }

    @GetMapping
    public List<ClusterMember> members() {
        return agent.members();
    }

    @GetMapping("/{name}")
    public ClusterMember member(@PathVariable String name) {
        return agent.member(name);
    }

    /** Returns when a status was last received from the member; {@code lastSeen} is null if never. */
    @GetMapping("/{name}/last-seen")
    public Map<String, Object> lastSeen(@PathVariable String name) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("lastSeen", agent.lastSeen(name).map(Object::toString).orElse(null));
        return body;
    }

    @PostMapping("/join")
    public Map<String, Object> join(@Valid @RequestBody JoinRequest request) {
        return Map.of("joined", agent.join(request.peers()));
    }

    /**
     * @param peers gossip endpoints ({@code host:port}) to join
     */
    public record JoinRequest(@NotEmpty List<String> peers) {
    }
}
