package com.vigil.agent.infrastructure.peer;

import com.vigil.agent.config.AgentProperties;
import com.vigil.agent.domain.PeerStatusClient;
import com.vigil.agent.domain.PeerStatusException;
import com.vigil.membership.ClusterMember;
import com.vigil.observability.CycleContextHolder;
import com.vigil.status.NodeStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;

/**
 * Fetches the local status of a peer from its agent API ({@code GET /api/v1/status/local}).
 * <p>
 * The peer's API port is read from its {@value AgentProperties#TAG_AGENT_PORT} gossip tag. A peer
 * answers 503 when it is degraded; the body is still its status and is returned as such.
 */
public final class HttpPeerStatusClient implements PeerStatusClient {

    /** Header carrying the ID of the collection cycle that issued the request. */
    public static final String CYCLE_ID_HEADER = "X-Vigil-Cycle-ID";

    static final String LOCAL_STATUS_PATH = "/api/v1/status/local";

    private final RestClient restClient;
    private final int defaultPort;

    public HttpPeerStatusClient(RestClient restClient, int defaultPort) {
        if (restClient == null) {
            throw new IllegalArgumentException("restClient must not be null");
        }
        this.restClient = restClient;
        this.defaultPort = defaultPort;
    }

    /**
     * Creates a client whose connect and read timeouts are both {@code timeout}.
     */
    public static HttpPeerStatusClient create(RestClient.Builder builder, Duration timeout, int defaultPort) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        return new HttpPeerStatusClient(builder.requestFactory(requestFactory).build(), defaultPort);
    }

    @Override
    public NodeStatus localStatus(ClusterMember member) {
        String url = statusUrl(member);
        try {
            NodeStatus status = restClient.get()
                    .uri(url)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(headers -> CycleContextHolder.get()
                            .ifPresent(context -> headers.set(CYCLE_ID_HEADER, context.cycleId())))
                    .retrieve()
                    .onStatus(code -> code.value() == HttpStatus.SERVICE_UNAVAILABLE.value(),
                            (request, response) -> { })
                    .body(NodeStatus.class);
            if (status == null) {
                throw new PeerStatusException(member.name(), "empty response from " + url, null);
            }
            return status;
        } catch (RestClientException e) {
            throw new PeerStatusException(member.name(), "status request to " + url + " failed: " + e.getMessage(), e);
        }
    }

    String statusUrl(ClusterMember member) {
        if (member.address() == null || member.address().isBlank()) {
            throw new PeerStatusException(member.name(), "member has no address", null);
        }
        return "http://" + member.address() + ":" + agentPort(member) + LOCAL_STATUS_PATH;
    }

    private int agentPort(ClusterMember member) {
        String tag = member.tags().get(AgentProperties.TAG_AGENT_PORT);
        if (tag == null) {
            return defaultPort;
        }
        try {
            return Integer.parseInt(tag.trim());
        } catch (NumberFormatException e) {
            throw new PeerStatusException(member.name(), "invalid " + AgentProperties.TAG_AGENT_PORT + " tag: " + tag, e);
        }
    }
}
