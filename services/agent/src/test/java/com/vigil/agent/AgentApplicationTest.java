package com.vigil.agent;

import com.vigil.agent.config.AgentProperties;
import com.vigil.agent.domain.ClusterAgent;
import com.vigil.agent.infrastructure.peer.HttpPeerStatusClient;
import com.vigil.database.TimelineStore;
import com.vigil.eventmodel.EventSerializer;
import com.vigil.eventmodel.TimelineEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs the agent standalone (single master node, in-memory membership and timeline).
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Agent application")
class AgentApplicationTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ClusterAgent agent;
    @Autowired private AgentProperties properties;
    @Autowired private TimelineStore timelineStore;

    @BeforeEach
    void collect() {
        agent.collectOnce();
    }

    @Test
    @DisplayName("binds agent properties from the test profile")
    void bindsProperties() {
        assertThat(properties.name()).isEqualTo("agent-test");
        assertThat(properties.role()).isEqualTo("master");
        assertThat(properties.gossip().mode()).isEqualTo(AgentProperties.GossipMode.STANDALONE);
        assertThat(timelineStore.retention()).isPositive();
    }

    @Test
    @DisplayName("serves a running cluster status")
    void servesClusterStatus() throws Exception {
        mockMvc.perform(get("/api/v1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.statusType").value("RUNNING"))
                .andExpect(jsonPath("$.nodes[0].name").value("agent-test"));
    }

    @Test
    @DisplayName("serves the local node status")
    void servesLocalStatus() throws Exception {
        mockMvc.perform(get("/api/v1/status/local"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("agent-test"))
                .andExpect(jsonPath("$.statusType").value("RUNNING"));
    }

    @Test
    @DisplayName("serves the status history")
    void servesHistory() throws Exception {
        mockMvc.perform(get("/api/v1/status/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].statusType").value("RUNNING"));
    }

    @Test
    @DisplayName("lists the local member with its announced tags")
    void listsMembers() throws Exception {
        mockMvc.perform(get("/api/v1/members"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("agent-test"))
                .andExpect(jsonPath("$[0].tags.role").value("master"));
    }

    @Test
    @DisplayName("answers 404 for an unknown member")
    void unknownMember() throws Exception {
        mockMvc.perform(get("/api/v1/members/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Member Not Found"));
    }

    @Test
    @DisplayName("reports when the local member was last seen")
    void lastSeen() throws Exception {
        mockMvc.perform(get("/api/v1/members/agent-test/last-seen"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lastSeen").isNotEmpty());
    }

    @Test
    @DisplayName("rejects a join request without peers")
    void rejectsEmptyJoin() throws Exception {
        mockMvc.perform(post("/api/v1/members/join")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"peers\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Error"));
    }

    @Test
    @DisplayName("queries the timeline")
    void queriesTimeline() throws Exception {
        mockMvc.perform(get("/api/v1/timeline").param("type", "NodeAdded"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    @DisplayName("rejects unknown timeline filters")
    void rejectsUnknownTimelineFilter() throws Exception {
        mockMvc.perform(get("/api/v1/timeline").param("color", "red"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("unknown filter: color"));
    }

    @Test
    @DisplayName("stores an event reported by a peer once and records when the peer was seen")
    void storesReportedEvent() throws Exception {
        Instant reportedAt = Instant.parse("2026-04-01T08:00:00Z");
        String body = "{\"name\":\"node-7\",\"event\":"
                + EventSerializer.serialize(new TimelineEvent.ProbeFailed(reportedAt, "node-7", "disk", "full"))
                + "}";

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/api/v1/timeline")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isNoContent());
        }

        mockMvc.perform(get("/api/v1/timeline").param("node", "node-7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].type").value("ProbeFailed"))
                .andExpect(jsonPath("$[0].probe").value("disk"));
        mockMvc.perform(get("/api/v1/members/node-7/last-seen"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lastSeen").value("2026-04-01T08:00:00Z"));
    }

    @Test
    @DisplayName("rejects a reported event missing its node")
    void rejectsInvalidReportedEvent() throws Exception {
        mockMvc.perform(post("/api/v1/timeline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"node-8\",\"event\":"
                                + "{\"type\":\"NodeAdded\",\"timestamp\":\"2026-04-01T08:00:00Z\"}}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/members/node-8/last-seen"))
                .andExpect(jsonPath("$.lastSeen").doesNotExist());
    }

    @Test
    @DisplayName("rejects a reported event of an unknown kind")
    void rejectsUnknownReportedEvent() throws Exception {
        mockMvc.perform(post("/api/v1/timeline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"node-8\",\"event\":{\"type\":\"Exploded\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("malformed request body"));
    }

    @Test
    @DisplayName("serves agent info with the cycle ID header")
    void servesInfo() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("agent-test"))
                .andExpect(jsonPath("$.member.name").value("agent-test"))
                .andExpect(header().exists(HttpPeerStatusClient.CYCLE_ID_HEADER));
    }

    @Test
    @DisplayName("exposes cluster health through actuator")
    void exposesHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.cluster.status").value("UP"));
    }
}
