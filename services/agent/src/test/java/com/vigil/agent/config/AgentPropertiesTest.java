package com.vigil.agent.config;

import com.vigil.agent.domain.AgentSettings;
import com.vigil.membership.ClusterMember;
import com.vigil.observability.TimeoutBudget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AgentProperties")
class AgentPropertiesTest {

    @Test
    @DisplayName("applies defaults for optional fields")
    void appliesDefaults() {
        AgentProperties props = minimal("node-1");

        assertThat(props.role()).isEqualTo(ClusterMember.ROLE_NODE);
        assertThat(props.peers()).isEmpty();
        assertThat(props.agentPort()).isEqualTo(AgentProperties.DEFAULT_AGENT_PORT);
        assertThat(props.statusPeriod()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.initTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.historySize()).isEqualTo(100);
        assertThat(props.gossip().mode()).isEqualTo(AgentProperties.GossipMode.JGROUPS);
        assertThat(props.gossip().clusterName()).isEqualTo("vigil");
        assertThat(props.gossip().config()).isNull();
        assertThat(props.gossip().bindAddress()).isNull();
        assertThat(props.gossip().bindPort()).isEqualTo(7800);
        assertThat(props.disk().enabled()).isTrue();
        assertThat(props.disk().path()).isEqualTo("/");
        assertThat(props.disk().minFreeRatio()).isEqualTo(0.1);
    }

    @Test
    @DisplayName("derives the timeout budget from the status period")
    void derivesBudget() {
        AgentProperties props = minimal("node-1");

        assertThat(props.timeoutBudget()).isEqualTo(TimeoutBudget.derive(Duration.ofSeconds(30)));
        assertThat(props.timeoutBudget().replyTimeout()).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    @DisplayName("derives the inner timeouts from an overridden reply timeout")
    void derivesInnerTimeoutsFromOverride() {
        AgentProperties props = new AgentProperties("node-1", null, null, null, 0, Duration.ofSeconds(30),
                Duration.ofSeconds(10), null, null, null, 0, null, null);

        TimeoutBudget budget = props.timeoutBudget();

        assertThat(budget.replyTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(budget.localTimeout()).isEqualTo(Duration.ofMillis(7500));
        assertThat(budget.probeTimeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("keeps explicit inner timeouts next to an overridden reply timeout")
    void appliesTimeoutOverrides() {
        AgentProperties props = new AgentProperties("node-1", null, null, null, 0, Duration.ofSeconds(30),
                Duration.ofSeconds(10), Duration.ofSeconds(8), Duration.ofSeconds(2), null, 0, null, null);

        TimeoutBudget budget = props.timeoutBudget();

        assertThat(budget).isEqualTo(new TimeoutBudget(Duration.ofSeconds(30), Duration.ofSeconds(10),
                Duration.ofSeconds(8), Duration.ofSeconds(2)));
    }

    @Test
    @DisplayName("rejects overrides that break the deadline nesting")
    void rejectsInconsistentOverrides() {
        AgentProperties props = new AgentProperties("node-1", null, null, null, 0, Duration.ofSeconds(30),
                Duration.ofSeconds(40), null, null, null, 0, null, null);

        assertThatThrownBy(props::timeoutBudget)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("replyTimeout");
    }

    @Test
    @DisplayName("announces role and agent port next to the extra tags")
    void announcesRoleAndPort() {
        AgentProperties props = new AgentProperties("master-1", "master", List.of("10.0.0.2:7800"),
                Map.of("zone", "eu-1"), 8080, null, null, null, null, null, 0, null, null);

        assertThat(props.announcedTags())
                .containsEntry(ClusterMember.TAG_ROLE, "master")
                .containsEntry(AgentProperties.TAG_AGENT_PORT, "8080")
                .containsEntry("zone", "eu-1");
    }

    @Test
    @DisplayName("converts to agent settings")
    void convertsToSettings() {
        AgentProperties props = new AgentProperties("node-1", null, List.of("10.0.0.1:7800"), null, 0,
                Duration.ofSeconds(3), null, null, null, Duration.ofSeconds(5), 10, null, null);

        AgentSettings settings = props.toSettings();

        assertThat(settings.nodeName()).isEqualTo("node-1");
        assertThat(settings.peers()).containsExactly("10.0.0.1:7800");
        assertThat(settings.budget().statusPeriod()).isEqualTo(Duration.ofSeconds(3));
        assertThat(settings.initTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.historySize()).isEqualTo(10);
        assertThat(settings.tags()).containsEntry(ClusterMember.TAG_ROLE, ClusterMember.ROLE_NODE);
    }

    private static AgentProperties minimal(String name) {
        return new AgentProperties(name, null, null, null, 0, null, null, null, null, null, 0, null, null);
    }
}
