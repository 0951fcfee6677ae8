package com.vigil.status;

import static org.assertj.core.api.Assertions.assertThat;

import com.vigil.membership.ClusterMember;
import com.vigil.membership.MemberStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ClusterStatusAggregator}: aggregation rules, summary priority and the
 * properties the status pipeline relies on (purity, monotonic degradation).
 */
@DisplayName("ClusterStatusAggregator")
class ClusterStatusAggregatorTest {

    private static final ClusterMember MASTER =
            ClusterMember.alive("master-1", "10.0.0.1", 7946, ClusterMember.ROLE_MASTER);
    private static final ClusterMember NODE_1 =
            ClusterMember.alive("node-1", "10.0.0.2", 7946, ClusterMember.ROLE_NODE);
    private static final ClusterMember NODE_2 =
            ClusterMember.alive("node-2", "10.0.0.3", 7946, ClusterMember.ROLE_NODE);

    private final ClusterStatusAggregator aggregator = new ClusterStatusAggregator();

    private static NodeStatus running(ClusterMember member) {
        return NodeStatus.fromProbes(member, List.of(ProbeResult.passed(member.name(), "disk")));
    }

    private static NodeStatus degraded(ClusterMember member) {
        return NodeStatus.fromProbes(member, List.of(
                ProbeResult.passed(member.name(), "disk"),
                ProbeResult.failed(member.name(), "kubelet", "unhealthy")));
    }

    @Nested
    @DisplayName("healthy cluster")
    class Healthy {

        @Test
        @DisplayName("should report Running when every node runs and a master is present")
        void shouldReportRunning() {
            SystemStatus status = aggregator.aggregate(
                    running(MASTER), List.of(running(NODE_1), running(NODE_2)),
                    List.of(MASTER, NODE_1, NODE_2));

            assertThat(status.statusType()).isEqualTo(StatusType.RUNNING);
            assertThat(status.summary()).isEmpty();
            assertThat(status.nodes()).hasSize(3);
        }

        @Test
        @DisplayName("should stamp the aggregation time")
        void shouldStampTimestamp() {
            Instant at = Instant.parse("2026-01-01T00:00:00.123456789Z");

            SystemStatus status = aggregator.aggregate(running(MASTER), List.of(), List.of(MASTER), at);

            assertThat(status.timestamp()).isEqualTo(at);
        }
    }

    @Nested
    @DisplayName("degradation rules")
    class Degradation {

        @Test
        @DisplayName("should detect members that sent no status")
        void shouldDetectMissingMembers() {
            SystemStatus status = aggregator.aggregate(
                    running(MASTER), List.of(running(NODE_1)), List.of(MASTER, NODE_1, NODE_2));

            assertThat(status.statusType()).isEqualTo(StatusType.DEGRADED);
            assertThat(status.summary()).isEqualTo("no status received from nodes (node-2,)");
        }

        @Test
        @DisplayName("should list several missing members in name order")
        void shouldListMissingInOrder() {
            var node3 = ClusterMember.alive("node-3", "10.0.0.4", 7946, ClusterMember.ROLE_NODE);

            SystemStatus status = aggregator.aggregate(
                    running(MASTER), List.of(), List.of(node3, MASTER, NODE_2));

            assertThat(status.summary()).isEqualTo("no status received from nodes (node-2,node-3,)");
        }

        @Test
        @DisplayName("should report master unavailable when no node is tagged master")
        void shouldRequireMaster() {
            var a = ClusterMember.alive("a", "10.0.0.1", 7946, ClusterMember.ROLE_NODE);
            var b = ClusterMember.alive("b", "10.0.0.2", 7946, ClusterMember.ROLE_NODE);
            var c = ClusterMember.alive("c", "10.0.0.3", 7946, ClusterMember.ROLE_NODE);

            SystemStatus status = aggregator.aggregate(
                    running(a), List.of(running(b), running(c)), List.of(a, b, c));

            assertThat(status.statusType()).isEqualTo(StatusType.DEGRADED);
            assertThat(status.summary()).isEqualTo("master node unavailable");
        }

        @Test
        @DisplayName("should prefer master unavailable over missing nodes in the summary")
        void shouldPrioritizeMasterOverMissing() {
            SystemStatus status = aggregator.aggregate(
                    running(NODE_1), List.of(), List.of(MASTER, NODE_1));

            assertThat(status.statusType()).isEqualTo(StatusType.DEGRADED);
            assertThat(status.summary()).isEqualTo("master node unavailable");
        }

        @Test
        @DisplayName("should degrade on a degraded node")
        void shouldDegradeOnDegradedNode() {
            SystemStatus status = aggregator.aggregate(
                    running(MASTER), List.of(degraded(NODE_1)), List.of(MASTER, NODE_1));

            assertThat(status.statusType()).isEqualTo(StatusType.DEGRADED);
            assertThat(status.summary()).isEqualTo("degraded nodes (node-1,)");
        }

        @Test
        @DisplayName("should treat an unknown node as a failure, not as an unknown cluster")
        void shouldTreatUnknownAsDegraded() {
            SystemStatus status = aggregator.aggregate(
                    running(MASTER), List.of(NodeStatus.unknown(NODE_1)), List.of(MASTER, NODE_1));

            assertThat(status.statusType()).isEqualTo(StatusType.DEGRADED);
            assertThat(status.node("node-1")).get()
                    .extracting(NodeStatus::statusType)
                    .isEqualTo(StatusType.UNKNOWN);
        }

        @Test
        @DisplayName("should degrade on a member reported as failed")
        void shouldDegradeOnFailedMember() {
            NodeStatus failedNode = running(NODE_1.withStatus(MemberStatus.FAILED));

            SystemStatus status = aggregator.aggregate(
                    running(MASTER), List.of(failedNode), List.of(MASTER, NODE_1));

            assertThat(status.statusType()).isEqualTo(StatusType.DEGRADED);
            assertThat(status.summary()).isEqualTo("failed members (node-1,)");
        }

        @Test
        @DisplayName("should prefer missing nodes over degraded nodes in the summary")
        void shouldPrioritizeMissingOverDegraded() {
            SystemStatus status = aggregator.aggregate(
                    running(MASTER), List.of(degraded(NODE_1)), List.of(MASTER, NODE_1, NODE_2));

            assertThat(status.summary()).isEqualTo("no status received from nodes (node-2,)");
        }
    }

    @Nested
    @DisplayName("edge cases")
    class EdgeCases {

        @Test
        @DisplayName("should report Unknown with no nodes when nothing was collected")
        void shouldReportUnknownWhenEmpty() {
            SystemStatus status = aggregator.aggregate(null, List.of(), List.of());

            assertThat(status.statusType()).isEqualTo(StatusType.UNKNOWN);
            assertThat(status.nodes()).isEmpty();
        }

        @Test
        @DisplayName("should explain an empty result with the members that did not answer")
        void shouldExplainEmptyResult() {
            SystemStatus status = aggregator.aggregate(null, List.of(), List.of(MASTER));

            assertThat(status.statusType()).isEqualTo(StatusType.UNKNOWN);
            assertThat(status.summary()).isEqualTo("no status received from nodes (master-1,)");
        }

        @Test
        @DisplayName("should keep the local status when a remote reports the same name")
        void shouldKeepFirstStatusPerName() {
            SystemStatus status = aggregator.aggregate(
                    running(MASTER), List.of(degraded(MASTER)), List.of(MASTER));

            assertThat(status.statusType()).isEqualTo(StatusType.RUNNING);
            assertThat(status.nodes()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("properties")
    class Properties {

        @Test
        @DisplayName("should return identical results for identical inputs")
        void shouldBeIdempotent() {
            NodeStatus local = running(MASTER);
            List<NodeStatus> remotes = List.of(degraded(NODE_1));
            List<ClusterMember> members = List.of(MASTER, NODE_1, NODE_2);

            SystemStatus first = aggregator.aggregate(local, remotes, members);
            SystemStatus second = aggregator.aggregate(local, remotes, members);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("should never move towards Running when a failed probe is added")
        void shouldDegradeMonotonically() {
            List<ClusterMember> members = List.of(MASTER, NODE_1, NODE_2);
            List<NodeStatus> baseline = List.of(running(MASTER), running(NODE_1), running(NODE_2));

            for (int target = 0; target < baseline.size(); target++) {
                SystemStatus before = aggregator.aggregate(
                        baseline.get(0), baseline.subList(1, baseline.size()), members);

                List<NodeStatus> changed = new ArrayList<>(baseline);
                NodeStatus node = changed.get(target);
                List<ProbeResult> probes = new ArrayList<>(node.probes());
                probes.add(ProbeResult.failed(node.name(), "extra", "boom"));
                changed.set(target, NodeStatus.fromProbes(node.member(), probes));

                SystemStatus after = aggregator.aggregate(
                        changed.get(0), changed.subList(1, changed.size()), members);

                assertThat(before.statusType()).isEqualTo(StatusType.RUNNING);
                assertThat(after.statusType()).isEqualTo(StatusType.DEGRADED);
            }
        }
    }
}
