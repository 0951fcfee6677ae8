package com.vigil.observability;

import com.vigil.observability.testing.InMemoryChecker;
import com.vigil.status.ProbeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CheckerRegistry")
class CheckerRegistryTest {

    private CheckerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CheckerRegistry();
    }

    @Test
    @DisplayName("should keep checkers in registration order")
    void shouldKeepRegistrationOrder() {
        registry.register(new InMemoryChecker("raft"))
                .register(new InMemoryChecker("disk"))
                .register(new InMemoryChecker("api"));

        assertThat(registry.checkers()).extracting(Checker::name).containsExactly("raft", "disk", "api");
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("should replace a checker registered under the same name")
    void shouldReplaceSameName() {
        InMemoryChecker first = new InMemoryChecker("disk");
        InMemoryChecker second = new InMemoryChecker("disk");

        registry.register(first).register(second);

        assertThat(registry.checkers()).containsExactly(second);
    }

    @Test
    @DisplayName("should deregister by name")
    void shouldDeregister() {
        registry.register(new InMemoryChecker("disk"));

        assertThat(registry.deregister("disk")).isTrue();
        assertThat(registry.deregister("disk")).isFalse();
        assertThat(registry.size()).isZero();
    }

    @Test
    @DisplayName("should return a snapshot unaffected by later registrations")
    void shouldReturnSnapshot() {
        registry.register(new InMemoryChecker("disk"));
        var snapshot = registry.checkers();

        registry.register(new InMemoryChecker("raft"));

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(new InMemoryChecker("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should reject null checker and blank name")
    void shouldRejectInvalid() {
        assertThatThrownBy(() -> registry.register(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(new Checker() {
            @Override
            public String name() {
                return " ";
            }

            @Override
            public ProbeResult run(String node, Duration budget) {
                return ProbeResult.passed(node, "x");
            }
        })).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("checker name");
    }
}
