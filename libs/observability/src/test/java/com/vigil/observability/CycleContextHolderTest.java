package com.vigil.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CycleContextHolder")
class CycleContextHolderTest {

    private static final CycleContext CONTEXT = new CycleContext("cycle-1", "node-1");

    @AfterEach
    void tearDown() {
        CycleContextHolder.clear();
    }

    @Nested
    @DisplayName("set / get / clear")
    class SetGetClear {

        @Test
        @DisplayName("should be empty by default")
        void shouldBeEmptyByDefault() {
            assertThat(CycleContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should populate MDC when set")
        void shouldPopulateMdc() {
            CycleContextHolder.set(CONTEXT);

            assertThat(CycleContextHolder.get()).contains(CONTEXT);
            assertThat(MDC.get(CycleContext.MDC_CYCLE_ID)).isEqualTo("cycle-1");
            assertThat(MDC.get(CycleContext.MDC_NODE)).isEqualTo("node-1");
        }

        @Test
        @DisplayName("should remove MDC keys when cleared")
        void shouldClearMdc() {
            CycleContextHolder.set(CONTEXT);
            CycleContextHolder.clear();

            assertThat(CycleContextHolder.get()).isEmpty();
            assertThat(MDC.get(CycleContext.MDC_CYCLE_ID)).isNull();
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNull() {
            assertThatThrownBy(() -> CycleContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("callWithContext")
    class CallWithContext {

        @Test
        @DisplayName("should install the context on another thread and clear it afterwards")
        void shouldTransferToPoolThread() {
            String[] seen = new String[2];

            CompletableFuture.runAsync(() -> {
                CycleContextHolder.runWithContext(CONTEXT,
                        () -> seen[0] = CycleContextHolder.get().map(CycleContext::cycleId).orElse(null));
                seen[1] = CycleContextHolder.get().map(CycleContext::cycleId).orElse("none");
            }).join();

            assertThat(seen[0]).isEqualTo("cycle-1");
            assertThat(seen[1]).isEqualTo("none");
        }

        @Test
        @DisplayName("should restore the previous context")
        void shouldRestorePrevious() {
            CycleContextHolder.set(CONTEXT);

            String inner = CycleContextHolder.callWithContext(new CycleContext("cycle-2", "node-1"),
                    () -> MDC.get(CycleContext.MDC_CYCLE_ID));

            assertThat(inner).isEqualTo("cycle-2");
            assertThat(CycleContextHolder.get()).contains(CONTEXT);
            assertThat(MDC.get(CycleContext.MDC_CYCLE_ID)).isEqualTo("cycle-1");
        }

        @Test
        @DisplayName("should run unchanged with a null context")
        void shouldRunWithoutContext() {
            assertThat(CycleContextHolder.callWithContext(null, () -> "ok")).isEqualTo("ok");
            assertThat(CycleContextHolder.get()).isEmpty();
        }
    }

    @Test
    @DisplayName("should generate distinct cycle IDs")
    void shouldGenerateDistinctIds() {
        assertThat(CycleContext.newCycle("node-1").cycleId())
                .isNotEqualTo(CycleContext.newCycle("node-1").cycleId());
    }
}
