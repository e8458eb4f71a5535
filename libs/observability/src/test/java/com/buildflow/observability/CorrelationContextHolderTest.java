package com.buildflow.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(CorrelationContextHolder.currentCorrelationId()).isNull();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new CorrelationContext("corr-1", "acme_db", "user-1", "req-1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
            assertThat(CorrelationContextHolder.currentCorrelationId()).isEqualTo("corr-1");
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("update should be a no-op without a context")
        void updateWithoutContext() {
            CorrelationContextHolder.update(ctx -> ctx.withPrincipal("u", "db"));

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "acme_db", "user-1", "req-1"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("agencyDatabase")).isEqualTo("acme_db");
            assertThat(MDC.get("userId")).isEqualTo("user-1");
            assertThat(MDC.get("requestId")).isEqualTo("req-1");
        }

        @Test
        @DisplayName("update should add the principal to the MDC")
        void updateAddsPrincipal() {
            CorrelationContextHolder.set(CorrelationContext.anonymous("corr-1", "req-1"));
            assertThat(MDC.get("userId")).isNull();

            CorrelationContextHolder.update(ctx -> ctx.withPrincipal("user-9", "acme_db"));

            assertThat(MDC.get("userId")).isEqualTo("user-9");
            assertThat(MDC.get("agencyDatabase")).isEqualTo("acme_db");
        }

        @Test
        @DisplayName("should clear MDC keys when context is cleared")
        void shouldClearMdcOnClear() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "acme_db", "user-1", "req-1"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("agencyDatabase")).isNull();
            assertThat(MDC.get("userId")).isNull();
            assertThat(MDC.get("requestId")).isNull();
        }
    }

    @Nested
    @DisplayName("runWithContext")
    class RunWithContext {

        @Test
        @DisplayName("should restore the outer context afterwards")
        void shouldRestoreOuter() {
            var outer = CorrelationContext.anonymous("outer", null);
            var inner = CorrelationContext.anonymous("inner", null);
            CorrelationContextHolder.set(outer);

            AtomicReference<String> seen = new AtomicReference<>();
            CorrelationContextHolder.runWithContext(inner,
                    () -> seen.set(CorrelationContextHolder.currentCorrelationId()));

            assertThat(seen.get()).isEqualTo("inner");
            assertThat(CorrelationContextHolder.currentCorrelationId()).isEqualTo("outer");
        }

        @Test
        @DisplayName("should restore context even if the runnable throws")
        void shouldRestoreOnException() {
            CorrelationContextHolder.set(CorrelationContext.anonymous("outer", null));

            assertThatThrownBy(() -> CorrelationContextHolder.runWithContext(
                    CorrelationContext.anonymous("inner", null),
                    () -> {
                        throw new IllegalStateException("boom");
                    }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(CorrelationContextHolder.currentCorrelationId()).isEqualTo("outer");
        }
    }

    @Test
    @DisplayName("should not leak context across threads")
    void shouldNotLeakAcrossThreads() throws InterruptedException {
        CorrelationContextHolder.set(CorrelationContext.anonymous("main", null));

        AtomicReference<Boolean> otherThreadHasContext = new AtomicReference<>();
        Thread other = new Thread(() -> otherThreadHasContext.set(CorrelationContextHolder.get().isPresent()));
        other.start();
        other.join();

        assertThat(otherThreadHasContext.get()).isFalse();
    }
}
