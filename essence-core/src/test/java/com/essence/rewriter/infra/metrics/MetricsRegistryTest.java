package com.essence.rewriter.infra.metrics;

import com.essence.rewriter.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class MetricsRegistryTest {

    @Test
    @DisplayName("Should discover the registered in-memory registry once")
    void shouldDiscoverRegistry() {
        MetricsRegistry registry = MetricsRegistry.getInstance();

        assertThat(registry).isInstanceOf(InMemoryMetricsRegistry.class);
        assertThat(MetricsRegistry.getInstance()).isSameAs(registry);
    }

    @Test
    @DisplayName("No-op registry should accept every call")
    void noOpShouldIgnoreEverything() {
        MetricsRegistry registry = MetricsRegistry.noop();

        assertThatCode(() -> {
            registry.increment(RewriterMetric.STEPS);
            registry.increment(RewriterMetric.RULE_APPLICATIONS, "partial_evaluator");
            registry.record(RewriterMetric.RUN_DURATION, Duration.ofMillis(5));
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should build series keys from the metric's tag keys")
    void shouldBuildSeriesKeys() {
        assertThat(RewriterMetric.STEPS.seriesKey()).isEqualTo("rewriter_steps_total");
        assertThat(RewriterMetric.RULE_APPLICATIONS.seriesKey("partial_evaluator"))
                .isEqualTo("rewriter_rule_applications_total{rule=partial_evaluator}");
        assertThat(RewriterMetric.SKIPPED_SUBTREES.tagKeys()).containsExactly("rule");
    }
}
