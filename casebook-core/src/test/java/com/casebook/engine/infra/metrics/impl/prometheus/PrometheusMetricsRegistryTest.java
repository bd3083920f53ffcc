package com.casebook.engine.infra.metrics.impl.prometheus;

import com.casebook.engine.infra.metrics.Counter;
import com.casebook.engine.infra.metrics.Gauge;
import com.casebook.engine.infra.metrics.MetricNames;
import com.casebook.engine.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrometheusMetricsRegistryTest {

    private CollectorRegistry collectors;
    private PrometheusMetricsRegistry registry;

    @BeforeEach
    void setUp() {
        collectors = new CollectorRegistry();
        registry = new PrometheusMetricsRegistry(collectors);
    }

    @Test
    @DisplayName("Should expose counter increments to the collector registry")
    void shouldCountIncrements() {
        Counter counter = registry.counter(MetricNames.DISCOVERIES);

        counter.increment();
        counter.increment(4);

        assertThat(counter.count()).isEqualTo(5);
        assertThat(collectors.getSampleValue("casebook_discoveries_total")).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should keep tagged counters apart")
    void shouldSeparateTagValues() {
        registry.counter(MetricNames.VERDICTS, "correct", "true").increment();
        registry.counter(MetricNames.VERDICTS, "correct", "false").increment(2);

        assertThat(registry.counter(MetricNames.VERDICTS, "correct", "true").count()).isEqualTo(1);
        assertThat(registry.counter(MetricNames.VERDICTS, "correct", "false").count()).isEqualTo(2);
        assertThat(collectors.getSampleValue("casebook_verdicts_total",
                new String[]{"correct"}, new String[]{"false"})).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should return the same adapter for the same name and tags")
    void shouldReuseAdapters() {
        assertThat(registry.gauge(MetricNames.ACTIVE_SESSIONS))
                .isSameAs(registry.gauge(MetricNames.ACTIVE_SESSIONS));
    }

    @Test
    @DisplayName("Should report the last gauge value")
    void shouldSetGauge() {
        Gauge gauge = registry.gauge(MetricNames.ACTIVE_SESSIONS);

        gauge.set(3);
        gauge.set(7);

        assertThat(gauge.value()).isEqualTo(7.0);
        assertThat(collectors.getSampleValue("casebook_active_sessions")).isEqualTo(7.0);
    }

    @Test
    @DisplayName("Should count timer observations")
    void shouldRecordTimer() throws Exception {
        Timer timer = registry.timer(MetricNames.CASE_LOAD);

        timer.record(Duration.ofMillis(20));
        String result = timer.record(() -> "compiled");

        assertThat(result).isEqualTo("compiled");
        assertThat(timer.count()).isEqualTo(2);
        assertThat(collectors.getSampleValue("casebook_case_load_seconds_count")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should reject negative durations")
    void shouldRejectNegativeDuration() {
        Timer timer = registry.timer(MetricNames.CASE_LOAD);

        assertThatThrownBy(() -> timer.record(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject tags that are not name/value pairs")
    void shouldRejectOddTags() {
        assertThatThrownBy(() -> registry.counter("casebook_odd_total", "case"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name/value pairs");
    }

    @Test
    @DisplayName("Should sanitize metric names for Prometheus")
    void shouldSanitizeNames() {
        assertThat(PrometheusMetricsRegistry.sanitizeName("Casebook.Case-Load")).isEqualTo("casebook_case_load");
    }
}
