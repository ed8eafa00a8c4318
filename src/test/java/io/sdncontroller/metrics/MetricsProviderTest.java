package io.sdncontroller.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.sdncontroller.metrics.MetricsConstants.*;
import static org.assertj.core.api.Assertions.*;

class MetricsProviderTest {

    private static final String TEST_CONTROLLER_ID = "test-controller-01";

    @Test
    void testCounterCarriesHostnameAndTags() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MetricsProvider provider = new MetricsProvider(registry, TEST_CONTROLLER_ID);

        Counter counter = provider.counter(BACKEND_FAILURES_METRIC_NAME,
                Map.of(CLUSTER_TAG, "c1", OPERATION_TAG, "create_port"));
        counter.increment();

        assertThat(counter.getId().getName()).isEqualTo(BACKEND_FAILURES_METRIC_NAME);
        assertThat(counter.getId().getTag("hostname")).isEqualTo(TEST_CONTROLLER_ID);
        assertThat(counter.getId().getTag(CLUSTER_TAG)).isEqualTo("c1");
        assertThat(counter.getId().getTag(OPERATION_TAG)).isEqualTo("create_port");
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void testCounterWithSameTagsIsShared() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MetricsProvider provider = new MetricsProvider(registry, TEST_CONTROLLER_ID);

        provider.counter(BACKEND_ORPHAN_PORTS_METRIC_NAME, Map.of()).increment(2);
        provider.counter(BACKEND_ORPHAN_PORTS_METRIC_NAME, Map.of()).increment(3);

        assertThat(registry.get(BACKEND_ORPHAN_PORTS_METRIC_NAME).counter().count()).isEqualTo(5.0);
    }

    @Test
    void testGaugeReadsHolderValue() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MetricsProvider provider = new MetricsProvider(registry, TEST_CONTROLLER_ID);

        AtomicDouble gaugeValue = provider.gauge(CONFIGURED_CLUSTERS_METRIC_NAME, Map.of());
        Gauge gauge = registry.find(CONFIGURED_CLUSTERS_METRIC_NAME).gauge();

        assertThat(gauge).isNotNull();
        assertThat(gauge.value()).isEqualTo(0.0);
        gaugeValue.set(3);
        assertThat(gauge.value()).isEqualTo(3.0);
        assertThat(gauge.getId().getTag("hostname")).isEqualTo(TEST_CONTROLLER_ID);
    }

    @Test
    void testSameGaugeReturnsRegisteredHolder() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MetricsProvider provider = new MetricsProvider(registry, TEST_CONTROLLER_ID);

        AtomicDouble first = provider.gauge(CONFIGURED_CLUSTERS_METRIC_NAME, Map.of());
        provider.gauge(CONFIGURED_CLUSTERS_METRIC_NAME, Map.of()).set(4);

        assertThat(provider.gauge(CONFIGURED_CLUSTERS_METRIC_NAME, Map.of())).isSameAs(first);
        assertThat(registry.get(CONFIGURED_CLUSTERS_METRIC_NAME).gauge().value()).isEqualTo(4.0);
    }
}
