package io.sdncontroller.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Meters of the reconciliation engine: drift between local records and the SDN
 * controllers (orphan switches and ports, records missing on the backend),
 * backend failures per cluster and operation, switch fragments created, and the
 * number of configured clusters.
 * <p>
 * Every meter is tagged with the controller id as {@code hostname}, so several
 * controllers can report into one registry. Gauge holders are kept here: the
 * registry only holds them weakly, and asking twice for the same gauge returns
 * the holder that is actually registered.
 */
@Slf4j
public class MetricsProvider {
    private static final String HOST_NAME_TAG = "hostname";

    private final MeterRegistry registry;
    private final String controllerId;
    private final Map<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

    public MetricsProvider(MeterRegistry registry, String controllerId) {
        this.registry = registry;
        this.controllerId = controllerId;
        log.info("Reporting reconciliation metrics as controller {}", controllerId);
    }

    /**
     * Counter for a drift or failure event. Counters with the same name and tags are shared.
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(withControllerTag(tags)).register(registry);
    }

    /**
     * Holder backing the gauge with the given name and tags, registered on first use.
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        String key = name + new TreeMap<>(tags);
        return gauges.computeIfAbsent(key, k -> {
            AtomicDouble holder = new AtomicDouble(0);
            Gauge.builder(name, holder::get).tags(withControllerTag(tags)).register(registry);
            return holder;
        });
    }

    private String[] withControllerTag(Map<String, String> tags) {
        String[] keyValues = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            keyValues[index++] = entry.getKey();
            keyValues[index++] = entry.getValue();
        }
        keyValues[index++] = HOST_NAME_TAG;
        keyValues[index] = controllerId;
        return keyValues;
    }
}
