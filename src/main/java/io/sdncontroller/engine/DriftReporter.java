package io.sdncontroller.engine;

import io.sdncontroller.exceptions.OutOfSyncException;
import io.sdncontroller.metrics.MetricsProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static io.sdncontroller.metrics.MetricsConstants.*;

/**
 * Reports divergence between local records and backend resources.
 * Divergence is logged and counted; only orphan switches under strict
 * consistency are raised as errors.
 */
@Slf4j
public class DriftReporter {

    static final String RESOURCE_NETWORK = "network";
    static final String RESOURCE_PORT = "port";

    private final MetricsProvider metricsProvider;
    private final boolean strictConsistency;

    public DriftReporter(MetricsProvider metricsProvider, boolean strictConsistency) {
        this.metricsProvider = metricsProvider;
        this.strictConsistency = strictConsistency;
    }

    /**
     * Backend switches with no local network.
     *
     * @throws OutOfSyncException when strict consistency is enabled and the count is non-zero
     */
    public void orphanSwitches(int count) throws OutOfSyncException {
        if (count == 0) {
            return;
        }
        metricsProvider.counter(BACKEND_ORPHAN_SWITCHES_METRIC_NAME, Map.of()).increment(count);
        if (strictConsistency) {
            log.error("Found {} logical switches not bound to local networks", count);
            throw new OutOfSyncException("logical switches", count);
        }
        log.warn("Found {} logical switches not bound to local networks. "
                + "Local records and backend are potentially out of sync", count);
    }

    /**
     * Backend ports with no local port.
     */
    public void orphanPorts(int count) {
        if (count == 0) {
            return;
        }
        metricsProvider.counter(BACKEND_ORPHAN_PORTS_METRIC_NAME, Map.of()).increment(count);
        log.warn("Found {} logical ports not bound to local ports. "
                + "Local records and backend are potentially out of sync", count);
    }

    public void missingOnBackend(String resourceType, String id) {
        metricsProvider.counter(LOCAL_RECORDS_MISSING_ON_BACKEND_METRIC_NAME,
                Map.of(RESOURCE_TAG, resourceType)).increment();
        log.debug("Local {} {} was not found on the backend", resourceType, id);
    }
}
