package io.sdncontroller.allocation;

import io.sdncontroller.backend.BackendException;
import io.sdncontroller.backend.BackendSwitch;
import io.sdncontroller.backend.SwitchBackend;
import io.sdncontroller.cluster.Cluster;
import io.sdncontroller.exceptions.CapacityExhaustedException;
import io.sdncontroller.exceptions.NetworkNotFoundException;
import io.sdncontroller.metrics.MetricsProvider;
import io.sdncontroller.models.Network;
import io.sdncontroller.models.NetworkBinding;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

import static io.sdncontroller.config.Constants.FRAGMENT_NAME_FORMAT;
import static io.sdncontroller.metrics.MetricsConstants.CLUSTER_TAG;
import static io.sdncontroller.metrics.MetricsConstants.SWITCH_FRAGMENTS_CREATED_METRIC_NAME;

/**
 * Picks the backend switch a new port of a network goes to.
 * <p>
 * The port counts read from the backend are not reserved, so two concurrent
 * allocations may both pick the last free slot of a switch.
 */
@Slf4j
public class SwitchAllocator {

    private final SwitchBackend switchBackend;
    private final MetricsProvider metricsProvider;

    public SwitchAllocator(SwitchBackend switchBackend, MetricsProvider metricsProvider) {
        this.switchBackend = switchBackend;
        this.metricsProvider = metricsProvider;
    }

    /**
     * Return a switch of the network with room for one more port.
     *
     * @param binding            provider binding of the network, null for plain overlay networks
     * @param maxPorts           port ceiling of a single switch
     * @param allowFragmentation whether a new switch may be created when all are full
     * @throws NetworkNotFoundException   if the backend reports no switch for the network
     * @throws CapacityExhaustedException if every switch is full and fragmentation is not allowed
     * @throws BackendException           if the backend cannot be queried or updated
     */
    public BackendSwitch select(Cluster cluster, Network network, NetworkBinding binding, int maxPorts,
                                boolean allowFragmentation)
            throws NetworkNotFoundException, CapacityExhaustedException, BackendException {
        List<BackendSwitch> switches = switchBackend.getSwitches(cluster, network.getId());
        if (switches.isEmpty()) {
            log.error("No logical switch found for network {} on cluster {}", network.getId(), cluster.getName());
            throw new NetworkNotFoundException(network.getId());
        }
        for (BackendSwitch candidate : switches) {
            if (candidate.getPortCount() < maxPorts) {
                log.debug("Selected switch {} ({} of {} ports used) for network {}",
                        candidate.getUuid(), candidate.getPortCount(), maxPorts, network.getId());
                return candidate;
            }
        }

        if (!allowFragmentation) {
            log.error("Maximum number of logical ports reached for network {} on cluster {}",
                    network.getId(), cluster.getName());
            throw new CapacityExhaustedException(network.getId());
        }

        BackendSwitch primary = switches.stream()
                .filter(s -> network.getId().equals(s.getUuid()))
                .findFirst()
                .orElseGet(() -> switches.get(0));
        switchBackend.markMultiSwitch(cluster, primary, network.getTenantId());

        String name = String.format(FRAGMENT_NAME_FORMAT, network.getName(), switches.size());
        BackendSwitch fragment = switchBackend.createSwitch(cluster, network.getTenantId(), name, binding,
                network.getId());
        metricsProvider.counter(SWITCH_FRAGMENTS_CREATED_METRIC_NAME, Map.of(CLUSTER_TAG, cluster.getName()))
                .increment();
        log.info("All {} switch(es) of network {} are full, created fragment {} ({})",
                switches.size(), network.getId(), fragment.getUuid(), name);
        return fragment;
    }
}
