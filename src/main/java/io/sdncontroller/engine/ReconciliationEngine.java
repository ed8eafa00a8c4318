package io.sdncontroller.engine;

import io.sdncontroller.allocation.SwitchAllocator;
import io.sdncontroller.auth.PolicyEnforcer;
import io.sdncontroller.auth.RequestContext;
import io.sdncontroller.backend.BackendException;
import io.sdncontroller.backend.BackendPort;
import io.sdncontroller.backend.BackendResourceNotFoundException;
import io.sdncontroller.backend.BackendSwitch;
import io.sdncontroller.backend.PortQuery;
import io.sdncontroller.backend.SwitchBackend;
import io.sdncontroller.cluster.Cluster;
import io.sdncontroller.cluster.ClusterRegistry;
import io.sdncontroller.config.NetworkControllerConfig;
import io.sdncontroller.enums.ResourceStatus;
import io.sdncontroller.exceptions.BackendUnavailableException;
import io.sdncontroller.exceptions.CapacityExhaustedException;
import io.sdncontroller.exceptions.InvalidInputException;
import io.sdncontroller.exceptions.NetworkControllerException;
import io.sdncontroller.exceptions.NetworkNotFoundException;
import io.sdncontroller.exceptions.PortNotFoundException;
import io.sdncontroller.exceptions.UnsupportedFeatureException;
import io.sdncontroller.metrics.MetricsProvider;
import io.sdncontroller.models.Network;
import io.sdncontroller.models.NetworkBinding;
import io.sdncontroller.models.NetworkRequest;
import io.sdncontroller.models.Port;
import io.sdncontroller.models.PortRequest;
import io.sdncontroller.models.RecordFilter;
import io.sdncontroller.store.RecordStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static io.sdncontroller.config.Constants.*;
import static io.sdncontroller.metrics.MetricsConstants.*;

/**
 * Keeps local network and port records in step with the logical switches and
 * ports of the backend clusters.
 * <p>
 * Local mutations of one operation run in a single record store transaction.
 * Backend calls are not part of that transaction: networks are created on the
 * backend first (the switch uuid becomes the network id), ports are recorded
 * locally first (the local id is tagged onto the backend port). Divergence
 * left behind by partial failures is logged with the resource ids and cluster
 * and reported by the listing operations; it is never repaired here.
 */
@Slf4j
public class ReconciliationEngine {

    private final ClusterRegistry clusterRegistry;
    private final RecordStore recordStore;
    private final SwitchBackend switchBackend;
    private final SwitchAllocator switchAllocator;
    private final PolicyEnforcer policyEnforcer;
    private final ProviderBindingValidator bindingValidator;
    private final DriftReporter driftReporter;
    private final MetricsProvider metricsProvider;
    private final int maxPortsPerOverlaySwitch;
    private final int maxPortsPerBridgedSwitch;

    public ReconciliationEngine(ClusterRegistry clusterRegistry,
                                RecordStore recordStore,
                                SwitchBackend switchBackend,
                                SwitchAllocator switchAllocator,
                                PolicyEnforcer policyEnforcer,
                                DriftReporter driftReporter,
                                MetricsProvider metricsProvider,
                                NetworkControllerConfig config) {
        this.clusterRegistry = clusterRegistry;
        this.recordStore = recordStore;
        this.switchBackend = switchBackend;
        this.switchAllocator = switchAllocator;
        this.policyEnforcer = policyEnforcer;
        this.bindingValidator = new ProviderBindingValidator(recordStore);
        this.driftReporter = driftReporter;
        this.metricsProvider = metricsProvider;
        this.maxPortsPerOverlaySwitch = config.getMaxLpPerOverlayLs();
        this.maxPortsPerBridgedSwitch = config.getMaxLpPerBridgedLs();
        metricsProvider.gauge(CONFIGURED_CLUSTERS_METRIC_NAME, Map.of()).set(clusterRegistry.size());
    }

    // =================================================================
    // NETWORKS
    // =================================================================

    public Network createNetwork(RequestContext context, NetworkRequest request) throws NetworkControllerException {
        String tenantId = request.getTenantId() != null ? request.getTenantId() : context.getTenantId();
        Optional<NetworkBinding> binding = Optional.empty();
        if (request.hasProviderAttributes()) {
            policyEnforcer.enforce(context, ACTION_PROVIDER_NETWORK_SET, tenantId);
            binding = bindingValidator.validate(request);
        }
        if (Boolean.FALSE.equals(request.getAdminStateUp())) {
            log.warn("Networks with admin_state_up=False are not supported. Ignoring setting for network {}",
                    request.getName());
        }

        Cluster cluster = clusterRegistry.resolve(request.getZoneId());
        BackendSwitch created;
        try {
            created = switchBackend.createSwitch(cluster, tenantId, request.getName(), binding.orElse(null), null);
        } catch (BackendException e) {
            throw backendFailure(cluster, "create_network", "Unable to create logical switch for network "
                    + request.getName(), e);
        }

        String networkId = created.getUuid();
        Optional<NetworkBinding> networkBinding = binding;
        try {
            return recordStore.inTransaction(() -> {
                Network network = recordStore.createNetwork(Network.builder()
                        .id(networkId)
                        .tenantId(tenantId)
                        .name(request.getName())
                        .adminStateUp(true)
                        .shared(Boolean.TRUE.equals(request.getShared()))
                        .build());
                recordStore.setNetworkSecurity(networkId, !Boolean.FALSE.equals(request.getPortSecurityEnabled()));
                if (networkBinding.isPresent()) {
                    networkBinding.get().setNetworkId(networkId);
                    recordStore.addNetworkBinding(networkBinding.get());
                }
                network.setStatus(ResourceStatus.ACTIVE);
                log.info("Created network {} ({}) on cluster {}", networkId, request.getName(), cluster.getName());
                return extendNetwork(context, network);
            });
        } catch (NetworkControllerException | RuntimeException e) {
            log.error("Failed to record network {} after creating its switch on cluster {}; "
                    + "the switch is left on the backend", networkId, cluster.getName(), e);
            throw e;
        }
    }

    public Network updateNetwork(RequestContext context, String networkId, NetworkRequest update)
            throws NetworkControllerException {
        if (Boolean.FALSE.equals(update.getAdminStateUp())) {
            throw new UnsupportedFeatureException("admin_state_up=False networks are not supported.");
        }
        if (update.hasProviderAttributes()) {
            throw new UnsupportedFeatureException("Provider attributes of an existing network cannot be changed.");
        }
        return recordStore.inTransaction(() -> {
            Network network = recordStore.getNetwork(networkId);
            if (update.getName() != null) {
                network.setName(update.getName());
            }
            if (update.getShared() != null) {
                network.setShared(update.getShared());
            }
            Network updated = recordStore.updateNetwork(network);
            if (update.getPortSecurityEnabled() != null) {
                recordStore.setNetworkSecurity(networkId, update.getPortSecurityEnabled());
            }
            log.info("Updated network {}", networkId);
            return extendNetwork(context, updated);
        });
    }

    /**
     * Delete a network from the record store and then its switches on every cluster.
     *
     * @throws NetworkNotFoundException if no cluster has a switch for the network; nothing is deleted then
     */
    public void deleteNetwork(RequestContext context, String networkId) throws NetworkControllerException {
        Map<Cluster, List<String>> pairs = switchesByCluster(networkId, "delete_network");
        if (pairs.isEmpty()) {
            log.error("No logical switch found for network {} on any cluster", networkId);
            throw new NetworkNotFoundException(networkId);
        }
        log.debug("Returning pairs for network {}: {}", networkId, pairs);

        recordStore.inTransaction(() -> {
            recordStore.deleteNetwork(networkId);
            return null;
        });

        for (Map.Entry<Cluster, List<String>> pair : pairs.entrySet()) {
            try {
                switchBackend.deleteSwitches(pair.getKey(), pair.getValue());
            } catch (BackendException e) {
                countBackendFailure(pair.getKey(), "delete_network");
                log.warn("Failed to delete switches {} of deleted network {} on cluster {}; "
                        + "they are left on the backend", pair.getValue(), networkId, pair.getKey().getName(), e);
            }
        }
        log.info("Deleted network {} for tenant {}", networkId, context.getTenantId());
    }

    public Network getNetwork(RequestContext context, String networkId) throws NetworkControllerException {
        Network network = extendNetwork(context, recordStore.getNetwork(networkId));

        List<BackendSwitch> switches = List.of();
        for (Cluster cluster : clustersDefaultFirst()) {
            try {
                switches = switchBackend.getSwitches(cluster, networkId);
                break;
            } catch (BackendResourceNotFoundException e) {
                log.debug("Network {} has no switch on cluster {}", networkId, cluster.getName());
            } catch (BackendException e) {
                throw backendFailure(cluster, "get_network", "Unable to get logical switches of network "
                        + networkId, e);
            }
        }
        if (switches.isEmpty()) {
            driftReporter.missingOnBackend(DriftReporter.RESOURCE_NETWORK, networkId);
        }
        boolean allUp = !switches.isEmpty() && switches.stream().allMatch(BackendSwitch::isFabricUp);
        network.setStatus(ResourceStatus.fromFabricStatus(allUp));
        return network;
    }

    public Map<String, Object> getNetwork(RequestContext context, String networkId, List<String> fields)
            throws NetworkControllerException {
        return FieldSelector.select(getNetwork(context, networkId), fields);
    }

    /**
     * List local networks with name and status taken from their switches.
     * Switches that belong to no local network are reported as drift.
     */
    public List<Network> getNetworks(RequestContext context, RecordFilter filter) throws NetworkControllerException {
        List<Network> networks = new ArrayList<>();
        for (Network network : recordStore.listNetworks(filter)) {
            networks.add(extendNetwork(context, network));
        }

        List<String> tenantFilter;
        if (filter.has(FILTER_TENANT_ID)) {
            tenantFilter = filter.values(FILTER_TENANT_ID);
        } else if (context.isAdmin()) {
            tenantFilter = List.of();
        } else {
            tenantFilter = List.of(context.getTenantId());
        }

        List<BackendSwitch> switches = new ArrayList<>();
        for (Cluster cluster : clusterRegistry.getClusters()) {
            try {
                switches.addAll(switchBackend.querySwitches(cluster, tenantFilter));
            } catch (BackendException e) {
                throw backendFailure(cluster, "get_networks", "Unable to get logical switches", e);
            }
        }
        if (filter.has(FILTER_ID)) {
            switches.removeIf(s -> !filter.values(FILTER_ID).contains(s.getNetworkId()));
        }

        Map<String, BackendSwitch> primaries = new LinkedHashMap<>();
        Map<String, List<BackendSwitch>> byNetwork = new LinkedHashMap<>();
        for (BackendSwitch sw : switches) {
            byNetwork.computeIfAbsent(sw.getNetworkId(), id -> new ArrayList<>()).add(sw);
            if (sw.getUuid().equals(sw.getNetworkId())) {
                primaries.put(sw.getUuid(), sw);
            }
        }

        for (Network network : networks) {
            List<BackendSwitch> matched = byNetwork.remove(network.getId());
            BackendSwitch primary = primaries.get(network.getId());
            if (matched == null || primary == null) {
                log.debug("Network {} has no logical switch in the listing", network.getId());
                continue;
            }
            network.setName(primary.getDisplayName());
            network.setStatus(ResourceStatus.fromFabricStatus(matched.stream().allMatch(BackendSwitch::isFabricUp)));
        }

        // Switches of local networks left out by the filter are not drift
        int orphans = 0;
        for (Map.Entry<String, List<BackendSwitch>> unmatched : byNetwork.entrySet()) {
            if (recordStore.findNetwork(unmatched.getKey()).isEmpty()) {
                orphans += unmatched.getValue().size();
            }
        }
        driftReporter.orphanSwitches(orphans);

        log.debug("get_networks() completed for tenant {}: {} network(s)", context.getTenantId(), networks.size());
        return networks;
    }

    public List<Map<String, Object>> getNetworks(RequestContext context, RecordFilter filter, List<String> fields)
            throws NetworkControllerException {
        return getNetworks(context, filter).stream()
                .map(network -> FieldSelector.select(network, fields))
                .collect(Collectors.toList());
    }

    /**
     * Raw listing of the logical switches of a tenant on every cluster.
     */
    public List<BackendSwitch> getAllNetworks(String tenantId) throws NetworkControllerException {
        List<BackendSwitch> switches = new ArrayList<>();
        List<String> tenants = tenantId != null ? List.of(tenantId) : List.of();
        for (Cluster cluster : clusterRegistry.getClusters()) {
            try {
                switches.addAll(switchBackend.querySwitches(cluster, tenants));
            } catch (BackendException e) {
                throw backendFailure(cluster, "get_all_networks", "Unable to get logical switches", e);
            }
        }
        log.debug("get_all_networks() completed for tenant {}: {} switch(es)", tenantId, switches.size());
        return switches;
    }

    // =================================================================
    // PORTS
    // =================================================================

    /**
     * Record a port locally, then place it on a switch of its network with room for it and plug it.
     *
     * The backend calls run inside the record store transaction, which stays open until they return.
     *
     * @throws CapacityExhaustedException if every switch of the network is full and it may not be fragmented;
     *                                    no port record is left behind
     */
    public Port createPort(RequestContext context, PortRequest request) throws NetworkControllerException {
        Network network = recordStore.getNetwork(request.getNetworkId());
        if (request.getPortSecurityEnabled() != null) {
            policyEnforcer.enforce(context, ACTION_PORT_SECURITY_CREATE, network.getTenantId());
        }
        Cluster cluster = clusterRegistry.resolve(request.getZoneId());
        String tenantId = request.getTenantId() != null ? request.getTenantId() : context.getTenantId();

        return recordStore.inTransaction(() -> {
            Port port = recordStore.createPort(Port.builder()
                    .networkId(network.getId())
                    .tenantId(tenantId)
                    .name(request.getName())
                    .deviceId(request.getDeviceId())
                    .deviceOwner(request.getDeviceOwner())
                    .adminStateUp(!Boolean.FALSE.equals(request.getAdminStateUp()))
                    .macAddress(request.getMacAddress())
                    .fixedIps(request.getFixedIps() != null ? request.getFixedIps() : new ArrayList<>())
                    .clusterName(cluster.getName())
                    .build());

            boolean portSecurity = resolvePortSecurity(request, network, port);
            recordStore.setPortSecurity(port.getId(), portSecurity);
            port.setPortSecurityEnabled(portSecurity);

            Optional<NetworkBinding> binding = recordStore.getNetworkBinding(network.getId());
            boolean bridged = binding.map(b -> b.getBindingType() != null && b.getBindingType().isBridged())
                    .orElse(false);
            int maxPorts = bridged ? maxPortsPerBridgedSwitch : maxPortsPerOverlaySwitch;

            try {
                BackendSwitch target = switchAllocator.select(cluster, network, binding.orElse(null), maxPorts, bridged);
                BackendPort backendPort = switchBackend.createPort(cluster, target.getUuid(), port);
                switchBackend.plugInterface(cluster, target.getUuid(), backendPort.getUuid(), ATTACHMENT_VIF,
                        port.getId());
            } catch (CapacityExhaustedException e) {
                log.error("Number of available ports for network {} exhausted", network.getId());
                throw e;
            } catch (BackendException e) {
                throw backendFailure(cluster, "create_port",
                        "An exception occurred while plugging the interface for port " + port.getId(), e);
            }

            log.info("Created port {} on network {} (cluster {}) for tenant {}",
                    port.getId(), network.getId(), cluster.getName(), tenantId);
            return port;
        });
    }

    /**
     * Update the local record and push it to the backend port in one record store transaction,
     * searching every switch of the network for the backend port. A backend failure rolls the
     * record back. Status is refreshed afterwards, outside the transaction.
     */
    public Port updatePort(RequestContext context, String portId, PortRequest update)
            throws NetworkControllerException {
        if (update.getPortSecurityEnabled() != null) {
            Port current = recordStore.getPort(portId);
            String owner = recordStore.findNetwork(current.getNetworkId()).map(Network::getTenantId).orElse(null);
            policyEnforcer.enforce(context, ACTION_PORT_SECURITY_UPDATE, owner);
        }

        LocatedPort[] located = new LocatedPort[1];
        Port updated = recordStore.inTransaction(() -> {
            Port port = recordStore.getPort(portId);
            applyUpdate(port, update);
            Port stored = recordStore.updatePort(port);

            if (update.getPortSecurityEnabled() != null) {
                if (update.getPortSecurityEnabled() && stored.getFixedIps().isEmpty()) {
                    throw new InvalidInputException("Port security requires an IP address");
                }
                recordStore.setPortSecurity(portId, update.getPortSecurityEnabled());
                stored.setPortSecurityEnabled(update.getPortSecurityEnabled());
            } else {
                stored.setPortSecurityEnabled(recordStore.getPortSecurity(portId).orElse(false));
            }

            // Fragment switches hold ports too, so search every switch
            LocatedPort found = locatePort(stored, WILDCARD_SWITCH, "update_port")
                    .orElseThrow(() -> new PortNotFoundException(portId));
            try {
                switchBackend.updatePort(found.cluster, found.switchUuid(stored.getNetworkId()),
                        found.port.getUuid(), stored);
            } catch (BackendException e) {
                throw backendFailure(found.cluster, "update_port", "Unable to update logical port "
                        + found.port.getUuid() + " of port " + portId, e);
            }
            located[0] = found;
            return stored;
        });

        LocatedPort found = located[0];
        try {
            updated.setStatus(switchBackend.getPortStatus(found.cluster, found.switchUuid(updated.getNetworkId()),
                    found.port.getUuid()));
        } catch (BackendException e) {
            log.warn("Unable to retrieve port status for logical port {} on cluster {}: {}",
                    found.port.getUuid(), found.cluster.getName(), e.getMessage());
        }
        log.info("Updated port {}", portId);
        return updated;
    }

    /**
     * Delete the backend port, then the local record.
     *
     * @throws PortNotFoundException if no cluster has a port tagged with the id; the record is kept then
     */
    public void deletePort(RequestContext context, String portId) throws NetworkControllerException {
        Port port = recordStore.getPort(portId);
        LocatedPort found = locatePort(port, WILDCARD_SWITCH, "delete_port")
                .orElseThrow(() -> {
                    log.error("Port {} not found on any cluster", portId);
                    return new PortNotFoundException(portId);
                });
        try {
            switchBackend.deletePort(found.cluster, found.switchUuid(port.getNetworkId()), found.port.getUuid());
        } catch (BackendException e) {
            throw backendFailure(found.cluster, "delete_port", "Unable to delete logical port "
                    + found.port.getUuid() + " of port " + portId, e);
        }
        recordStore.inTransaction(() -> {
            recordStore.deletePort(portId);
            return null;
        });
        log.info("Deleted port {} for tenant {}", portId, context.getTenantId());
    }

    public Port getPort(RequestContext context, String portId) throws NetworkControllerException {
        Port port = recordStore.getPort(portId);
        port.setPortSecurityEnabled(recordStore.getPortSecurity(portId).orElse(false));
        Optional<LocatedPort> found = locatePort(port, WILDCARD_SWITCH, "get_port");
        if (found.isPresent()) {
            project(port, found.get().port);
        } else {
            driftReporter.missingOnBackend(DriftReporter.RESOURCE_PORT, portId);
        }
        log.debug("Port details for tenant {}: {}", context.getTenantId(), port);
        return port;
    }

    public Map<String, Object> getPort(RequestContext context, String portId, List<String> fields)
            throws NetworkControllerException {
        return FieldSelector.select(getPort(context, portId), fields);
    }

    /**
     * List local ports with admin state, name and status taken from the backend ports tagged
     * with their ids. Backend ports claimed by no local port are counted as drift. A network
     * filter scopes the backend query to the primary and fragment switches of those networks.
     */
    public List<Port> getPorts(RequestContext context, RecordFilter filter) throws NetworkControllerException {
        List<Port> ports = recordStore.listPorts(filter);
        for (Port port : ports) {
            port.setPortSecurityEnabled(recordStore.getPortSecurity(port.getId()).orElse(false));
        }

        PortQuery.PortQueryBuilder query = PortQuery.builder()
                .deviceIds(filter.values(FILTER_DEVICE_ID))
                .tenantIds(filter.values(FILTER_TENANT_ID));

        Map<String, BackendPort> backendPorts = new LinkedHashMap<>();
        List<String> networkIds = filter.values(FILTER_NETWORK_ID);
        if (networkIds.isEmpty()) {
            for (Cluster cluster : clusterRegistry.getClusters()) {
                collectPorts(cluster, query.switchUuid(WILDCARD_SWITCH).build(), backendPorts);
            }
        } else {
            for (String networkId : networkIds) {
                for (Map.Entry<Cluster, List<String>> entry : switchesByCluster(networkId, "get_ports").entrySet()) {
                    for (String switchUuid : entry.getValue()) {
                        collectPorts(entry.getKey(), query.switchUuid(switchUuid).build(), backendPorts);
                    }
                }
            }
        }

        for (Port port : ports) {
            BackendPort match = backendPorts.remove(port.getId());
            if (match != null) {
                project(port, match);
            } else {
                driftReporter.missingOnBackend(DriftReporter.RESOURCE_PORT, port.getId());
            }
        }
        driftReporter.orphanPorts(backendPorts.size());
        return ports;
    }

    public List<Map<String, Object>> getPorts(RequestContext context, RecordFilter filter, List<String> fields)
            throws NetworkControllerException {
        return getPorts(context, filter).stream()
                .map(port -> FieldSelector.select(port, fields))
                .collect(Collectors.toList());
    }

    // =================================================================
    // HELPERS
    // =================================================================

    private Network extendNetwork(RequestContext context, Network network) {
        if (policyEnforcer.check(context, ACTION_PROVIDER_NETWORK_VIEW, network.getTenantId())) {
            recordStore.getNetworkBinding(network.getId()).ifPresent(binding -> {
                network.setNetworkType(binding.getBindingType().getValue());
                network.setPhysicalNetwork(binding.getPhysicalNetwork());
                network.setSegmentationId(binding.getVlanId());
            });
        }
        network.setPortSecurityEnabled(recordStore.getNetworkSecurity(network.getId()).orElse(true));
        return network;
    }

    /**
     * Explicit request value, else the network's setting. Inherited port security is
     * turned off for ports without fixed IPs; an explicit request for it is rejected.
     */
    private boolean resolvePortSecurity(PortRequest request, Network network, Port port)
            throws InvalidInputException {
        boolean hasIp = !port.getFixedIps().isEmpty();
        if (request.getPortSecurityEnabled() != null) {
            if (request.getPortSecurityEnabled() && !hasIp) {
                throw new InvalidInputException("Port security requires an IP address");
            }
            return request.getPortSecurityEnabled();
        }
        return hasIp && recordStore.getNetworkSecurity(network.getId()).orElse(true);
    }

    private static void applyUpdate(Port port, PortRequest update) {
        if (update.getName() != null) {
            port.setName(update.getName());
        }
        if (update.getDeviceId() != null) {
            port.setDeviceId(update.getDeviceId());
        }
        if (update.getDeviceOwner() != null) {
            port.setDeviceOwner(update.getDeviceOwner());
        }
        if (update.getAdminStateUp() != null) {
            port.setAdminStateUp(update.getAdminStateUp());
        }
        if (update.getMacAddress() != null) {
            port.setMacAddress(update.getMacAddress());
        }
        if (update.getFixedIps() != null) {
            port.setFixedIps(new ArrayList<>(update.getFixedIps()));
        }
    }

    private static void project(Port port, BackendPort backendPort) {
        port.setAdminStateUp(backendPort.isAdminStatusEnabled());
        if (backendPort.getDisplayName() != null) {
            port.setName(backendPort.getDisplayName());
        }
        port.setStatus(ResourceStatus.fromFabricStatus(backendPort.isFabricStatusUp()));
    }

    /**
     * Find the backend port tagged with the port's id. The cluster recorded on the port is
     * tried first; records without one, or not found there, fall back to scanning every cluster.
     */
    private Optional<LocatedPort> locatePort(Port port, String switchScope, String operation)
            throws BackendUnavailableException {
        List<Cluster> candidates = new ArrayList<>();
        Optional<Cluster> owner = clusterRegistry.getCluster(port.getClusterName());
        owner.ifPresent(candidates::add);
        for (Cluster cluster : clusterRegistry.getClusters()) {
            if (!candidates.contains(cluster)) {
                candidates.add(cluster);
            }
        }

        for (Cluster cluster : candidates) {
            try {
                Optional<BackendPort> found = switchBackend.findPort(cluster, switchScope, port.getId());
                if (found.isPresent()) {
                    if (owner.isEmpty() || owner.get() != cluster) {
                        log.debug("Port {} found by scanning on cluster {}", port.getId(), cluster.getName());
                    }
                    return Optional.of(new LocatedPort(cluster, found.get()));
                }
            } catch (BackendException e) {
                throw backendFailure(cluster, operation, "Unable to look up logical port of port " + port.getId(), e);
            }
        }
        return Optional.empty();
    }

    /**
     * Switch uuids of the network on every cluster where its primary switch exists.
     */
    private Map<Cluster, List<String>> switchesByCluster(String networkId, String operation)
            throws BackendUnavailableException {
        Map<Cluster, List<String>> pairs = new LinkedHashMap<>();
        for (Cluster cluster : clusterRegistry.getClusters()) {
            try {
                List<String> uuids = switchBackend.getSwitches(cluster, networkId).stream()
                        .map(BackendSwitch::getUuid)
                        .collect(Collectors.toList());
                pairs.put(cluster, uuids);
            } catch (BackendResourceNotFoundException e) {
                log.debug("Network {} has no switch on cluster {}", networkId, cluster.getName());
            } catch (BackendException e) {
                throw backendFailure(cluster, operation, "Unable to get logical switches of network "
                        + networkId, e);
            }
        }
        return pairs;
    }

    private void collectPorts(Cluster cluster, PortQuery query, Map<String, BackendPort> backendPorts)
            throws BackendUnavailableException {
        try {
            for (BackendPort backendPort : switchBackend.queryPorts(cluster, query)) {
                backendPort.getLogicalPortId().ifPresent(id -> backendPorts.put(id, backendPort));
            }
        } catch (BackendException e) {
            throw backendFailure(cluster, "get_ports", "Unable to get ports on switch " + query.getSwitchUuid(), e);
        }
    }

    private List<Cluster> clustersDefaultFirst() {
        List<Cluster> ordered = new ArrayList<>();
        ordered.add(clusterRegistry.getDefaultCluster());
        Set<String> seen = new HashSet<>();
        seen.add(clusterRegistry.getDefaultCluster().getName());
        for (Cluster cluster : clusterRegistry.getClusters()) {
            if (seen.add(cluster.getName())) {
                ordered.add(cluster);
            }
        }
        return ordered;
    }

    private BackendUnavailableException backendFailure(Cluster cluster, String operation, String message,
                                                       BackendException cause) {
        countBackendFailure(cluster, operation);
        log.error("{} on cluster {}: {}", message, cluster.getName(), cause.getMessage(), cause);
        return new BackendUnavailableException(message + " on cluster " + cluster.getName(), cause);
    }

    private void countBackendFailure(Cluster cluster, String operation) {
        metricsProvider.counter(BACKEND_FAILURES_METRIC_NAME,
                Map.of(CLUSTER_TAG, cluster.getName(), OPERATION_TAG, operation)).increment();
    }

    private static final class LocatedPort {
        private final Cluster cluster;
        private final BackendPort port;

        private LocatedPort(Cluster cluster, BackendPort port) {
            this.cluster = cluster;
            this.port = port;
        }

        private String switchUuid(String fallback) {
            String switchUuid = port.getSwitchUuid();
            return switchUuid != null ? switchUuid : fallback;
        }
    }
}
