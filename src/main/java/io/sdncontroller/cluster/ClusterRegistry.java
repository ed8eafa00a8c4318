package io.sdncontroller.cluster;

import com.google.common.collect.ImmutableMap;
import io.sdncontroller.backend.BackendClientFactory;
import io.sdncontroller.config.NetworkControllerConfig;
import io.sdncontroller.config.NetworkControllerConfig.ClusterSection;
import io.sdncontroller.exceptions.InvalidClusterConfigException;
import io.sdncontroller.exceptions.UnknownZoneException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Holds all configured clusters and resolves the cluster a resource targets.
 * <p>
 * Built once at startup and read-only afterwards. The zone lookup cache is
 * filled lazily and never invalidated: zone to cluster assignment does not
 * change for the lifetime of the process.
 */
@Slf4j
public class ClusterRegistry {

    private final ImmutableMap<String, Cluster> clusters;
    private final Cluster defaultCluster;
    private final ConcurrentMap<String, Cluster> zoneCache = new ConcurrentHashMap<>();

    private ClusterRegistry(ImmutableMap<String, Cluster> clusters, Cluster defaultCluster) {
        this.clusters = clusters;
        this.defaultCluster = defaultCluster;
    }

    /**
     * Build the registry from configured cluster sections, binding a backend client to each.
     * Any invalid section aborts the whole build.
     */
    public static ClusterRegistry fromConfig(NetworkControllerConfig config, BackendClientFactory clientFactory)
            throws InvalidClusterConfigException {
        List<Cluster> built = new ArrayList<>();
        for (ClusterSection section : config.getClusters()) {
            Cluster cluster = buildCluster(section);
            cluster.bindClient(clientFactory);
            built.add(cluster);
        }
        return of(built, config.getDefaultClusterName());
    }

    /**
     * Assemble a registry from already-built clusters.
     *
     * @param defaultClusterName name of the default cluster; when null or unknown the first cluster is used
     */
    public static ClusterRegistry of(List<Cluster> clusterList, String defaultClusterName)
            throws InvalidClusterConfigException {
        if (clusterList == null || clusterList.isEmpty()) {
            throw new InvalidClusterConfigException("At least one cluster must be configured");
        }
        ImmutableMap.Builder<String, Cluster> builder = ImmutableMap.builder();
        Set<String> seen = new HashSet<>();
        for (Cluster cluster : clusterList) {
            if (!seen.add(cluster.getName())) {
                throw new InvalidClusterConfigException("Duplicate cluster name: " + cluster.getName());
            }
            builder.put(cluster.getName(), cluster);
        }
        ImmutableMap<String, Cluster> clusters = builder.build();

        Cluster first = clusterList.get(0);
        Cluster defaultCluster;
        if (defaultClusterName != null && clusters.containsKey(defaultClusterName)) {
            defaultCluster = clusters.get(defaultClusterName);
        } else {
            if (defaultClusterName == null) {
                log.warn("Default cluster name not specified. Using first cluster: {}", first.getName());
            } else {
                log.warn("Default cluster name {} not found. Using first cluster: {}",
                        defaultClusterName, first.getName());
            }
            defaultCluster = first;
        }

        log.info("ClusterRegistry initialized with clusters {} (default: {})",
                clusters.keySet(), defaultCluster.getName());
        return new ClusterRegistry(clusters, defaultCluster);
    }

    private static Cluster buildCluster(ClusterSection section) throws InvalidClusterConfigException {
        String name = section.getName();
        if (name == null || name.isBlank()) {
            throw new InvalidClusterConfigException("Cluster definition without a name");
        }
        boolean secure = section.getUse_https() == null || section.getUse_https();
        List<ControllerEndpoint> endpoints = new ArrayList<>();
        List<String> connections = section.getController_connection() != null
                ? section.getController_connection() : List.of();
        for (String connection : connections) {
            try {
                endpoints.add(ControllerEndpoint.parse(connection, section.getDefault_tz_uuid(),
                        section.getCluster_uuid(), section.getZone_id(), secure));
            } catch (InvalidClusterConfigException e) {
                log.error("Invalid connection parameters for controller {} in cluster {}",
                        ControllerEndpoint.mask(connection), name);
                throw new InvalidClusterConfigException("Invalid cluster " + name + ": " + e.getMessage(), e);
            }
        }
        return new Cluster(name, endpoints);
    }

    /**
     * Resolve the cluster for a resource.
     *
     * @param zone the resource's zone attribute, or null to use the default cluster
     * @throws UnknownZoneException if no cluster serves the zone
     */
    public Cluster resolve(String zone) throws UnknownZoneException {
        if (zone == null) {
            return defaultCluster;
        }
        Cluster cached = zoneCache.get(zone);
        if (cached != null) {
            return cached;
        }
        log.debug("Looking for zone: {}", zone);
        for (Cluster cluster : clusters.values()) {
            if (zone.equals(cluster.getZone())) {
                zoneCache.putIfAbsent(zone, cluster);
                return cluster;
            }
        }
        log.error("Unable to find cluster config entry for zone: {}", zone);
        throw new UnknownZoneException(zone);
    }

    public Cluster getDefaultCluster() {
        return defaultCluster;
    }

    public Optional<Cluster> getCluster(String name) {
        return Optional.ofNullable(name == null ? null : clusters.get(name));
    }

    /**
     * All clusters in configuration order.
     */
    public Collection<Cluster> getClusters() {
        return clusters.values();
    }

    public int size() {
        return clusters.size();
    }
}
