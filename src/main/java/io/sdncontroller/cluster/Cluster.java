package io.sdncontroller.cluster;

import io.sdncontroller.backend.BackendClient;
import io.sdncontroller.backend.BackendClientFactory;
import io.sdncontroller.exceptions.InvalidClusterConfigException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named set of SDN controllers treated as one backend target.
 * <p>
 * The primary endpoint supplies every cluster-wide setting (credentials,
 * timeouts, transport zone, zone id); secondary endpoints are failover
 * addresses only.
 */
@Slf4j
public class Cluster {

    private final String name;
    private final ControllerEndpoint primary;
    private final List<ControllerEndpoint> secondaries;
    private volatile BackendClient client;

    public Cluster(String name, List<ControllerEndpoint> endpoints) {
        this.name = name;
        this.primary = endpoints.isEmpty() ? null : endpoints.get(0);
        this.secondaries = endpoints.size() > 1
                ? List.copyOf(endpoints.subList(1, endpoints.size()))
                : List.of();
    }

    /**
     * Bind the backend client for this cluster. Fails when the cluster has no endpoint.
     */
    public synchronized void bindClient(BackendClientFactory factory) throws InvalidClusterConfigException {
        if (primary == null) {
            throw new InvalidClusterConfigException("Cluster " + name + " has no controller endpoints");
        }
        if (client != null) {
            throw new IllegalStateException("Backend client already bound for cluster " + name);
        }
        this.client = factory.create(this);
        log.info("Bound backend client for cluster {} ({} controller(s), primary {}:{})",
                name, getEndpoints().size(), primary.getAddress(), primary.getPort());
    }

    public BackendClient getClient() {
        BackendClient bound = client;
        if (bound == null) {
            throw new IllegalStateException("No backend client bound for cluster " + name);
        }
        return bound;
    }

    public String getName() {
        return name;
    }

    public ControllerEndpoint getPrimary() {
        if (primary == null) {
            throw new IllegalStateException("Cluster " + name + " has no controller endpoints");
        }
        return primary;
    }

    public List<ControllerEndpoint> getSecondaries() {
        return secondaries;
    }

    /**
     * Primary first, then secondaries in configuration order.
     */
    public List<ControllerEndpoint> getEndpoints() {
        if (primary == null) {
            return List.of();
        }
        List<ControllerEndpoint> all = new ArrayList<>(secondaries.size() + 1);
        all.add(primary);
        all.addAll(secondaries);
        return Collections.unmodifiableList(all);
    }

    public String getHost() {
        return getPrimary().getAddress();
    }

    public int getPort() {
        return getPrimary().getPort();
    }

    public String getUser() {
        return getPrimary().getUser();
    }

    public String getPassword() {
        return getPrimary().getPassword();
    }

    public int getRequestTimeout() {
        return getPrimary().getRequestTimeout();
    }

    public int getHttpTimeout() {
        return getPrimary().getHttpTimeout();
    }

    public int getRetries() {
        return getPrimary().getRetries();
    }

    public int getRedirects() {
        return getPrimary().getRedirects();
    }

    public String getDefaultTzUuid() {
        return getPrimary().getDefaultTzUuid();
    }

    public String getZone() {
        return getPrimary().getZone();
    }

    public String getUuid() {
        return getPrimary().getClusterUuid();
    }

    @Override
    public String toString() {
        return "Cluster{name=" + name + ", endpoints=" + getEndpoints() + "}";
    }
}
