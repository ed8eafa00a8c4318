package io.sdncontroller.backend;

import io.sdncontroller.cluster.Cluster;
import io.sdncontroller.enums.ResourceStatus;
import io.sdncontroller.models.NetworkBinding;
import io.sdncontroller.models.Port;

import java.util.List;
import java.util.Optional;

/**
 * Switch and port operations the controller performs on a cluster's backend.
 */
public interface SwitchBackend {

    /**
     * Create a switch. When {@code primaryNetworkId} is set the switch is a
     * fragment of that network and is tagged with its id.
     *
     * @param binding provider binding, or null for an overlay switch on the cluster's default transport zone
     */
    BackendSwitch createSwitch(Cluster cluster, String tenantId, String displayName, NetworkBinding binding,
                               String primaryNetworkId) throws BackendException;

    /**
     * All switches of a network: the primary switch first, then its fragments.
     *
     * @throws BackendResourceNotFoundException if the primary switch does not exist on this cluster
     */
    List<BackendSwitch> getSwitches(Cluster cluster, String networkId) throws BackendException;

    /**
     * Tag the primary switch of a network as spanning several switches. No-op when already tagged.
     */
    void markMultiSwitch(Cluster cluster, BackendSwitch primary, String tenantId) throws BackendException;

    void deleteSwitches(Cluster cluster, List<String> switchUuids) throws BackendException;

    /**
     * List switches, restricted to the given tenants when the list is not empty.
     */
    List<BackendSwitch> querySwitches(Cluster cluster, List<String> tenantIds) throws BackendException;

    BackendPort createPort(Cluster cluster, String switchUuid, Port port) throws BackendException;

    void plugInterface(Cluster cluster, String switchUuid, String portUuid, String attachmentType,
                       String attachmentId) throws BackendException;

    void updatePort(Cluster cluster, String switchUuid, String portUuid, Port port) throws BackendException;

    ResourceStatus getPortStatus(Cluster cluster, String switchUuid, String portUuid) throws BackendException;

    void deletePort(Cluster cluster, String switchUuid, String portUuid) throws BackendException;

    /**
     * Find the backend port joined to a local port id.
     *
     * @param switchUuid switch to search, or {@code *} for every switch of the cluster
     */
    Optional<BackendPort> findPort(Cluster cluster, String switchUuid, String portId) throws BackendException;

    /**
     * Ports carrying a logical-port-id tag that match the query.
     */
    List<BackendPort> queryPorts(Cluster cluster, PortQuery query) throws BackendException;
}
