package io.sdncontroller.store;

import io.sdncontroller.exceptions.NetworkControllerException;
import io.sdncontroller.exceptions.NetworkNotFoundException;
import io.sdncontroller.exceptions.PortNotFoundException;
import io.sdncontroller.models.Network;
import io.sdncontroller.models.NetworkBinding;
import io.sdncontroller.models.Port;
import io.sdncontroller.models.RecordFilter;

import java.util.List;
import java.util.Optional;

/**
 * Local record store for networks, ports and their side tables.
 * <p>
 * All mutations belonging to one logical operation are grouped with
 * {@link #inTransaction}; calls made outside a transaction run in their own.
 * Records returned are copies: changing them does not change the store.
 */
public interface RecordStore {

    // =================================================================
    // TRANSACTIONS
    // =================================================================

    /**
     * Run the callback atomically. Any exception rolls back every mutation made
     * by the callback and is rethrown unchanged. A call made while a
     * transaction is already open on the current thread joins it.
     */
    <T> T inTransaction(TransactionCallback<T> callback) throws NetworkControllerException;

    // =================================================================
    // NETWORKS
    // =================================================================

    /**
     * Create a network record. The id must already be set.
     */
    Network createNetwork(Network network) throws NetworkControllerException;

    Optional<Network> findNetwork(String networkId);

    Network getNetwork(String networkId) throws NetworkNotFoundException;

    Network updateNetwork(Network network) throws NetworkNotFoundException;

    /**
     * Delete a network together with its provider binding and security binding.
     */
    void deleteNetwork(String networkId) throws NetworkNotFoundException;

    /**
     * Networks matching the filter on id, tenant_id and name.
     */
    List<Network> listNetworks(RecordFilter filter);

    // =================================================================
    // PORTS
    // =================================================================

    /**
     * Create a port record, assigning an id and a MAC address when absent.
     */
    Port createPort(Port port) throws NetworkControllerException;

    Port getPort(String portId) throws PortNotFoundException;

    Port updatePort(Port port) throws PortNotFoundException;

    void deletePort(String portId) throws PortNotFoundException;

    /**
     * Ports matching the filter on id, tenant_id, network_id, device_id and name.
     */
    List<Port> listPorts(RecordFilter filter);

    // =================================================================
    // PROVIDER BINDINGS
    // =================================================================

    void addNetworkBinding(NetworkBinding binding) throws NetworkControllerException;

    Optional<NetworkBinding> getNetworkBinding(String networkId);

    /**
     * Binding holding the given physical network and vlan id, if any.
     */
    Optional<NetworkBinding> findBindingBySegment(String physicalNetwork, int vlanId);

    // =================================================================
    // PORT SECURITY BINDINGS
    // =================================================================

    void setNetworkSecurity(String networkId, boolean enabled);

    Optional<Boolean> getNetworkSecurity(String networkId);

    void setPortSecurity(String portId, boolean enabled);

    Optional<Boolean> getPortSecurity(String portId);
}
