package io.sdncontroller.store;

import io.sdncontroller.exceptions.InvalidInputException;
import io.sdncontroller.exceptions.NetworkControllerException;
import io.sdncontroller.exceptions.NetworkNotFoundException;
import io.sdncontroller.exceptions.PortNotFoundException;
import io.sdncontroller.exceptions.SegmentationIdInUseException;
import io.sdncontroller.models.FixedIp;
import io.sdncontroller.models.Network;
import io.sdncontroller.models.NetworkBinding;
import io.sdncontroller.models.Port;
import io.sdncontroller.models.RecordFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static io.sdncontroller.config.Constants.*;

/**
 * Record store keeping every table in memory.
 * <p>
 * Transactions are serialized by a fair lock held for the whole outermost
 * transaction. On entry all tables are snapshotted; if the callback throws,
 * the snapshot is restored.
 * <p>
 * Single reads and writes take the same lock, so they wait for any open
 * transaction. The engine calls the SDN controllers from inside its port
 * create and update transactions so a backend failure rolls the records
 * back; while such a call is in flight, every other store access on this
 * controller is blocked for up to the cluster's request timeout.
 */
@Slf4j
public class InMemoryRecordStore implements RecordStore {

    private final ReentrantLock lock = new ReentrantLock(true);

    private Tables tables = new Tables();

    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) throws NetworkControllerException {
        lock.lock();
        try {
            if (lock.getHoldCount() > 1) {
                return callback.doInTransaction();
            }
            Tables snapshot = tables.copy();
            try {
                return callback.doInTransaction();
            } catch (NetworkControllerException | RuntimeException e) {
                tables = snapshot;
                log.debug("Rolled back transaction: {}", e.getMessage());
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Network createNetwork(Network network) throws NetworkControllerException {
        if (network.getId() == null) {
            throw new InvalidInputException("network id is required");
        }
        lock.lock();
        try {
            if (tables.networks.containsKey(network.getId())) {
                throw new InvalidInputException("network " + network.getId() + " already exists");
            }
            Network stored = stripProjections(network);
            tables.networks.put(stored.getId(), stored);
            log.debug("Stored network {}", stored.getId());
            return copy(stored);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Network> findNetwork(String networkId) {
        lock.lock();
        try {
            return Optional.ofNullable(tables.networks.get(networkId)).map(InMemoryRecordStore::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Network getNetwork(String networkId) throws NetworkNotFoundException {
        return findNetwork(networkId).orElseThrow(() -> new NetworkNotFoundException(networkId));
    }

    @Override
    public Network updateNetwork(Network network) throws NetworkNotFoundException {
        lock.lock();
        try {
            if (!tables.networks.containsKey(network.getId())) {
                throw new NetworkNotFoundException(network.getId());
            }
            Network stored = stripProjections(network);
            tables.networks.put(stored.getId(), stored);
            return copy(stored);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deleteNetwork(String networkId) throws NetworkNotFoundException {
        lock.lock();
        try {
            if (tables.networks.remove(networkId) == null) {
                throw new NetworkNotFoundException(networkId);
            }
            tables.bindings.remove(networkId);
            tables.networkSecurity.remove(networkId);
            log.debug("Removed network {}", networkId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Network> listNetworks(RecordFilter filter) {
        lock.lock();
        try {
            return tables.networks.values().stream()
                    .filter(n -> filter.matches(FILTER_ID, n.getId())
                            && filter.matches(FILTER_TENANT_ID, n.getTenantId())
                            && filter.matches(FILTER_NAME, n.getName()))
                    .map(InMemoryRecordStore::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Port createPort(Port port) throws NetworkControllerException {
        lock.lock();
        try {
            Port stored = stripProjections(port);
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            if (stored.getMacAddress() == null) {
                stored.setMacAddress(generateMac());
            }
            if (tables.ports.containsKey(stored.getId())) {
                throw new InvalidInputException("port " + stored.getId() + " already exists");
            }
            tables.ports.put(stored.getId(), stored);
            log.debug("Stored port {} on network {}", stored.getId(), stored.getNetworkId());
            return copy(stored);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Port getPort(String portId) throws PortNotFoundException {
        lock.lock();
        try {
            Port port = tables.ports.get(portId);
            if (port == null) {
                throw new PortNotFoundException(portId);
            }
            return copy(port);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Port updatePort(Port port) throws PortNotFoundException {
        lock.lock();
        try {
            if (!tables.ports.containsKey(port.getId())) {
                throw new PortNotFoundException(port.getId());
            }
            Port stored = stripProjections(port);
            tables.ports.put(stored.getId(), stored);
            return copy(stored);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deletePort(String portId) throws PortNotFoundException {
        lock.lock();
        try {
            if (tables.ports.remove(portId) == null) {
                throw new PortNotFoundException(portId);
            }
            tables.portSecurity.remove(portId);
            log.debug("Removed port {}", portId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Port> listPorts(RecordFilter filter) {
        lock.lock();
        try {
            return tables.ports.values().stream()
                    .filter(p -> filter.matches(FILTER_ID, p.getId())
                            && filter.matches(FILTER_TENANT_ID, p.getTenantId())
                            && filter.matches(FILTER_NETWORK_ID, p.getNetworkId())
                            && filter.matches(FILTER_DEVICE_ID, p.getDeviceId())
                            && filter.matches(FILTER_NAME, p.getName()))
                    .map(InMemoryRecordStore::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addNetworkBinding(NetworkBinding binding) throws NetworkControllerException {
        lock.lock();
        try {
            if (binding.getVlanId() != null) {
                Optional<NetworkBinding> holder =
                        findBindingBySegment(binding.getPhysicalNetwork(), binding.getVlanId());
                if (holder.isPresent() && !holder.get().getNetworkId().equals(binding.getNetworkId())) {
                    throw new SegmentationIdInUseException(binding.getPhysicalNetwork(), binding.getVlanId());
                }
            }
            tables.bindings.put(binding.getNetworkId(), copy(binding));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<NetworkBinding> getNetworkBinding(String networkId) {
        lock.lock();
        try {
            return Optional.ofNullable(tables.bindings.get(networkId)).map(InMemoryRecordStore::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<NetworkBinding> findBindingBySegment(String physicalNetwork, int vlanId) {
        lock.lock();
        try {
            return tables.bindings.values().stream()
                    .filter(b -> b.getVlanId() != null && b.getVlanId() == vlanId)
                    .filter(b -> physicalNetwork == null
                            ? b.getPhysicalNetwork() == null
                            : physicalNetwork.equals(b.getPhysicalNetwork()))
                    .findFirst()
                    .map(InMemoryRecordStore::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setNetworkSecurity(String networkId, boolean enabled) {
        lock.lock();
        try {
            tables.networkSecurity.put(networkId, enabled);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Boolean> getNetworkSecurity(String networkId) {
        lock.lock();
        try {
            return Optional.ofNullable(tables.networkSecurity.get(networkId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setPortSecurity(String portId, boolean enabled) {
        lock.lock();
        try {
            tables.portSecurity.put(portId, enabled);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Boolean> getPortSecurity(String portId) {
        lock.lock();
        try {
            return Optional.ofNullable(tables.portSecurity.get(portId));
        } finally {
            lock.unlock();
        }
    }

    private static String generateMac() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return String.format("%s:%02x:%02x:%02x", MAC_PREFIX,
                random.nextInt(256), random.nextInt(256), random.nextInt(256));
    }

    // Status, provider and security fields are projections, never stored on the record itself
    private static Network stripProjections(Network network) {
        Network stored = copy(network);
        stored.setStatus(null);
        stored.setNetworkType(null);
        stored.setPhysicalNetwork(null);
        stored.setSegmentationId(null);
        stored.setPortSecurityEnabled(null);
        return stored;
    }

    private static Port stripProjections(Port port) {
        Port stored = copy(port);
        stored.setStatus(null);
        stored.setPortSecurityEnabled(null);
        return stored;
    }

    private static Network copy(Network network) {
        return network.toBuilder().build();
    }

    private static Port copy(Port port) {
        Port copy = port.toBuilder().build();
        List<FixedIp> fixedIps = new ArrayList<>();
        for (FixedIp fixedIp : port.getFixedIps()) {
            fixedIps.add(new FixedIp(fixedIp.getSubnetId(), fixedIp.getIpAddress()));
        }
        copy.setFixedIps(fixedIps);
        return copy;
    }

    private static NetworkBinding copy(NetworkBinding binding) {
        return new NetworkBinding(binding.getNetworkId(), binding.getBindingType(),
                binding.getPhysicalNetwork(), binding.getVlanId());
    }

    private static final class Tables {
        private final Map<String, Network> networks = new LinkedHashMap<>();
        private final Map<String, Port> ports = new LinkedHashMap<>();
        private final Map<String, NetworkBinding> bindings = new LinkedHashMap<>();
        private final Map<String, Boolean> networkSecurity = new LinkedHashMap<>();
        private final Map<String, Boolean> portSecurity = new LinkedHashMap<>();

        private Tables copy() {
            Tables copy = new Tables();
            networks.forEach((id, n) -> copy.networks.put(id, InMemoryRecordStore.copy(n)));
            ports.forEach((id, p) -> copy.ports.put(id, InMemoryRecordStore.copy(p)));
            bindings.forEach((id, b) -> copy.bindings.put(id, InMemoryRecordStore.copy(b)));
            copy.networkSecurity.putAll(networkSecurity);
            copy.portSecurity.putAll(portSecurity);
            return copy;
        }
    }
}
