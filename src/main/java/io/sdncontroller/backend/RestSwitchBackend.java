package io.sdncontroller.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import io.sdncontroller.cluster.Cluster;
import io.sdncontroller.enums.NetworkType;
import io.sdncontroller.enums.ResourceStatus;
import io.sdncontroller.models.FixedIp;
import io.sdncontroller.models.NetworkBinding;
import io.sdncontroller.models.Port;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.sdncontroller.config.Constants.*;

/**
 * {@link SwitchBackend} mapping switch and port operations onto the
 * controller's REST resources through each cluster's {@link BackendClient}.
 */
@Slf4j
public class RestSwitchBackend implements SwitchBackend {

    // Controllers reject longer display names
    private static final int MAX_DISPLAY_NAME_LENGTH = 40;

    private final ObjectMapper objectMapper;

    public RestSwitchBackend() {
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public BackendSwitch createSwitch(Cluster cluster, String tenantId, String displayName, NetworkBinding binding,
                                      String primaryNetworkId) throws BackendException {
        Map<String, Object> transportZone = new LinkedHashMap<>();
        transportZone.put("zone_uuid", binding != null && binding.getPhysicalNetwork() != null
                ? binding.getPhysicalNetwork() : cluster.getDefaultTzUuid());
        transportZone.put("transport_type", transportType(binding));
        if (binding != null && binding.getBindingType() == NetworkType.VLAN) {
            transportZone.put("binding_config",
                    Map.of("vlan_translation", List.of(Map.of("transport", binding.getVlanId()))));
        }

        List<BackendTag> tags = new ArrayList<>();
        tags.add(Tags.tenant(tenantId));
        tags.add(Tags.version());
        if (primaryNetworkId != null) {
            tags.add(Tags.network(primaryNetworkId));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("display_name", truncate(displayName));
        body.put("transport_zones", List.of(transportZone));
        body.put("tags", tags);

        BackendSwitch created = toSwitch(cluster.getClient().create(PATH_LSWITCH, body));
        log.info("Created logical switch {} ({}) on cluster {}", created.getUuid(), displayName, cluster.getName());
        return created;
    }

    @Override
    public List<BackendSwitch> getSwitches(Cluster cluster, String networkId) throws BackendException {
        BackendClient client = cluster.getClient();
        BackendSwitch primary = toSwitch(client.get(
                PATH_LSWITCH + "/" + networkId + "?relations=" + RELATION_SWITCH_STATUS));
        List<BackendSwitch> switches = new ArrayList<>();
        switches.add(primary);
        if (primary.isMultiSwitch()) {
            ListMultimap<String, String> params = LinkedListMultimap.create();
            params.put("relations", RELATION_SWITCH_STATUS);
            params.put("tag", networkId);
            params.put("tag_scope", TAG_SCOPE_NETWORK);
            for (JsonNode node : client.query(PATH_LSWITCH, params)) {
                BackendSwitch fragment = toSwitch(node);
                if (!networkId.equals(fragment.getUuid())) {
                    switches.add(fragment);
                }
            }
        }
        log.debug("Found {} switch(es) for network {} on cluster {}", switches.size(), networkId, cluster.getName());
        return switches;
    }

    @Override
    public void markMultiSwitch(Cluster cluster, BackendSwitch primary, String tenantId) throws BackendException {
        if (primary.isMultiSwitch()) {
            return;
        }
        List<BackendTag> tags = new ArrayList<>(primary.getTags());
        if (Tags.find(tags, TAG_SCOPE_TENANT).isEmpty() && tenantId != null) {
            tags.add(Tags.tenant(tenantId));
        }
        tags.add(Tags.multiSwitch());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("display_name", truncate(primary.getDisplayName()));
        body.put("tags", tags);
        cluster.getClient().update(PATH_LSWITCH + "/" + primary.getUuid(), body);
        primary.setTags(tags);
        log.info("Tagged logical switch {} on cluster {} as multi-switch", primary.getUuid(), cluster.getName());
    }

    @Override
    public void deleteSwitches(Cluster cluster, List<String> switchUuids) throws BackendException {
        for (String uuid : switchUuids) {
            try {
                cluster.getClient().delete(PATH_LSWITCH + "/" + uuid);
                log.info("Deleted logical switch {} on cluster {}", uuid, cluster.getName());
            } catch (BackendResourceNotFoundException e) {
                log.warn("Logical switch {} already absent from cluster {}", uuid, cluster.getName());
            }
        }
    }

    @Override
    public List<BackendSwitch> querySwitches(Cluster cluster, List<String> tenantIds) throws BackendException {
        List<String> tenants = tenantIds == null || tenantIds.isEmpty()
                ? Collections.singletonList(null) : tenantIds;
        Map<String, BackendSwitch> switches = new LinkedHashMap<>();
        for (String tenant : tenants) {
            ListMultimap<String, String> params = LinkedListMultimap.create();
            params.put("fields", SWITCH_QUERY_FIELDS);
            params.put("relations", RELATION_SWITCH_STATUS);
            if (tenant != null) {
                params.put("tag", tenant);
                params.put("tag_scope", TAG_SCOPE_TENANT);
            }
            for (JsonNode node : cluster.getClient().query(PATH_LSWITCH, params)) {
                BackendSwitch sw = toSwitch(node);
                switches.putIfAbsent(sw.getUuid(), sw);
            }
        }
        return new ArrayList<>(switches.values());
    }

    @Override
    public BackendPort createPort(Cluster cluster, String switchUuid, Port port) throws BackendException {
        JsonNode node = cluster.getClient().create(portsPath(switchUuid), portBody(port));
        BackendPort created = toPort(node, switchUuid);
        log.info("Created logical port {} for port {} on switch {} of cluster {}",
                created.getUuid(), port.getId(), switchUuid, cluster.getName());
        return created;
    }

    @Override
    public void plugInterface(Cluster cluster, String switchUuid, String portUuid, String attachmentType,
                              String attachmentId) throws BackendException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", attachmentType);
        body.put("vif_uuid", attachmentId);
        cluster.getClient().update(portPath(switchUuid, portUuid) + "/" + PATH_ATTACHMENT, body);
        log.debug("Plugged {} {} into logical port {} on cluster {}",
                attachmentType, attachmentId, portUuid, cluster.getName());
    }

    @Override
    public void updatePort(Cluster cluster, String switchUuid, String portUuid, Port port) throws BackendException {
        cluster.getClient().update(portPath(switchUuid, portUuid), portBody(port));
        log.debug("Updated logical port {} for port {} on cluster {}", portUuid, port.getId(), cluster.getName());
    }

    @Override
    public ResourceStatus getPortStatus(Cluster cluster, String switchUuid, String portUuid) throws BackendException {
        JsonNode status = cluster.getClient().get(portPath(switchUuid, portUuid) + "/" + PATH_STATUS);
        return ResourceStatus.fromFabricStatus(status.path("fabric_status_up").asBoolean(false));
    }

    @Override
    public void deletePort(Cluster cluster, String switchUuid, String portUuid) throws BackendException {
        cluster.getClient().delete(portPath(switchUuid, portUuid));
        log.info("Deleted logical port {} on switch {} of cluster {}", portUuid, switchUuid, cluster.getName());
    }

    @Override
    public Optional<BackendPort> findPort(Cluster cluster, String switchUuid, String portId) throws BackendException {
        ListMultimap<String, String> params = portQueryParams();
        params.put("tag", portId);
        params.put("tag_scope", TAG_SCOPE_LOGICAL_PORT);
        try {
            List<JsonNode> found = cluster.getClient().query(portsPath(switchUuid), params);
            if (found.size() > 1) {
                log.warn("Found {} logical ports tagged with port id {} on cluster {}",
                        found.size(), portId, cluster.getName());
            }
            return found.stream().findFirst().map(node -> toPort(node, switchUuid));
        } catch (BackendResourceNotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public List<BackendPort> queryPorts(Cluster cluster, PortQuery query) throws BackendException {
        List<String> devices = query.getDeviceIds().isEmpty()
                ? Collections.singletonList(null) : query.getDeviceIds();
        List<String> tenants = query.getTenantIds().isEmpty()
                ? Collections.singletonList(null) : query.getTenantIds();
        Map<String, BackendPort> ports = new LinkedHashMap<>();
        try {
            for (String device : devices) {
                for (String tenant : tenants) {
                    ListMultimap<String, String> params = portQueryParams();
                    if (device != null) {
                        params.put("tag", Tags.hashDeviceId(device));
                        params.put("tag_scope", TAG_SCOPE_DEVICE);
                    }
                    if (tenant != null) {
                        params.put("tag", tenant);
                        params.put("tag_scope", TAG_SCOPE_TENANT);
                    }
                    // Only ports that carry the join tag
                    params.put("tag_scope", TAG_SCOPE_LOGICAL_PORT);
                    for (JsonNode node : cluster.getClient().query(portsPath(query.getSwitchUuid()), params)) {
                        BackendPort port = toPort(node, query.getSwitchUuid());
                        ports.putIfAbsent(port.getUuid(), port);
                    }
                }
            }
        } catch (BackendResourceNotFoundException e) {
            log.debug("Switch {} not present on cluster {}", query.getSwitchUuid(), cluster.getName());
            return List.of();
        }
        return new ArrayList<>(ports.values());
    }

    private Map<String, Object> portBody(Port port) {
        List<BackendTag> tags = new ArrayList<>(Arrays.asList(
                Tags.tenant(port.getTenantId()),
                Tags.logicalPort(port.getId()),
                Tags.device(port.getDeviceId()),
                Tags.version()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("display_name", truncate(port.getName()));
        body.put("admin_status_enabled", port.isAdminStateUp());
        body.put("tags", tags);
        List<Map<String, String>> addressPairs = new ArrayList<>();
        if (Boolean.TRUE.equals(port.getPortSecurityEnabled())) {
            for (FixedIp fixedIp : port.getFixedIps()) {
                Map<String, String> pair = new LinkedHashMap<>();
                pair.put("mac_address", port.getMacAddress());
                pair.put("ip_address", fixedIp.getIpAddress());
                addressPairs.add(pair);
            }
        }
        body.put("allowed_address_pairs", addressPairs);
        return body;
    }

    private static ListMultimap<String, String> portQueryParams() {
        ListMultimap<String, String> params = LinkedListMultimap.create();
        params.put("fields", PORT_QUERY_FIELDS + ",_href");
        params.put("relations", RELATION_PORT_STATUS);
        return params;
    }

    private static String transportType(NetworkBinding binding) {
        if (binding == null || binding.getBindingType() == null) {
            return TRANSPORT_TYPE_OVERLAY;
        }
        return binding.getBindingType().isBridged() ? TRANSPORT_TYPE_BRIDGE : binding.getBindingType().getValue();
    }

    private static String portsPath(String switchUuid) {
        return PATH_LSWITCH + "/" + switchUuid + "/" + PATH_LPORT;
    }

    private static String portPath(String switchUuid, String portUuid) {
        return portsPath(switchUuid) + "/" + portUuid;
    }

    private static String truncate(String name) {
        if (name == null) {
            return "";
        }
        return name.length() > MAX_DISPLAY_NAME_LENGTH ? name.substring(0, MAX_DISPLAY_NAME_LENGTH) : name;
    }

    private BackendSwitch toSwitch(JsonNode node) {
        return objectMapper.convertValue(node, BackendSwitch.class);
    }

    private BackendPort toPort(JsonNode node, String switchUuid) {
        BackendPort port = objectMapper.convertValue(node, BackendPort.class);
        if (port.getHref() == null && !WILDCARD_SWITCH.equals(switchUuid)) {
            port.setHref(portPath(switchUuid, port.getUuid()));
        }
        return port;
    }
}
