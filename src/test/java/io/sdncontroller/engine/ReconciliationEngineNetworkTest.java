package io.sdncontroller.engine;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.sdncontroller.allocation.SwitchAllocator;
import io.sdncontroller.auth.RequestContext;
import io.sdncontroller.auth.RoleBasedPolicyEnforcer;
import io.sdncontroller.backend.BackendException;
import io.sdncontroller.backend.BackendResourceNotFoundException;
import io.sdncontroller.backend.BackendSwitch;
import io.sdncontroller.backend.SwitchBackend;
import io.sdncontroller.backend.Tags;
import io.sdncontroller.cluster.Cluster;
import io.sdncontroller.cluster.ClusterRegistry;
import io.sdncontroller.cluster.ControllerEndpoint;
import io.sdncontroller.config.NetworkControllerConfig;
import io.sdncontroller.enums.NetworkType;
import io.sdncontroller.enums.ResourceStatus;
import io.sdncontroller.exceptions.BackendUnavailableException;
import io.sdncontroller.exceptions.InvalidInputException;
import io.sdncontroller.exceptions.NotAuthorizedException;
import io.sdncontroller.exceptions.UnsupportedFeatureException;
import io.sdncontroller.metrics.MetricsProvider;
import io.sdncontroller.models.Network;
import io.sdncontroller.models.NetworkBinding;
import io.sdncontroller.models.NetworkRequest;
import io.sdncontroller.models.RecordFilter;
import io.sdncontroller.store.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static io.sdncontroller.metrics.MetricsConstants.BACKEND_FAILURES_METRIC_NAME;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReconciliationEngineNetworkTest {

    private static final String TENANT = "tenant-1";

    @Mock
    private SwitchBackend switchBackend;

    @Mock
    private SwitchAllocator switchAllocator;

    @Mock
    private NetworkControllerConfig config;

    private final RequestContext admin = RequestContext.admin();
    private final RequestContext tenant = RequestContext.tenant(TENANT);

    private InMemoryRecordStore store;
    private SimpleMeterRegistry meterRegistry;
    private Cluster cluster;
    private ReconciliationEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryRecordStore();
        meterRegistry = new SimpleMeterRegistry();
        cluster = new Cluster("c1", List.of(ControllerEndpoint.builder()
                .address("10.0.0.1").port(443).user("admin").password("secret").build()));
        MetricsProvider metrics = new MetricsProvider(meterRegistry, "test-controller");
        engine = new ReconciliationEngine(ClusterRegistry.of(List.of(cluster), "c1"), store, switchBackend,
                switchAllocator, new RoleBasedPolicyEnforcer(), new DriftReporter(metrics, false), metrics, config);
    }

    private static BackendSwitch backendSwitch(String uuid, boolean fabricUp) {
        return new BackendSwitch(uuid, "name-" + uuid, List.of(Tags.tenant(TENANT)), fabricUp, 0);
    }

    private void storeNetwork(String id) throws Exception {
        store.createNetwork(Network.builder().id(id).tenantId(TENANT).name("net-" + id).build());
    }

    @Test
    void testCreateNetworkRecordsBackendUuid() throws Exception {
        when(switchBackend.createSwitch(eq(cluster), eq(TENANT), eq("net"), isNull(), isNull()))
                .thenReturn(backendSwitch("ls-1", true));

        Network network = engine.createNetwork(tenant, NetworkRequest.builder().name("net").build());

        assertThat(network.getId()).isEqualTo("ls-1");
        assertThat(network.getTenantId()).isEqualTo(TENANT);
        assertThat(network.getPortSecurityEnabled()).isTrue();
        assertThat(store.getNetwork("ls-1").getName()).isEqualTo("net");
    }

    @Test
    void testCreateNetworkIgnoresAdminStateDown() throws Exception {
        when(switchBackend.createSwitch(any(), any(), any(), any(), any())).thenReturn(backendSwitch("ls-1", true));

        Network network = engine.createNetwork(tenant, NetworkRequest.builder().name("net").adminStateUp(false).build());

        assertThat(network.isAdminStateUp()).isTrue();
    }

    @Test
    void testCreateNetworkBackendFailureLeavesNoRecord() throws Exception {
        when(switchBackend.createSwitch(any(), any(), any(), any(), any()))
                .thenThrow(new BackendException("connection refused"));

        assertThatThrownBy(() -> engine.createNetwork(tenant, NetworkRequest.builder().name("net").build()))
                .isInstanceOf(BackendUnavailableException.class)
                .hasCauseInstanceOf(BackendException.class);

        assertThat(store.listNetworks(RecordFilter.none())).isEmpty();
        assertThat(meterRegistry.get(BACKEND_FAILURES_METRIC_NAME)
                .tag("cluster", "c1").tag("operation", "create_network").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testSegmentationIdOnNonVlanFailsBeforeBackendCall() {
        assertThatThrownBy(() -> engine.createNetwork(admin, NetworkRequest.builder()
                .name("net").networkType("gre").segmentationId(5).build()))
                .isInstanceOf(InvalidInputException.class);

        verifyNoInteractions(switchBackend);
    }

    @Test
    void testVlanOutOfRangeIsRejected() {
        assertThatThrownBy(() -> engine.createNetwork(admin, NetworkRequest.builder()
                .name("net").networkType("vlan").physicalNetwork("phys1").segmentationId(4095).build()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("out of range");

        verifyNoInteractions(switchBackend);
    }

    @Test
    void testProviderAttributesRequireAdmin() {
        assertThatThrownBy(() -> engine.createNetwork(tenant, NetworkRequest.builder()
                .name("net").networkType("flat").physicalNetwork("phys1").build()))
                .isInstanceOf(NotAuthorizedException.class);

        verifyNoInteractions(switchBackend);
    }

    @Test
    void testVlanNetworkRecordsBindingAndPassesItToBackend() throws Exception {
        when(switchBackend.createSwitch(eq(cluster), any(), eq("vlan-net"), any(NetworkBinding.class), isNull()))
                .thenReturn(backendSwitch("ls-vlan", true));

        Network network = engine.createNetwork(admin, NetworkRequest.builder().tenantId(TENANT)
                .name("vlan-net").networkType("vlan").physicalNetwork("phys1").segmentationId(10).build());

        assertThat(network.getNetworkType()).isEqualTo("vlan");
        assertThat(network.getSegmentationId()).isEqualTo(10);
        NetworkBinding binding = store.getNetworkBinding("ls-vlan").orElseThrow();
        assertThat(binding.getBindingType()).isEqualTo(NetworkType.VLAN);
        assertThat(binding.getPhysicalNetwork()).isEqualTo("phys1");
    }

    @Test
    void testProviderAttributesHiddenFromTenant() throws Exception {
        storeNetwork("net-1");
        store.addNetworkBinding(new NetworkBinding("net-1", NetworkType.FLAT, "phys1", null));
        when(switchBackend.getSwitches(cluster, "net-1")).thenReturn(List.of(backendSwitch("net-1", true)));

        Network asTenant = engine.getNetwork(tenant, "net-1");
        Network asAdmin = engine.getNetwork(admin, "net-1");

        assertThat(asTenant.getNetworkType()).isNull();
        assertThat(asTenant.getPhysicalNetwork()).isNull();
        assertThat(asAdmin.getNetworkType()).isEqualTo("flat");
        assertThat(asAdmin.getPhysicalNetwork()).isEqualTo("phys1");
    }

    @Test
    void testUpdateNetworkRejectsAdminStateDown() {
        assertThatThrownBy(() -> engine.updateNetwork(admin, "net-1", NetworkRequest.builder().adminStateUp(false).build()))
                .isInstanceOf(UnsupportedFeatureException.class);
    }

    @Test
    void testUpdateNetworkChangesNameAndPortSecurity() throws Exception {
        storeNetwork("net-1");

        Network updated = engine.updateNetwork(admin, "net-1",
                NetworkRequest.builder().name("renamed").portSecurityEnabled(false).build());

        assertThat(updated.getName()).isEqualTo("renamed");
        assertThat(updated.getPortSecurityEnabled()).isFalse();
        assertThat(store.getNetworkSecurity("net-1")).contains(false);
        verifyNoInteractions(switchBackend);
    }

    @Test
    void testNetworkStatusIsDownWhenAnySwitchIsDown() throws Exception {
        storeNetwork("net-1");
        when(switchBackend.getSwitches(cluster, "net-1"))
                .thenReturn(List.of(backendSwitch("net-1", true), backendSwitch("frag-1", false)));

        assertThat(engine.getNetwork(tenant, "net-1").getStatus()).isEqualTo(ResourceStatus.DOWN);
    }

    @Test
    void testMissingSwitchMeansNetworkDown() throws Exception {
        storeNetwork("net-1");
        when(switchBackend.getSwitches(cluster, "net-1")).thenThrow(new BackendResourceNotFoundException("/x"));

        assertThat(engine.getNetwork(tenant, "net-1").getStatus()).isEqualTo(ResourceStatus.DOWN);
    }

    @Test
    void testGetNetworkWrapsBackendFailure() throws Exception {
        storeNetwork("net-1");
        when(switchBackend.getSwitches(cluster, "net-1")).thenThrow(new BackendException("timeout"));

        assertThatThrownBy(() -> engine.getNetwork(tenant, "net-1"))
                .isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void testGetNetworkFieldSelection() throws Exception {
        storeNetwork("net-1");
        when(switchBackend.getSwitches(cluster, "net-1")).thenReturn(List.of(backendSwitch("net-1", true)));

        Map<String, Object> fields = engine.getNetwork(tenant, "net-1", List.of("id", "status"));

        assertThat(fields).containsOnlyKeys("id", "status");
        assertThat(fields).containsEntry("id", "net-1").containsEntry("status", "ACTIVE");
    }

    @Test
    void testTenantListingQueriesOwnTenant() throws Exception {
        when(switchBackend.querySwitches(cluster, List.of(TENANT))).thenReturn(List.of());

        engine.getNetworks(tenant, RecordFilter.none());

        verify(switchBackend).querySwitches(cluster, List.of(TENANT));
    }

    @Test
    void testAdminListingQueriesAllTenantsUnlessFiltered() throws Exception {
        when(switchBackend.querySwitches(eq(cluster), anyList())).thenReturn(List.of());

        engine.getNetworks(admin, RecordFilter.none());
        engine.getNetworks(admin, RecordFilter.by("tenant_id", "t1", "t2"));

        verify(switchBackend).querySwitches(cluster, List.of());
        verify(switchBackend).querySwitches(cluster, List.of("t1", "t2"));
    }

    @Test
    void testListingLeavesNetworksWithoutSwitchAsTheyAre() throws Exception {
        storeNetwork("net-1");
        when(switchBackend.querySwitches(eq(cluster), anyList())).thenReturn(List.of());

        List<Network> networks = engine.getNetworks(admin, RecordFilter.none());

        assertThat(networks).singleElement().satisfies(n -> {
            assertThat(n.getName()).isEqualTo("net-net-1");
            assertThat(n.getStatus()).isNull();
        });
    }

    @Test
    void testDeleteNetworkToleratesBackendDeletionFailure() throws Exception {
        storeNetwork("net-1");
        when(switchBackend.getSwitches(cluster, "net-1")).thenReturn(List.of(backendSwitch("net-1", true)));
        doThrow(new BackendException("boom")).when(switchBackend).deleteSwitches(cluster, List.of("net-1"));

        engine.deleteNetwork(admin, "net-1");

        assertThat(store.findNetwork("net-1")).isEmpty();
        assertThat(meterRegistry.get(BACKEND_FAILURES_METRIC_NAME).tag("operation", "delete_network")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void testGetAllNetworksListsTenantSwitches() throws Exception {
        when(switchBackend.querySwitches(cluster, List.of(TENANT)))
                .thenReturn(List.of(backendSwitch("ls-1", true), backendSwitch("ls-2", false)));

        assertThat(engine.getAllNetworks(TENANT)).extracting(BackendSwitch::getUuid).containsExactly("ls-1", "ls-2");
    }
}
