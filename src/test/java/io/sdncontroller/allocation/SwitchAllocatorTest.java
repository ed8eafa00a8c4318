package io.sdncontroller.allocation;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.sdncontroller.backend.BackendSwitch;
import io.sdncontroller.backend.SwitchBackend;
import io.sdncontroller.backend.Tags;
import io.sdncontroller.cluster.Cluster;
import io.sdncontroller.cluster.ControllerEndpoint;
import io.sdncontroller.enums.NetworkType;
import io.sdncontroller.exceptions.CapacityExhaustedException;
import io.sdncontroller.exceptions.NetworkNotFoundException;
import io.sdncontroller.metrics.MetricsProvider;
import io.sdncontroller.models.Network;
import io.sdncontroller.models.NetworkBinding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static io.sdncontroller.metrics.MetricsConstants.SWITCH_FRAGMENTS_CREATED_METRIC_NAME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SwitchAllocatorTest {

    @Mock
    private SwitchBackend switchBackend;

    private SimpleMeterRegistry registry;
    private SwitchAllocator allocator;
    private Cluster cluster;
    private Network network;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        allocator = new SwitchAllocator(switchBackend, new MetricsProvider(registry, "test"));
        cluster = new Cluster("c1", List.of(ControllerEndpoint.builder()
                .address("10.0.0.1").port(443).user("u").password("p").build()));
        network = Network.builder().id("net-1").tenantId("t1").name("blue").build();
    }

    private static BackendSwitch sw(String uuid, int ports) {
        return new BackendSwitch(uuid, uuid, List.of(Tags.tenant("t1")), true, ports);
    }

    @Test
    void testFirstSwitchWithRoomIsSelected() throws Exception {
        when(switchBackend.getSwitches(cluster, "net-1")).thenReturn(List.of(sw("net-1", 4), sw("frag-1", 2)));

        BackendSwitch selected = allocator.select(cluster, network, null, 4, true);

        assertThat(selected.getUuid()).isEqualTo("frag-1");
        verify(switchBackend, never()).createSwitch(any(), anyString(), anyString(), any(), anyString());
    }

    @Test
    void testNetworkWithoutSwitchesIsNotFound() throws Exception {
        when(switchBackend.getSwitches(cluster, "net-1")).thenReturn(List.of());

        assertThatThrownBy(() -> allocator.select(cluster, network, null, 64, true))
                .isInstanceOf(NetworkNotFoundException.class)
                .hasMessageContaining("net-1");
        verify(switchBackend, never()).markMultiSwitch(any(), any(), anyString());
        verify(switchBackend, never()).createSwitch(any(), anyString(), anyString(), any(), anyString());
    }

    @Test
    void testFullSwitchWithoutFragmentationFails() throws Exception {
        when(switchBackend.getSwitches(cluster, "net-1")).thenReturn(List.of(sw("net-1", 5000)));

        assertThatThrownBy(() -> allocator.select(cluster, network, null, 5000, false))
                .isInstanceOf(CapacityExhaustedException.class);
        verify(switchBackend, never()).markMultiSwitch(any(), any(), anyString());
    }

    @Test
    void testFragmentCreatedWhenAllSwitchesFull() throws Exception {
        BackendSwitch primary = sw("net-1", 64);
        NetworkBinding binding = new NetworkBinding("net-1", NetworkType.VLAN, "phys", 10);
        when(switchBackend.getSwitches(cluster, "net-1")).thenReturn(List.of(primary, sw("frag-1", 64)));
        when(switchBackend.createSwitch(cluster, "t1", "blue-ext-2", binding, "net-1"))
                .thenReturn(sw("frag-2", 0));

        BackendSwitch selected = allocator.select(cluster, network, binding, 64, true);

        assertThat(selected.getUuid()).isEqualTo("frag-2");
        verify(switchBackend).markMultiSwitch(cluster, primary, "t1");
        assertThat(registry.get(SWITCH_FRAGMENTS_CREATED_METRIC_NAME).tag("cluster", "c1").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void testFirstFragmentIsNumberedOne() throws Exception {
        when(switchBackend.getSwitches(cluster, "net-1")).thenReturn(List.of(sw("net-1", 64)));
        when(switchBackend.createSwitch(eq(cluster), eq("t1"), eq("blue-ext-1"), any(), eq("net-1")))
                .thenReturn(sw("frag-1", 0));

        assertThat(allocator.select(cluster, network, null, 64, true).getUuid()).isEqualTo("frag-1");
    }
}
