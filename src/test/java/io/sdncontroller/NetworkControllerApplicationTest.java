package io.sdncontroller;

import io.micrometer.core.instrument.MeterRegistry;
import io.sdncontroller.backend.BackendClientFactory;
import io.sdncontroller.backend.HttpBackendClient;
import io.sdncontroller.backend.SwitchBackend;
import io.sdncontroller.cluster.Cluster;
import io.sdncontroller.cluster.ClusterRegistry;
import io.sdncontroller.config.NetworkControllerConfig;
import io.sdncontroller.engine.ReconciliationEngine;
import io.sdncontroller.exceptions.InvalidClusterConfigException;
import io.sdncontroller.metrics.MetricsProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static io.sdncontroller.metrics.MetricsConstants.CONFIGURED_CLUSTERS_METRIC_NAME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Wiring of the application beans from the test configuration.
 */
class NetworkControllerApplicationTest {

    private final NetworkControllerApplication application = new NetworkControllerApplication();

    @TempDir
    Path tempDir;

    @Test
    void testBeansWireFromConfiguration() throws Exception {
        NetworkControllerConfig config = application.config();
        MeterRegistry meterRegistry = application.meterRegistry();
        MetricsProvider metricsProvider = application.metricsProvider(meterRegistry, config);
        BackendClientFactory clientFactory = application.backendClientFactory(config);

        ClusterRegistry registry = application.clusterRegistry(config, clientFactory);
        SwitchBackend switchBackend = application.switchBackend();
        ReconciliationEngine engine = application.reconciliationEngine(registry, application.recordStore(),
                switchBackend, application.switchAllocator(switchBackend, metricsProvider),
                application.policyEnforcer(), application.driftReporter(metricsProvider, config),
                metricsProvider, config);

        assertThat(engine).isNotNull();
        assertThat(registry.getClusters()).extracting(Cluster::getName).containsExactly("west", "east");
        assertThat(registry.getDefaultCluster().getName()).isEqualTo("east");
        assertThat(registry.getDefaultCluster().getClient()).isInstanceOf(HttpBackendClient.class);
        assertThat(meterRegistry.get(CONFIGURED_CLUSTERS_METRIC_NAME).gauge().value()).isEqualTo(2.0);
    }

    @Test
    void testInvalidClusterAbortsStartup() throws Exception {
        Path file = tempDir.resolve("bad.yml");
        Files.writeString(file, "clusters:\n  - name: broken\n    controller_connection:\n      - 10.0.0.1:443\n");
        NetworkControllerConfig config = new NetworkControllerConfig(file.toString());

        assertThatThrownBy(() -> application.clusterRegistry(config, application.backendClientFactory(config)))
                .isInstanceOf(InvalidClusterConfigException.class)
                .hasMessageContaining("broken");
    }
}
