package io.sdncontroller;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.sdncontroller.allocation.SwitchAllocator;
import io.sdncontroller.auth.PolicyEnforcer;
import io.sdncontroller.auth.RoleBasedPolicyEnforcer;
import io.sdncontroller.backend.BackendClientFactory;
import io.sdncontroller.backend.HttpBackendClient;
import io.sdncontroller.backend.RestSwitchBackend;
import io.sdncontroller.backend.SwitchBackend;
import io.sdncontroller.cluster.ClusterRegistry;
import io.sdncontroller.config.NetworkControllerConfig;
import io.sdncontroller.engine.DriftReporter;
import io.sdncontroller.engine.ReconciliationEngine;
import io.sdncontroller.exceptions.InvalidClusterConfigException;
import io.sdncontroller.metrics.MetricsProvider;
import io.sdncontroller.store.InMemoryRecordStore;
import io.sdncontroller.store.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Main Spring Boot application class for the network controller.
 *
 * Wires the cluster registry, backend access, record store and policy into a
 * {@link ReconciliationEngine}. All collaborators are passed explicitly; the
 * registry is built once from configuration and not modified afterwards.
 */
@Slf4j
@SpringBootApplication
public class NetworkControllerApplication {

    public static void main(String[] args) {
        log.info("Starting Network Controller Application");

        try {
            SpringApplication.run(NetworkControllerApplication.class, args);
            log.info("Network Controller started successfully");

        } catch (Exception e) {
            log.error("Failed to start Network Controller: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public NetworkControllerConfig config() {
        NetworkControllerConfig config = new NetworkControllerConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry meterRegistry, NetworkControllerConfig config) {
        return new MetricsProvider(meterRegistry, config.getControllerId());
    }

    @Bean
    public RecordStore recordStore() {
        log.info("Initializing in-memory record store");
        return new InMemoryRecordStore();
    }

    @Bean
    public PolicyEnforcer policyEnforcer() {
        return new RoleBasedPolicyEnforcer();
    }

    @Bean
    public BackendClientFactory backendClientFactory(NetworkControllerConfig config) {
        return cluster -> new HttpBackendClient(cluster.getName(), cluster.getEndpoints(),
                config.getConcurrentConnections());
    }

    /**
     * ClusterRegistry bean - an invalid cluster definition aborts startup
     */
    @Bean
    public ClusterRegistry clusterRegistry(NetworkControllerConfig config, BackendClientFactory clientFactory)
            throws InvalidClusterConfigException {
        log.info("Building cluster registry from {} cluster definition(s)", config.getClusters().size());
        try {
            return ClusterRegistry.fromConfig(config, clientFactory);
        } catch (InvalidClusterConfigException e) {
            log.error("Failed to build cluster registry: {}", e.getMessage());
            throw e;
        }
    }

    @Bean
    public SwitchBackend switchBackend() {
        return new RestSwitchBackend();
    }

    @Bean
    public SwitchAllocator switchAllocator(SwitchBackend switchBackend, MetricsProvider metricsProvider) {
        return new SwitchAllocator(switchBackend, metricsProvider);
    }

    @Bean
    public DriftReporter driftReporter(MetricsProvider metricsProvider, NetworkControllerConfig config) {
        return new DriftReporter(metricsProvider, config.isStrictConsistency());
    }

    @Bean
    public ReconciliationEngine reconciliationEngine(ClusterRegistry clusterRegistry,
                                                     RecordStore recordStore,
                                                     SwitchBackend switchBackend,
                                                     SwitchAllocator switchAllocator,
                                                     PolicyEnforcer policyEnforcer,
                                                     DriftReporter driftReporter,
                                                     MetricsProvider metricsProvider,
                                                     NetworkControllerConfig config) {
        log.info("Initializing ReconciliationEngine");
        return new ReconciliationEngine(clusterRegistry, recordStore, switchBackend, switchAllocator,
                policyEnforcer, driftReporter, metricsProvider, config);
    }
}
