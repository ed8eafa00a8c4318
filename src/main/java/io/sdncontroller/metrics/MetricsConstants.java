package io.sdncontroller.metrics;

/**
 * Constants for metrics names and tags used in the network controller.
 */
public class MetricsConstants {
    public final static String BACKEND_ORPHAN_SWITCHES_METRIC_NAME = "backend_orphan_switches";
    public final static String BACKEND_ORPHAN_PORTS_METRIC_NAME = "backend_orphan_ports";
    public final static String LOCAL_RECORDS_MISSING_ON_BACKEND_METRIC_NAME = "local_records_missing_on_backend";
    public final static String BACKEND_FAILURES_METRIC_NAME = "backend_failures";
    public final static String SWITCH_FRAGMENTS_CREATED_METRIC_NAME = "switch_fragments_created";
    public final static String CONFIGURED_CLUSTERS_METRIC_NAME = "configured_clusters";
    public final static String CLUSTER_TAG = "cluster";
    public final static String OPERATION_TAG = "operation";
    public final static String RESOURCE_TAG = "resource";

    private MetricsConstants() {}
}
