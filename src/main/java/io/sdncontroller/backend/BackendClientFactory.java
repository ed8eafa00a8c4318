package io.sdncontroller.backend;

import io.sdncontroller.cluster.Cluster;

/**
 * Creates the client bound to a cluster once its endpoints are known.
 */
@FunctionalInterface
public interface BackendClientFactory {

    BackendClient create(Cluster cluster);
}
