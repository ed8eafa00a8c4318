package io.sdncontroller.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ListMultimap;

import java.util.List;

/**
 * Executes requests against the controllers of one cluster.
 * <p>
 * Retry, redirect, failover and timeout policy live entirely behind this
 * interface; callers see each call as a single operation that either returns
 * or throws.
 */
public interface BackendClient {

    /**
     * Fetch a single resource.
     *
     * @throws BackendResourceNotFoundException if the controller reports the resource missing
     */
    JsonNode get(String path) throws BackendException;

    /**
     * Run a query and return every result across all pages.
     * Parameters keep insertion order, so paired parameters (tag, tag_scope) stay together.
     */
    List<JsonNode> query(String path, ListMultimap<String, String> params) throws BackendException;

    /**
     * Create a resource and return the controller's representation of it.
     */
    JsonNode create(String path, Object body) throws BackendException;

    /**
     * Replace the mutable fields of a resource.
     */
    JsonNode update(String path, Object body) throws BackendException;

    void delete(String path) throws BackendException;
}
