package io.sdncontroller.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import io.sdncontroller.cluster.ControllerEndpoint;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static io.sdncontroller.config.Constants.*;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Backend client for one cluster, speaking JSON over HTTP to its controllers.
 * <p>
 * Requests go to the last controller that answered; on connection failure the
 * next controller is tried, for at most {@code retries} extra attempts. A
 * session cookie is obtained per controller through the login resource and
 * renewed once when the controller answers 401. Concurrent requests are
 * limited by a semaphore.
 */
@Slf4j
public class HttpBackendClient implements BackendClient {

    private static final String COOKIE_HEADER = "Cookie";
    private static final String SET_COOKIE_HEADER = "Set-Cookie";
    private static final String CONTENT_TYPE_JSON = "application/json";
    private static final String CONTENT_TYPE_FORM = "application/x-www-form-urlencoded";

    private final String clusterName;
    private final List<ControllerEndpoint> endpoints;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Semaphore connectionSlots;
    private final AtomicInteger activeEndpoint = new AtomicInteger();
    private final Map<URI, String> sessionCookies = new ConcurrentHashMap<>();

    public HttpBackendClient(String clusterName, List<ControllerEndpoint> endpoints, int concurrentConnections) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one controller endpoint is required");
        }
        this.clusterName = clusterName;
        this.endpoints = List.copyOf(endpoints);
        this.objectMapper = new ObjectMapper();
        this.connectionSlots = new Semaphore(Math.max(1, concurrentConnections), true);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(primary().getHttpTimeout()))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public JsonNode get(String path) throws BackendException {
        return execute("GET", path, null);
    }

    @Override
    public List<JsonNode> query(String path, ListMultimap<String, String> params) throws BackendException {
        // Keyed by uuid so a resource seen on two pages is returned once
        Map<String, JsonNode> byUuid = new LinkedHashMap<>();
        List<JsonNode> withoutUuid = new ArrayList<>();
        Set<String> seenCursors = new HashSet<>();
        String cursor = null;
        int pages = 0;
        do {
            ListMultimap<String, String> pageParams = LinkedListMultimap.create(params);
            pageParams.put(PARAM_PAGE_LENGTH, String.valueOf(QUERY_PAGE_LENGTH));
            if (cursor != null) {
                pageParams.put(PARAM_PAGE_CURSOR, cursor);
            }
            JsonNode page = execute("GET", path + "?" + encode(pageParams), null);
            for (JsonNode result : page.path("results")) {
                String uuid = result.path("uuid").asText(null);
                if (uuid == null) {
                    withoutUuid.add(result);
                } else {
                    byUuid.putIfAbsent(uuid, result);
                }
            }
            cursor = page.path("page_cursor").asText(null);
            if (cursor != null && cursor.isEmpty()) {
                cursor = null;
            }
            pages++;
            if (cursor != null && !seenCursors.add(cursor)) {
                throw new BackendException("Query " + path + " on cluster " + clusterName
                        + " returned page cursor " + cursor + " twice after " + pages + " page(s)");
            }
        } while (cursor != null);

        List<JsonNode> results = new ArrayList<>(byUuid.values());
        results.addAll(withoutUuid);
        log.debug("Query {} on cluster {} returned {} result(s) in {} page(s)", path, clusterName, results.size(), pages);
        return results;
    }

    @Override
    public JsonNode create(String path, Object body) throws BackendException {
        return execute("POST", path, body);
    }

    @Override
    public JsonNode update(String path, Object body) throws BackendException {
        return execute("PUT", path, body);
    }

    @Override
    public void delete(String path) throws BackendException {
        execute("DELETE", path, null);
    }

    private JsonNode execute(String method, String path, Object body) throws BackendException {
        String payload = serialize(body);
        acquireSlot();
        try {
            int retries = Math.max(0, primary().getRetries());
            int start = activeEndpoint.get();
            BackendException lastFailure = null;
            for (int attempt = 0; attempt <= retries; attempt++) {
                int index = Math.floorMod(start + attempt, endpoints.size());
                ControllerEndpoint endpoint = endpoints.get(index);
                try {
                    HttpResponse<String> response = sendAuthenticated(endpoint, method, path, payload);
                    activeEndpoint.set(index);
                    return handleResponse(method, path, response);
                } catch (IOException e) {
                    log.warn("Request {} {} to controller {}:{} of cluster {} failed (attempt {}/{}): {}",
                            method, path, endpoint.getAddress(), endpoint.getPort(), clusterName,
                            attempt + 1, retries + 1, e.getMessage());
                    lastFailure = new BackendException("Request " + method + " " + path + " to cluster "
                            + clusterName + " failed: " + e.getMessage(), e);
                }
            }
            throw lastFailure;
        } finally {
            connectionSlots.release();
        }
    }

    private HttpResponse<String> sendAuthenticated(ControllerEndpoint endpoint, String method, String path,
                                                   String payload) throws IOException, BackendException {
        URI base = endpoint.baseUri();
        String cookie = sessionCookies.get(base);
        if (cookie == null) {
            cookie = login(endpoint);
        }
        HttpResponse<String> response = send(endpoint, method, base.resolve(path), payload, cookie);
        if (response.statusCode() == 401 || response.statusCode() == 403) {
            log.debug("Session rejected by controller {}, logging in again", base);
            sessionCookies.remove(base);
            response = send(endpoint, method, base.resolve(path), payload, login(endpoint));
        }
        return response;
    }

    private String login(ControllerEndpoint endpoint) throws IOException, BackendException {
        URI base = endpoint.baseUri();
        String form = "username=" + URLEncoder.encode(endpoint.getUser(), UTF_8)
                + "&password=" + URLEncoder.encode(endpoint.getPassword(), UTF_8);
        HttpRequest request = HttpRequest.newBuilder(base.resolve(PATH_LOGIN))
                .timeout(Duration.ofSeconds(endpoint.getRequestTimeout()))
                .header("Content-Type", CONTENT_TYPE_FORM)
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();
        HttpResponse<String> response = sendInterruptibly(request);
        if (response.statusCode() / 100 != 2) {
            throw new BackendException("Login to controller " + base + " of cluster " + clusterName
                    + " failed", response.statusCode());
        }
        Optional<String> setCookie = response.headers().firstValue(SET_COOKIE_HEADER);
        String cookie = setCookie.map(value -> value.split(";", 2)[0]).orElse("");
        sessionCookies.put(base, cookie);
        log.debug("Logged in to controller {} of cluster {}", base, clusterName);
        return cookie;
    }

    private HttpResponse<String> send(ControllerEndpoint endpoint, String method, URI target, String payload,
                                      String cookie) throws IOException, BackendException {
        URI current = target;
        int redirectsLeft = Math.max(0, endpoint.getRedirects());
        while (true) {
            HttpRequest.Builder builder = HttpRequest.newBuilder(current)
                    .timeout(Duration.ofSeconds(endpoint.getRequestTimeout()))
                    .header("Accept", CONTENT_TYPE_JSON);
            if (cookie != null && !cookie.isEmpty()) {
                builder.header(COOKIE_HEADER, cookie);
            }
            if (payload != null) {
                builder.header("Content-Type", CONTENT_TYPE_JSON)
                        .method(method, HttpRequest.BodyPublishers.ofString(payload));
            } else {
                builder.method(method, HttpRequest.BodyPublishers.noBody());
            }
            HttpResponse<String> response = sendInterruptibly(builder.build());
            if (!isRedirect(response.statusCode())) {
                return response;
            }
            Optional<String> location = response.headers().firstValue("Location");
            if (location.isEmpty() || redirectsLeft == 0) {
                throw new BackendException("Too many redirects or missing location for " + method + " "
                        + target.getPath() + " on cluster " + clusterName, response.statusCode());
            }
            redirectsLeft--;
            current = current.resolve(location.get());
            log.debug("Following redirect to {}", current);
        }
    }

    private HttpResponse<String> sendInterruptibly(HttpRequest request) throws IOException, BackendException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted while calling cluster " + clusterName, e);
        }
    }

    private JsonNode handleResponse(String method, String path, HttpResponse<String> response)
            throws BackendException {
        int status = response.statusCode();
        if (status == 404) {
            throw new BackendResourceNotFoundException(path);
        }
        if (status / 100 != 2) {
            throw new BackendException("Request " + method + " " + path + " on cluster " + clusterName
                    + " returned status " + status + ": " + response.body(), status);
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new BackendException("Malformed response for " + method + " " + path + " on cluster "
                    + clusterName, status, e);
        }
    }

    private String serialize(Object body) throws BackendException {
        if (body == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new BackendException("Unable to serialize request body", e);
        }
    }

    private void acquireSlot() throws BackendException {
        try {
            connectionSlots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted waiting for a connection to cluster " + clusterName, e);
        }
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static String encode(ListMultimap<String, String> params) {
        return params.entries().stream()
                .map(e -> URLEncoder.encode(e.getKey(), UTF_8) + "=" + URLEncoder.encode(e.getValue(), UTF_8))
                .collect(Collectors.joining("&"));
    }

    private ControllerEndpoint primary() {
        return endpoints.get(0);
    }
}
