package io.sdncontroller.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.sdncontroller.cluster.ControllerEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.sdncontroller.config.Constants.PATH_LOGIN;
import static io.sdncontroller.config.Constants.PATH_LSWITCH;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpBackendClientTest {

    private static final String SESSION = "session=abc";

    private HttpServer server;
    private final AtomicInteger logins = new AtomicInteger();
    private final List<String> requests = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean expireSessionOnce;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext(PATH_LOGIN, exchange -> {
            logins.incrementAndGet();
            exchange.getResponseHeaders().add("Set-Cookie", SESSION + "; Path=/");
            respond(exchange, 200, "");
        });
        server.createContext(PATH_LSWITCH, exchange -> {
            String uri = exchange.getRequestURI().toString();
            requests.add(exchange.getRequestMethod() + " " + uri);
            if (!SESSION.equals(exchange.getRequestHeaders().getFirst("Cookie"))) {
                respond(exchange, 401, "");
                return;
            }
            if (expireSessionOnce) {
                expireSessionOnce = false;
                respond(exchange, 401, "");
                return;
            }
            String path = exchange.getRequestURI().getPath();
            if (path.endsWith("/missing")) {
                respond(exchange, 404, "");
            } else if (path.endsWith("/stuck")) {
                respond(exchange, 200, "{\"results\":[{\"uuid\":\"sw-1\"}],\"page_cursor\":\"same\"}");
            } else if (path.endsWith("/broken")) {
                respond(exchange, 500, "boom");
            } else if ("POST".equals(exchange.getRequestMethod())) {
                String body = new String(exchange.getRequestBody().readAllBytes(), UTF_8);
                respond(exchange, 201, "{\"uuid\":\"sw-new\",\"echo\":" + body + "}");
            } else if ("DELETE".equals(exchange.getRequestMethod())) {
                respond(exchange, 204, null);
            } else if (uri.contains("_page_cursor=next")) {
                respond(exchange, 200, "{\"results\":[{\"uuid\":\"sw-2\"},{\"uuid\":\"sw-3\"}]}");
            } else if (uri.contains("_page_length")) {
                respond(exchange, 200, "{\"results\":[{\"uuid\":\"sw-1\"},{\"uuid\":\"sw-2\"}],"
                        + "\"page_cursor\":\"next\"}");
            } else {
                respond(exchange, 200, "{\"uuid\":\"sw-1\"}");
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        if (body == null) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        byte[] bytes = body.getBytes(UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private static ControllerEndpoint endpoint(int port) {
        return ControllerEndpoint.builder()
                .address("127.0.0.1").port(port).user("admin").password("secret")
                .requestTimeout(5).httpTimeout(2).retries(1).redirects(1)
                .secure(false)
                .build();
    }

    private HttpBackendClient client() {
        return new HttpBackendClient("c1", List.of(endpoint(server.getAddress().getPort())), 2);
    }

    @Test
    void testGetLogsInOnceAndReusesSession() throws Exception {
        HttpBackendClient client = client();

        JsonNode first = client.get(PATH_LSWITCH + "/sw-1");
        client.get(PATH_LSWITCH + "/sw-1");

        assertThat(first.path("uuid").asText()).isEqualTo("sw-1");
        assertThat(logins.get()).isEqualTo(1);
    }

    @Test
    void testExpiredSessionIsRenewed() throws Exception {
        HttpBackendClient client = client();
        client.get(PATH_LSWITCH + "/sw-1");
        expireSessionOnce = true;

        JsonNode node = client.get(PATH_LSWITCH + "/sw-1");

        assertThat(node.path("uuid").asText()).isEqualTo("sw-1");
        assertThat(logins.get()).isEqualTo(2);
    }

    @Test
    void testQueryFollowsPagesAndDeduplicates() throws Exception {
        ListMultimap<String, String> params = LinkedListMultimap.create();
        params.put("tag", "t1");
        params.put("tag_scope", "tenant-id");

        List<JsonNode> results = client().query(PATH_LSWITCH, params);

        assertThat(results).extracting(n -> n.path("uuid").asText()).containsExactly("sw-1", "sw-2", "sw-3");
        assertThat(requests).hasSize(2);
        assertThat(requests.get(0)).contains("tag=t1&tag_scope=tenant-id&_page_length=1000");
    }

    @Test
    void testQueryStopsWhenCursorRepeats() {
        assertThatThrownBy(() -> client().query(PATH_LSWITCH + "/stuck", LinkedListMultimap.create()))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("page cursor same twice");
        assertThat(requests).hasSize(2);
        assertThat(requests.get(1)).contains("_page_cursor=same");
    }

    @Test
    void testCreateSendsJsonBody() throws Exception {
        JsonNode created = client().create(PATH_LSWITCH, Map.of("display_name", "net"));

        assertThat(created.path("uuid").asText()).isEqualTo("sw-new");
        assertThat(created.path("echo").path("display_name").asText()).isEqualTo("net");
    }

    @Test
    void testDeleteWithEmptyResponse() throws Exception {
        client().delete(PATH_LSWITCH + "/sw-1");

        assertThat(requests).containsExactly("DELETE " + PATH_LSWITCH + "/sw-1");
    }

    @Test
    void testNotFoundIsDistinguished() {
        assertThatThrownBy(() -> client().get(PATH_LSWITCH + "/missing"))
                .isInstanceOf(BackendResourceNotFoundException.class)
                .extracting(e -> ((BackendException) e).getStatusCode()).isEqualTo(404);
    }

    @Test
    void testServerErrorCarriesStatus() {
        assertThatThrownBy(() -> client().get(PATH_LSWITCH + "/broken"))
                .isInstanceOf(BackendException.class)
                .isNotInstanceOf(BackendResourceNotFoundException.class)
                .hasMessageContaining("500");
    }

    @Test
    void testFailsOverToNextController() throws Exception {
        int deadPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            deadPort = socket.getLocalPort();
        }
        HttpBackendClient client = new HttpBackendClient("c1",
                List.of(endpoint(deadPort), endpoint(server.getAddress().getPort())), 1);

        JsonNode node = client.get(PATH_LSWITCH + "/sw-1");

        assertThat(node.path("uuid").asText()).isEqualTo("sw-1");
        client.get(PATH_LSWITCH + "/sw-1");
        assertThat(requests).hasSize(2);
    }

    @Test
    void testUnreachableClusterFails() throws Exception {
        int deadPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            deadPort = socket.getLocalPort();
        }
        HttpBackendClient client = new HttpBackendClient("c1", List.of(endpoint(deadPort)), 1);

        assertThatThrownBy(() -> client.get(PATH_LSWITCH + "/sw-1"))
                .isInstanceOf(BackendException.class)
                .extracting(e -> ((BackendException) e).getStatusCode()).isEqualTo(-1);
    }

    @Test
    void testRequiresEndpoints() {
        assertThatThrownBy(() -> new HttpBackendClient("c1", List.of(), 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
