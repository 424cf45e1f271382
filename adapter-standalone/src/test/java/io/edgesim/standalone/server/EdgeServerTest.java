package io.edgesim.standalone.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.edgesim.standalone.config.ConfigLoadException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * End-to-end tests: YAML on disk, handlers loaded by class name, a real
 * Javalin server in front of a JDK {@link HttpServer} origin.
 */
class EdgeServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Map<String, String> ENV = Map.of("EDGE_PORT", "0", "EDGE_HOST", "127.0.0.1");

    @TempDir
    Path tempDir;

    private HttpServer origin;
    private final AtomicInteger originHits = new AtomicInteger();
    private final AtomicReference<String> lastOriginBody = new AtomicReference<>();
    private EdgeServerApp server;
    private HttpClient client;
    private Path configFile;

    @BeforeEach
    void setUp() throws IOException {
        origin = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        origin.createContext("/", exchange -> {
            originHits.incrementAndGet();
            String requestBody = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            lastOriginBody.set(requestBody);
            String responseBody = String.format(
                    "{\"method\":\"%s\",\"path\":\"%s\",\"hit\":%d}",
                    exchange.getRequestMethod(), exchange.getRequestURI().getPath(), originHits.get());
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        origin.start();

        configFile = tempDir.resolve("edge-sim.yaml");
        writeConfig("io.edgesim.standalone.fixtures.HelloHandler");
        server = EdgeServerApp.start(configFile, ENV::get);
        client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        origin.stop(0);
    }

    private void writeConfig(String helloHandler) throws IOException {
        Files.writeString(configFile, """
                cache:
                  dir: %s
                behaviors:
                  - pattern: /hello
                    event-type: viewer-request
                    handler: %s
                  - pattern: /api/*
                    event-type: viewer-response
                    handler: io.edgesim.standalone.fixtures.StampHandler
                  - pattern: /boom
                    event-type: viewer-request
                    handler: io.edgesim.standalone.fixtures.FailingHandler
                origins:
                  - path-pattern: /api/*
                    target: http://127.0.0.1:%d
                """.formatted(tempDir.resolve("cache"), helloHandler, origin.getAddress().getPort()));
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + server.port() + path))
                .method(method, publisher)
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("viewer-request short-circuit answers without touching the origin")
    void shortCircuit_noOriginFetch() throws Exception {
        HttpResponse<String> response = send("GET", "/hello", null);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("hello");
        assertThat(response.headers().firstValue("content-type"))
                .hasValueSatisfying(value -> assertThat(value).startsWith("text/plain"));
        assertThat(originHits.get()).isZero();
    }

    @Test
    @DisplayName("Origin response is cached: the second request does not reach the origin")
    void originFetch_cachedOnce() throws Exception {
        HttpResponse<String> first = send("GET", "/api/items?page=1", null);
        HttpResponse<String> second = send("GET", "/api/items?page=1", null);

        assertThat(first.statusCode()).isEqualTo(200);
        assertThat(MAPPER.readTree(first.body()).get("path").asText()).isEqualTo("/api/items");
        assertThat(second.body()).isEqualTo(first.body());
        assertThat(originHits.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("viewer-response handler runs on fresh and cached responses")
    void viewerResponse_stampsHeader() throws Exception {
        HttpResponse<String> first = send("GET", "/api/stamp", null);
        HttpResponse<String> second = send("GET", "/api/stamp", null);

        assertThat(first.headers().firstValue("x-edge-stage")).hasValue("viewer-response");
        assertThat(second.headers().firstValue("x-edge-stage")).hasValue("viewer-response");
    }

    @Test
    @DisplayName("PURGE empties the cache and forces a refetch")
    void purge_forcesRefetch() throws Exception {
        send("GET", "/api/items", null);
        assertThat(originHits.get()).isEqualTo(1);

        HttpResponse<String> purge = send("PURGE", "/anything", null);
        assertThat(purge.statusCode()).isEqualTo(200);
        assertThat(server.router().cache().size()).isZero();

        HttpResponse<String> refetched = send("GET", "/api/items", null);
        assertThat(refetched.statusCode()).isEqualTo(200);
        assertThat(MAPPER.readTree(refetched.body()).get("hit").asInt()).isEqualTo(2);
        assertThat(originHits.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Path with no origin → 502 JSON error body")
    void noOrigin_502() throws Exception {
        HttpResponse<String> response = send("GET", "/unmapped", null);

        assertThat(response.statusCode()).isEqualTo(502);
        assertThat(response.headers().firstValue("content-type")).hasValueSatisfying(
                value -> assertThat(value).startsWith("application/json"));
        JsonNode body = MAPPER.readTree(response.body());
        assertThat(body.get("code").asInt()).isEqualTo(502);
        assertThat(body.get("message").asText()).isNotBlank();
    }

    @Test
    @DisplayName("Throwing handler → 500 and the server keeps serving")
    void failingHandler_500() throws Exception {
        HttpResponse<String> failed = send("GET", "/boom", null);
        HttpResponse<String> next = send("GET", "/hello", null);

        assertThat(failed.statusCode()).isEqualTo(500);
        assertThat(MAPPER.readTree(failed.body()).get("message").asText()).contains("handler exploded");
        assertThat(next.statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("POST body is forwarded to the origin")
    void postBody_forwarded() throws Exception {
        HttpResponse<String> response = send("POST", "/api/orders", "{\"qty\":3}");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(MAPPER.readTree(response.body()).get("method").asText()).isEqualTo("POST");
        assertThat(lastOriginBody.get()).isEqualTo("{\"qty\":3}");
    }

    @Test
    @DisplayName("Admin reload swaps handlers without a restart")
    void adminReload_swapsHandlers() throws Exception {
        writeConfig("io.edgesim.standalone.fixtures.GoodbyeHandler");

        HttpResponse<String> reload = send("POST", "/__edge/reload", null);

        assertThat(reload.statusCode()).isEqualTo(200);
        JsonNode summary = MAPPER.readTree(reload.body());
        assertThat(summary.get("status").asText()).isEqualTo("reloaded");
        // /hello, /api/*, /boom and the catch-all
        assertThat(summary.get("behaviors").asInt()).isEqualTo(4);
        assertThat(send("GET", "/hello", null).body()).isEqualTo("goodbye");
    }

    @Test
    @DisplayName("Failed reload → 500, previous behaviors keep serving")
    void adminReload_failureKeepsOldRegistry() throws Exception {
        writeConfig("com.example.MissingHandler");

        HttpResponse<String> reload = send("POST", "/__edge/reload", null);

        assertThat(reload.statusCode()).isEqualTo(500);
        JsonNode body = MAPPER.readTree(reload.body());
        assertThat(body.get("code").asInt()).isEqualTo(500);
        assertThat(body.get("message").asText()).contains("Reload failed").contains("com.example.MissingHandler");
        assertThat(send("GET", "/hello", null).body()).isEqualTo("hello");
    }

    @Test
    @DisplayName("Cache survives a restart on the same directory")
    void restart_servesFromDurableCache() throws Exception {
        send("GET", "/api/persisted", null);
        server.stop();
        server = EdgeServerApp.start(configFile, ENV::get);

        HttpResponse<String> response = send("GET", "/api/persisted", null);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(originHits.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unknown handler class at startup → ConfigLoadException")
    void startup_unknownHandlerFails() throws IOException {
        Path broken = tempDir.resolve("broken.yaml");
        Files.writeString(broken, """
                behaviors:
                  - event-type: viewer-request
                    handler: com.example.Nope
                """);

        assertThatThrownBy(() -> EdgeServerApp.start(broken, ENV::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("com.example.Nope");
    }
}
