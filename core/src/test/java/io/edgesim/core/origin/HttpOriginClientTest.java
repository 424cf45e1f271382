package io.edgesim.core.origin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpServer;
import io.edgesim.core.error.OriginUnavailableException;
import io.edgesim.core.model.EventBody;
import io.edgesim.core.model.HttpHeaders;
import io.edgesim.core.model.OriginTarget;
import io.edgesim.core.model.RequestEvent;
import io.edgesim.core.model.ResponseArtifact;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link HttpOriginClient} against a JDK {@link HttpServer} acting as
 * the origin.
 */
@DisplayName("HttpOriginClient")
class HttpOriginClientTest {

    record Received(String method, String path, String query, Headers headers, String body) {}

    private HttpServer origin;
    private OriginTarget target;
    private HttpOriginClient client;
    private final AtomicReference<Received> received = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        origin = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        origin.createContext("/", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            received.set(new Received(
                    exchange.getRequestMethod(),
                    exchange.getRequestURI().getPath(),
                    exchange.getRequestURI().getRawQuery(),
                    exchange.getRequestHeaders(),
                    body));
            byte[] bytes = ("echo " + exchange.getRequestMethod() + " " + body).getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain");
            exchange.getResponseHeaders().add("Set-Cookie", "a=1");
            exchange.getResponseHeaders().add("Set-Cookie", "b=2");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        origin.createContext("/redirect", exchange -> {
            exchange.getResponseHeaders().set("Location", "/elsewhere");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        origin.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        origin.start();
        target = new OriginTarget("http://127.0.0.1:" + origin.getAddress().getPort());
        client = new HttpOriginClient(Duration.ofSeconds(2), Duration.ofMillis(300));
    }

    @AfterEach
    void tearDown() {
        origin.stop(0);
    }

    @Test
    @DisplayName("GET forwards path, query and end-to-end headers")
    void forwardsGet() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("x-custom", List.of("one", "two"));
        headers.put("keep-alive", List.of("timeout=5"));
        headers.put("host", List.of("viewer.example"));
        RequestEvent request = new RequestEvent(
                "GET", "/api/items", "page=2", HttpHeaders.ofMulti(headers), Map.of(), EventBody.empty(), null);

        ResponseArtifact response = client.fetch(request, target).join();

        assertThat(response.status()).isEqualTo(200);
        assertThat(received.get().path()).isEqualTo("/api/items");
        assertThat(received.get().query()).isEqualTo("page=2");
        assertThat(received.get().headers().get("X-custom")).containsExactly("one", "two");
        assertThat(received.get().headers().containsKey("Keep-alive")).isFalse();
    }

    @Test
    @DisplayName("POST forwards the body")
    void forwardsBody() {
        RequestEvent request = RequestEvent.of("POST", "/submit").withBody(EventBody.of("{\"a\":1}"));

        ResponseArtifact response = client.fetch(request, target).join();

        assertThat(received.get().method()).isEqualTo("POST");
        assertThat(received.get().body()).isEqualTo("{\"a\":1}");
        assertThat(response.body().asString()).isEqualTo("echo POST {\"a\":1}");
    }

    @Test
    @DisplayName("Response headers keep every value under lowercase names")
    void responseHeadersAreMultiValued() {
        ResponseArtifact response = client.fetch(RequestEvent.of("GET", "/"), target).join();

        assertThat(response.headers().all("set-cookie")).containsExactly("a=1", "b=2");
        assertThat(response.headers().names()).allSatisfy(name -> assertThat(name).isLowerCase());
        assertThat(response.headers().contains("transfer-encoding")).isFalse();
    }

    @Test
    @DisplayName("Redirects are returned, not followed")
    void redirectsAreNotFollowed() {
        ResponseArtifact response = client.fetch(RequestEvent.of("GET", "/redirect"), target).join();

        assertThat(response.status()).isEqualTo(302);
        assertThat(response.headers().first("location")).isEqualTo("/elsewhere");
    }

    @Test
    @DisplayName("Refused connection fails with OriginUnavailable")
    void connectionRefused() throws IOException {
        HttpServer closed = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        int port = closed.getAddress().getPort();
        closed.stop(0);

        CompletionException e = assertThrows(CompletionException.class, () -> client.fetch(
                        RequestEvent.of("GET", "/"), new OriginTarget("http://127.0.0.1:" + port))
                .join());

        assertThat(e.getCause()).isInstanceOf(OriginUnavailableException.class);
        assertThat(((OriginUnavailableException) e.getCause()).httpStatus()).isEqualTo(502);
    }

    @Test
    @DisplayName("Slow origin fails with OriginUnavailable caused by a timeout")
    void readTimeout() {
        CompletionException e = assertThrows(
                CompletionException.class,
                () -> client.fetch(RequestEvent.of("GET", "/slow"), target).join());

        assertThat(e.getCause())
                .isInstanceOf(OriginUnavailableException.class)
                .hasCauseInstanceOf(HttpTimeoutException.class);
    }

    @Test
    @DisplayName("Unusable request URI fails without contacting the origin")
    void invalidUri() {
        CompletionException e = assertThrows(
                CompletionException.class,
                () -> client.fetch(RequestEvent.of("GET", "/with space"), target).join());

        assertThat(e.getCause()).isInstanceOf(OriginUnavailableException.class);
        assertThat(received.get()).isNull();
    }

    @Test
    void clientUsesHttp11WithoutRedirects() {
        assertThat(client.httpClient().version()).isEqualTo(HttpClient.Version.HTTP_1_1);
        assertThat(client.httpClient().followRedirects()).isEqualTo(HttpClient.Redirect.NEVER);
    }
}
