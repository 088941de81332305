package io.datahub.client.transport;

import static org.assertj.core.api.Assertions.assertThat;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.datahub.client.transport.HttpTransport.HttpCallResult;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ApacheHttpTransportTest {

  private HttpServer server;
  private ApacheHttpTransport transport;
  private String baseUrl;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    transport = ApacheHttpTransport.create(Duration.ofSeconds(2), Duration.ofSeconds(2));
  }

  @AfterEach
  void tearDown() throws IOException {
    transport.close();
    server.stop(0);
  }

  @Test
  void getReturnsStatusAndBodyWithHeaders() {
    AtomicReference<String> authorization = new AtomicReference<>();
    AtomicReference<String> query = new AtomicReference<>();
    server.createContext("/data", exchange -> {
      authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
      query.set(exchange.getRequestURI().getRawQuery());
      respond(exchange, 200, "{\"a\":1}");
    });

    HttpCallResult result = transport.get(baseUrl + "/data?id=7",
        Map.of("Authorization", "Bearer abc", "Accept", "application/json"), Duration.ofSeconds(1));

    assertThat(result.isTransportFailure()).isFalse();
    assertThat(result.statusCode()).isEqualTo(200);
    assertThat(result.body()).isEqualTo("{\"a\":1}");
    assertThat(authorization.get()).isEqualTo("Bearer abc");
    assertThat(query.get()).isEqualTo("id=7");
  }

  @Test
  void nonSuccessStatusIsNotATransportFailure() {
    server.createContext("/data", exchange -> respond(exchange, 401, ""));

    HttpCallResult result = transport.get(baseUrl + "/data", Map.of(), Duration.ofSeconds(1));

    assertThat(result.isTransportFailure()).isFalse();
    assertThat(result.statusCode()).isEqualTo(401);
    assertThat(result.body()).isEmpty();
  }

  @Test
  void postSendsUrlEncodedForm() {
    AtomicReference<String> body = new AtomicReference<>();
    AtomicReference<String> contentType = new AtomicReference<>();
    server.createContext("/token", exchange -> {
      contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
      body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
      respond(exchange, 200, "{\"access_token\":\"t\"}");
    });

    Map<String, String> form = new java.util.LinkedHashMap<>();
    form.put("grant_type", "password");
    form.put("username", "alice");
    form.put("password", "p&ss word");
    HttpCallResult result = transport.post(baseUrl + "/token",
        Map.of("Content-Type", "application/x-www-form-urlencoded"), form);

    assertThat(result.statusCode()).isEqualTo(200);
    assertThat(contentType.get()).startsWith("application/x-www-form-urlencoded");
    assertThat(body.get()).isEqualTo("grant_type=password&username=alice&password=p%26ss+word");
  }

  @Test
  void slowResponseIsATransportFailure() {
    server.createContext("/slow", exchange -> {
      try {
        Thread.sleep(1_500);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      respond(exchange, 200, "{\"late\":true}");
    });

    HttpCallResult result = transport.get(baseUrl + "/slow", Map.of(), Duration.ofMillis(200));

    assertThat(result.isTransportFailure()).isTrue();
    assertThat(result.statusCode()).isEqualTo(-1);
  }

  @Test
  void refusedConnectionIsATransportFailure() throws IOException {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }

    HttpCallResult result = transport.get("http://127.0.0.1:" + port + "/data", Map.of(), Duration.ofSeconds(1));

    assertThat(result.isTransportFailure()).isTrue();
    assertThat(result.error()).isNotBlank();
  }

  @Test
  void malformedUrlIsATransportFailure() {
    HttpCallResult result = transport.get(baseUrl + "/data?name=foo bar", Map.of(), Duration.ofSeconds(1));

    assertThat(result.isTransportFailure()).isTrue();
    assertThat(result.error()).contains("IllegalArgumentException");
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
    if (bytes.length > 0) {
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(bytes);
      }
    }
    exchange.close();
  }
}
