package com.scholary.consult.scribe.refinement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GeminiClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private HttpServer server;
  private final AtomicReference<String> path = new AtomicReference<>();
  private final AtomicReference<String> apiKey = new AtomicReference<>();
  private final AtomicReference<String> requestBody = new AtomicReference<>();
  private volatile int status = 200;
  private volatile String responseBody = "";

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/v1beta/models/",
        exchange -> {
          path.set(exchange.getRequestURI().getPath());
          apiKey.set(exchange.getRequestHeaders().getFirst("x-goog-api-key"));
          requestBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
          exchange.getResponseHeaders().add("Content-Type", "application/json; charset=UTF-8");
          exchange.sendResponseHeaders(status, bytes.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
          }
        });
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  private GeminiClient client(String key) {
    return new GeminiClient(
        new GenerativeProperties(
            "http://127.0.0.1:" + server.getAddress().getPort(), key, "gemini-2.5-flash", 5, 5),
        objectMapper);
  }

  @Test
  void generate_shouldPostPromptAndReturnCandidateText() throws Exception {
    responseBody =
        "{\"candidates\":[{\"content\":{\"role\":\"model\",\"parts\":[{\"text\":\"## CONSULTATION \"},"
            + "{\"text\":\"SUMMARY\"}]},\"finishReason\":\"STOP\"}],\"usageMetadata\":{}}";

    String text = client("k-123").generate("Resuma: paciente com tosse");

    assertThat(text).isEqualTo("## CONSULTATION SUMMARY");
    assertThat(path.get()).isEqualTo("/v1beta/models/gemini-2.5-flash:generateContent");
    assertThat(apiKey.get()).isEqualTo("k-123");
    JsonNode sent = objectMapper.readTree(requestBody.get());
    assertThat(sent.at("/contents/0/parts/0/text").asText()).isEqualTo("Resuma: paciente com tosse");
  }

  @Test
  void generate_shouldFailOnErrorStatus() {
    status = 429;
    responseBody = "{\"error\":{\"message\":\"quota\"}}";

    assertThatThrownBy(() -> client("k").generate("prompt"))
        .isInstanceOf(GenerativeServiceException.class)
        .hasMessageContaining("status 429");
  }

  @Test
  void generate_shouldFailWhenNoCandidateText() {
    responseBody = "{\"candidates\":[]}";

    assertThatThrownBy(() -> client("k").generate("prompt"))
        .isInstanceOf(GenerativeServiceException.class)
        .hasMessageContaining("no text");
  }

  @Test
  void generate_shouldRefuseWithoutApiKey() {
    GeminiClient client = client(" ");

    assertThat(client.isAvailable()).isFalse();
    assertThatThrownBy(() -> client.generate("prompt"))
        .isInstanceOf(GenerativeServiceException.class)
        .hasMessageContaining("not configured");
    assertThat(path.get()).isNull();
  }
}
