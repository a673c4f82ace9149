package com.scholary.consult.scribe.refinement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Gemini {@code generateContent} endpoint.
 *
 * <p>Single-shot: no retries, one request per prompt.
 */
@Component
public class GeminiClient implements GenerativeTextService {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiClient.class);

  private final HttpClient httpClient;
  private final GenerativeProperties properties;
  private final ObjectMapper objectMapper;

  public GeminiClient(GenerativeProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeoutSeconds()))
            .build();

    if (properties.hasApiKey()) {
      LOGGER.info(
          "Initialized generative client: baseUrl={}, model={}",
          properties.baseUrl(),
          properties.model());
    } else {
      LOGGER.warn("No generative API key configured; improve and summarize will pass text through");
    }
  }

  @Override
  public boolean isAvailable() {
    return properties.hasApiKey();
  }

  @Override
  public String generate(String prompt) {
    if (!isAvailable()) {
      throw new GenerativeServiceException("Generative service is not configured");
    }

    String body;
    try {
      body = objectMapper.writeValueAsString(GeminiRequest.ofPrompt(prompt));
    } catch (JsonProcessingException e) {
      throw new GenerativeServiceException("Could not encode request", e);
    }

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(
                URI.create(
                    properties.baseUrl()
                        + "/v1beta/models/"
                        + properties.model()
                        + ":generateContent"))
            .timeout(Duration.ofSeconds(properties.requestTimeoutSeconds()))
            .header("Content-Type", "application/json")
            .header("x-goog-api-key", properties.apiKey())
            .POST(BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

    LOGGER.debug("Sending generate request: promptChars={}", prompt.length());

    HttpResponse<String> response;
    try {
      response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new GenerativeServiceException("Generate request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenerativeServiceException("Generate request interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new GenerativeServiceException(
          String.format(
              "Generative API returned status %d: %s", response.statusCode(), response.body()));
    }

    String text;
    try {
      text = objectMapper.readValue(response.body(), GeminiResponse.class).firstText();
    } catch (JsonProcessingException e) {
      throw new GenerativeServiceException("Malformed generative response", e);
    }

    if (text.isBlank()) {
      throw new GenerativeServiceException("Generative API returned no text");
    }

    LOGGER.debug("Generate request succeeded: responseChars={}", text.length());
    return text;
  }
}
