package com.scholary.consult.scribe.recognition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Google Speech v2 recognition endpoint.
 *
 * <p>Sends raw 16-bit PCM as {@code audio/l16} and parses the newline-delimited JSON answer. Each
 * call carries its own request timeout; nothing here touches JVM-wide socket settings, so
 * concurrent pipeline runs cannot interfere with each other's deadlines.
 *
 * <p>No retries happen here. {@link RecognitionClient} owns the retry policy.
 */
@Component
public class GoogleSpeechClient implements RecognitionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoogleSpeechClient.class);

  private final HttpClient httpClient;
  private final RecognitionProperties properties;
  private final ObjectMapper objectMapper;

  public GoogleSpeechClient(RecognitionProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeoutSeconds()))
            .build();

    LOGGER.info(
        "Initialized speech recognition client: baseUrl={}, locale={}",
        properties.baseUrl(),
        properties.locale());
  }

  @Override
  public String recognize(RecognitionRequest request, Duration deadline) {
    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(buildUri(request.locale()))
            .timeout(deadline)
            .header("Content-Type", "audio/l16; rate=" + request.sampleRate())
            .POST(BodyPublishers.ofByteArray(request.pcm()))
            .build();

    LOGGER.debug(
        "Sending recognition request: bytes={}, deadline={}ms",
        request.pcm().length,
        deadline.toMillis());

    HttpResponse<String> response;
    try {
      response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      throw new RecognitionTimeoutException(
          "Recognition request exceeded " + deadline.toMillis() + "ms", e);
    } catch (IOException e) {
      throw new RecognitionException("Recognition request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RecognitionException("Recognition request interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new RecognitionException(
          String.format(
              "Recognition service returned status %d: %s",
              response.statusCode(), response.body()));
    }

    return parseTranscript(response.body())
        .orElseThrow(() -> new SpeechNotUnderstoodException("No speech recognized in audio"));
  }

  /**
   * Pick the transcript from a response body.
   *
   * <p>Skips the empty leading objects and, among the alternatives of the first non-empty result,
   * prefers the one carrying the highest confidence. Alternatives without a confidence rank below
   * those with one; among equals the first is taken.
   *
   * @param body the raw response body
   * @return the transcript, or empty if the service recognized nothing
   */
  Optional<String> parseTranscript(String body) {
    if (body == null) {
      return Optional.empty();
    }

    for (String line : body.split("\n")) {
      if (line.isBlank()) {
        continue;
      }

      GoogleSpeechResponse parsed;
      try {
        parsed = objectMapper.readValue(line, GoogleSpeechResponse.class);
      } catch (JsonProcessingException e) {
        throw new RecognitionException("Malformed recognition response: " + line, e);
      }

      if (parsed.result() == null || parsed.result().isEmpty()) {
        continue;
      }

      List<GoogleSpeechResponse.Alternative> alternatives =
          parsed.result().get(0).alternative();
      if (alternatives == null || alternatives.isEmpty()) {
        continue;
      }

      return alternatives.stream()
          .filter(a -> a.transcript() != null)
          .max(
              Comparator.comparing(
                  (GoogleSpeechResponse.Alternative a) ->
                      a.confidence() == null ? -1.0 : a.confidence()))
          .map(GoogleSpeechResponse.Alternative::transcript);
    }

    return Optional.empty();
  }

  private URI buildUri(String locale) {
    StringBuilder uri =
        new StringBuilder(properties.baseUrl())
            .append("?client=chromium&lang=")
            .append(URLEncoder.encode(locale, StandardCharsets.UTF_8));
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      uri.append("&key=").append(URLEncoder.encode(properties.apiKey(), StandardCharsets.UTF_8));
    }
    return URI.create(uri.toString());
  }
}
