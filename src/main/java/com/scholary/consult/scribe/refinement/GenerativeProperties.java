package com.scholary.consult.scribe.refinement;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the generative-text client.
 *
 * <p>A blank {@code apiKey} leaves the service unavailable; improve and summarize then pass text
 * through unchanged.
 */
@ConfigurationProperties(prefix = "generative")
@Validated
public record GenerativeProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeoutSeconds,
    @Positive int requestTimeoutSeconds) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
