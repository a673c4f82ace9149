package com.scholary.consult.scribe.recognition;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech recognition client.
 *
 * <p>The deadline for attempt {@code n} (1-based) is {@code initialDeadlineSeconds + (n - 1) *
 * deadlineIncrementSeconds}. Only timeouts are retried.
 */
@ConfigurationProperties(prefix = "recognition")
@Validated
public record RecognitionProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String locale,
    @Positive int connectTimeoutSeconds,
    @Positive int initialDeadlineSeconds,
    @PositiveOrZero int deadlineIncrementSeconds,
    @Positive int maxAttempts,
    @PositiveOrZero long retryBackoffMillis,
    @Positive int calibrationMillis) {}
