package com.scholary.consult.scribe.audio;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for audio decoding and segmentation.
 *
 * <p>The segmentation defaults (60s threshold, 45s windows) keep each request to the recognition
 * service well under the length it handles reliably.
 */
@ConfigurationProperties(prefix = "audio")
@Validated
public record AudioProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String tempDir,
    @Positive int minInputBytes,
    @Positive int processTimeoutSeconds,
    @NotNull @Valid SegmentationProperties segmentation) {

  public record SegmentationProperties(
      @Positive long longAudioThresholdMs, @Positive long segmentLengthMs) {}
}
