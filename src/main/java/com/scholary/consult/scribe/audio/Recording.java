package com.scholary.consult.scribe.audio;

import java.time.Instant;

/**
 * A recording after normalization.
 *
 * <p>{@code audio} holds canonical WAV bytes when {@code normalized} is true. When the decoder
 * could not read the input, it holds the original bytes untouched and {@code durationMs} is 0, so
 * the recording is treated as a single segment and left to the recognition fallback chain.
 *
 * <p>The byte array is shared, not copied, by later stages and must not be modified.
 */
public record Recording(
    String id,
    String ownerId,
    byte[] audio,
    long durationMs,
    Instant createdAt,
    String subject,
    boolean normalized) {

  public boolean hasSubject() {
    return subject != null && !subject.isBlank();
  }
}
