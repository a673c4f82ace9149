package com.scholary.consult.scribe.transcript;

import java.time.Instant;
import java.util.List;

/**
 * Stitched result of recognizing every segment of a recording.
 *
 * <p>{@code fragments} are in segment order; an unsegmented recording has exactly one.
 */
public record Transcript(
    String id,
    String ownerId,
    String recordingId,
    List<TranscriptFragment> fragments,
    String text,
    Instant createdAt) {

  public Transcript {
    fragments = List.copyOf(fragments);
  }

  public boolean fullySucceeded() {
    return fragments.stream().allMatch(TranscriptFragment::succeeded);
  }
}
