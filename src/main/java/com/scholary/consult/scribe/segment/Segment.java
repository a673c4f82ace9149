package com.scholary.consult.scribe.segment;

/**
 * One slice of a recording submitted to the recognition service.
 *
 * <p>A {@code whole} segment is the implicit single segment of a short recording: its audio is the
 * recording's own byte array and it was never physically split.
 */
public record Segment(
    String recordingId, int index, TimeRange range, byte[] audio, boolean whole) {

  public long startMs() {
    return range.startMs();
  }

  public long endMs() {
    return range.endMs();
  }

  /** Human-facing 1-based number, used in stitched headers and logs. */
  public int number() {
    return index + 1;
  }
}
