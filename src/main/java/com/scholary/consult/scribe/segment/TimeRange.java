package com.scholary.consult.scribe.segment;

/**
 * A half-open time range {@code [startMs, endMs)} in milliseconds.
 *
 * <p>Segment boundaries are half-open so consecutive segments share their boundary point without
 * overlapping.
 */
public record TimeRange(long startMs, long endMs) {

  public TimeRange {
    if (startMs < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (endMs < startMs) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public long durationMs() {
    return endMs - startMs;
  }

  /** True if the instant lies in {@code [startMs, endMs)}. */
  public boolean contains(long timeMs) {
    return timeMs >= startMs && timeMs < endMs;
  }

  public boolean overlaps(TimeRange other) {
    return this.startMs < other.endMs && other.startMs < this.endMs;
  }

  /** True if {@code next} starts exactly where this range ends. */
  public boolean isFollowedBy(TimeRange next) {
    return this.endMs == next.startMs;
  }
}
