package com.scholary.consult.scribe.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of one log call, so log shippers can
 * index them as separate fields instead of parsing the message.
 */
public class StructuredLogger {

  public static final String CORRELATION_ID = "correlationId";
  public static final String RECORDING_ID = "recordingId";
  public static final String OWNER_ID = "ownerId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log segment planning event. */
  public void logSegmentPlanned(int segmentIndex, long startMs, long endMs, int audioBytes) {
    try {
      MDC.put("event_type", "segment_planned");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("startMs", String.valueOf(startMs));
      MDC.put("endMs", String.valueOf(endMs));

      logger.debug(
          "Segment planned: index={}, range=[{}-{}]ms, bytes={}",
          segmentIndex,
          startMs,
          endMs,
          audioBytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log the audio read level that succeeded after earlier levels failed. */
  public void logReadFallback(int segmentIndex, String failedLevel, String message) {
    try {
      MDC.put("event_type", "read_fallback");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("readLevel", failedLevel);

      logger.warn(
          "Audio read failed: segment={}, level={}, trying next level: {}",
          segmentIndex,
          failedLevel,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log fragment recognized event. */
  public void logFragmentRecognized(
      int segmentIndex, String status, int textLength, int attempts, long recognizeMs) {
    try {
      MDC.put("event_type", "fragment_recognized");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("status", status);
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("recognizeMs", String.valueOf(recognizeMs));

      logger.info(
          "Fragment recognized: segment={}, status={}, chars={}, attempts={}, took={}ms",
          segmentIndex,
          status,
          textLength,
          attempts,
          recognizeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log recognition retry event. */
  public void logRecognitionRetry(
      int segmentIndex, int attempt, int maxAttempts, long deadlineMs, String message) {
    try {
      MDC.put("event_type", "recognition_retry");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("deadlineMs", String.valueOf(deadlineMs));

      logger.warn(
          "Recognition timed out: segment={}, attempt={}/{}, deadline={}ms, message={}",
          segmentIndex,
          attempt,
          maxAttempts,
          deadlineMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log recognition failure event. */
  public void logRecognitionFailed(int segmentIndex, String status, String message) {
    try {
      MDC.put("event_type", "recognition_failed");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("status", status);

      logger.error(
          "Recognition failed: segment={}, status={}, message={}", segmentIndex, status, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String correlationId, String ownerId, String recordingId) {
    MDC.put(CORRELATION_ID, correlationId);
    if (ownerId != null) {
      MDC.put(OWNER_ID, ownerId);
    }
    if (recordingId != null) {
      MDC.put(RECORDING_ID, recordingId);
    }
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove(CORRELATION_ID);
    MDC.remove(OWNER_ID);
    MDC.remove(RECORDING_ID);
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("segment_index");
    MDC.remove("startMs");
    MDC.remove("endMs");
    MDC.remove("readLevel");
    MDC.remove("status");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("deadlineMs");
    MDC.remove("recognizeMs");
  }
}
