package com.scholary.consult.scribe.recognition;

import com.scholary.consult.scribe.logging.StructuredLogger;
import com.scholary.consult.scribe.segment.Segment;
import com.scholary.consult.scribe.transcript.TranscriptFragment;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns one segment into one transcript fragment.
 *
 * <p>The segment is read through the fallback chain, then sent to the recognition service. Only
 * timeouts are retried: each retry waits a fixed backoff and gets a wider deadline than the one
 * before. Every other outcome ends the segment immediately. Failures never escape as exceptions;
 * they come back as a fragment with the matching status.
 */
@Component
public class RecognitionClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecognitionClient.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final FallbackAudioReader audioReader;
  private final RecognitionService recognitionService;
  private final RecognitionProperties properties;

  public RecognitionClient(
      FallbackAudioReader audioReader,
      RecognitionService recognitionService,
      RecognitionProperties properties) {
    this.audioReader = audioReader;
    this.recognitionService = recognitionService;
    this.properties = properties;
  }

  /**
   * Recognize a segment.
   *
   * @param segment the segment to recognize
   * @return exactly one fragment for the segment
   */
  public TranscriptFragment recognize(Segment segment) {
    long startTime = System.currentTimeMillis();
    int index = segment.index();
    boolean whole = segment.whole();

    PreparedAudio audio;
    try {
      audio = audioReader.read(segment);
    } catch (AudioReadException e) {
      structuredLogger.logRecognitionFailed(index, "SERVICE_ERROR", e.getMessage());
      return TranscriptFragment.serviceError(index, e.getMessage(), whole);
    }

    RecognitionRequest request =
        new RecognitionRequest(audio.pcm(), audio.sampleRate(), properties.locale());
    int maxAttempts = properties.maxAttempts();

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      Duration deadline = deadlineFor(attempt);
      try {
        String text = recognitionService.recognize(request, deadline);
        TranscriptFragment fragment =
            text == null || text.isBlank()
                ? TranscriptFragment.empty(index, whole)
                : TranscriptFragment.ok(index, text.strip(), whole);
        structuredLogger.logFragmentRecognized(
            index,
            fragment.status().name(),
            text == null ? 0 : text.length(),
            attempt,
            System.currentTimeMillis() - startTime);
        return fragment;

      } catch (RecognitionTimeoutException e) {
        structuredLogger.logRecognitionRetry(
            index, attempt, maxAttempts, deadline.toMillis(), e.getMessage());
        if (attempt < maxAttempts && !backOff()) {
          return TranscriptFragment.serviceError(index, "Recognition interrupted", whole);
        }

      } catch (SpeechNotUnderstoodException e) {
        structuredLogger.logRecognitionFailed(index, "UNRECOGNIZED", e.getMessage());
        return TranscriptFragment.unrecognized(index, whole);

      } catch (RecognitionException e) {
        structuredLogger.logRecognitionFailed(index, "SERVICE_ERROR", e.getMessage());
        return TranscriptFragment.serviceError(index, e.getMessage(), whole);
      }
    }

    structuredLogger.logRecognitionFailed(
        index, "TIMEOUT", String.format("Gave up after %d attempts", maxAttempts));
    return TranscriptFragment.timeout(index, whole);
  }

  /** Deadline for a 1-based attempt number. */
  Duration deadlineFor(int attempt) {
    return Duration.ofSeconds(
        properties.initialDeadlineSeconds()
            + (long) (attempt - 1) * properties.deadlineIncrementSeconds());
  }

  private boolean backOff() {
    try {
      Thread.sleep(properties.retryBackoffMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
