package com.scholary.consult.scribe.recognition;

import java.time.Duration;

/**
 * Interface for speech-to-text services.
 *
 * <p>This abstraction keeps the retry and fallback policy in {@link RecognitionClient} independent
 * of the provider. Implementations make exactly one request per call and must not retry.
 */
public interface RecognitionService {

  /**
   * Recognize speech in one piece of audio.
   *
   * @param request the audio and locale
   * @param deadline the maximum time this single call may take
   * @return the recognized text, possibly blank
   * @throws RecognitionTimeoutException if the deadline passes
   * @throws SpeechNotUnderstoodException if the service could not make out any speech
   * @throws RecognitionException for any other service or request error
   */
  String recognize(RecognitionRequest request, Duration deadline);
}
