package com.scholary.consult.scribe.recognition;

/**
 * Exception thrown when a recognition call fails.
 *
 * <p>The base type covers request errors and service-side failures, neither of which is retried.
 * Subclasses distinguish timeouts and unintelligible audio.
 */
public class RecognitionException extends RuntimeException {

  public RecognitionException(String message) {
    super(message);
  }

  public RecognitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
