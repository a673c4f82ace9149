package com.scholary.consult.scribe.recognition;

/** The recognition call did not complete within its deadline. Transient; retried. */
public class RecognitionTimeoutException extends RecognitionException {

  public RecognitionTimeoutException(String message) {
    super(message);
  }

  public RecognitionTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
