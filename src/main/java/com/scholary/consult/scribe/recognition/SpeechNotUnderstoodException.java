package com.scholary.consult.scribe.recognition;

/** The service processed the audio but found no intelligible speech. Not retried. */
public class SpeechNotUnderstoodException extends RecognitionException {

  public SpeechNotUnderstoodException(String message) {
    super(message);
  }
}
