package com.scholary.consult.scribe.recognition;

/** Exception thrown when a read strategy cannot turn segment bytes into recognizable audio. */
public class AudioReadException extends RuntimeException {

  public AudioReadException(String message) {
    super(message);
  }

  public AudioReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
