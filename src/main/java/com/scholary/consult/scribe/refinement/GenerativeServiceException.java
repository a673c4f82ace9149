package com.scholary.consult.scribe.refinement;

/** Exception thrown when a generative-text call fails or yields no text. */
public class GenerativeServiceException extends RuntimeException {

  public GenerativeServiceException(String message) {
    super(message);
  }

  public GenerativeServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
