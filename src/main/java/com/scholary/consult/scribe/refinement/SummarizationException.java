package com.scholary.consult.scribe.refinement;

/**
 * Exception thrown when a summary could not be generated.
 *
 * <p>Unlike improvement failures, which fall back to the original text, these reach the caller.
 */
public class SummarizationException extends RuntimeException {

  public SummarizationException(String message) {
    super(message);
  }

  public SummarizationException(String message, Throwable cause) {
    super(message, cause);
  }
}
