package com.scholary.consult.scribe.refinement;

/**
 * Interface for generative-text services.
 *
 * <p>Abstracted so tests can stub the model and other providers can be plugged in.
 */
public interface GenerativeTextService {

  /**
   * Generate text for a prompt.
   *
   * @param prompt the full prompt
   * @return the generated text
   * @throws GenerativeServiceException if the call fails or returns no text
   */
  String generate(String prompt);

  /** Whether the service is configured well enough to be called. */
  boolean isAvailable();
}
