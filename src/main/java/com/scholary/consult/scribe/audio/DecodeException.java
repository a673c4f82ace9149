package com.scholary.consult.scribe.audio;

/**
 * Exception thrown when input audio cannot be turned into canonical PCM.
 *
 * <p>{@link Reason#TOO_SMALL} is terminal for the recording. {@link Reason#UNREADABLE} means only
 * the preferred decode path failed; callers may still hand the original bytes to the recognition
 * fallback chain.
 */
public class DecodeException extends RuntimeException {

  public enum Reason {
    TOO_SMALL,
    UNREADABLE
  }

  private final Reason reason;

  public DecodeException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public DecodeException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
