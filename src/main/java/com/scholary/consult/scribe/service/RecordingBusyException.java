package com.scholary.consult.scribe.service;

/** Exception thrown when a run could not get the lock for its recording in time. */
public class RecordingBusyException extends RuntimeException {

  public RecordingBusyException(String message) {
    super(message);
  }

  public RecordingBusyException(String message, Throwable cause) {
    super(message, cause);
  }
}
