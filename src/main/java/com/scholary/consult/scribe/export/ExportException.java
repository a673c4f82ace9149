package com.scholary.consult.scribe.export;

/** Exception thrown when a document cannot be rendered or written. */
public class ExportException extends RuntimeException {

  public ExportException(String message) {
    super(message);
  }

  public ExportException(String message, Throwable cause) {
    super(message, cause);
  }
}
