package com.scholary.consult.scribe.transcript;

/** Outcome of recognizing one segment. */
public enum FragmentStatus {
  OK,
  EMPTY,
  UNRECOGNIZED,
  SERVICE_ERROR,
  TIMEOUT
}
