package com.aiadvent.refactor.patch;

/** The generator reply contains neither the no-changes sentinel nor a recognisable diff. */
public class InvalidPatchOutputException extends RuntimeException {

  public InvalidPatchOutputException(String message) {
    super(message);
  }

  public InvalidPatchOutputException(String message, Throwable cause) {
    super(message, cause);
  }
}
