package com.aiadvent.refactor.patch;

/** A diff was found but it is structurally unacceptable. */
public class PatchValidationException extends InvalidPatchOutputException {

  public PatchValidationException(String message) {
    super(message);
  }
}
