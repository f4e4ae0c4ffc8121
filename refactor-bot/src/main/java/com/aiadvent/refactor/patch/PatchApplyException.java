package com.aiadvent.refactor.patch;

public class PatchApplyException extends RuntimeException {

  public PatchApplyException(String message) {
    super(message);
  }

  public PatchApplyException(String message, Throwable cause) {
    super(message, cause);
  }
}
