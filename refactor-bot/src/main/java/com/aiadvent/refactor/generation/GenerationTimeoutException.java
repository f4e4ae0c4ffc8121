package com.aiadvent.refactor.generation;

public class GenerationTimeoutException extends RuntimeException {

  public GenerationTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
