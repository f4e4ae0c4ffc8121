package com.aiadvent.refactor.generation;

/** Connection level failure talking to the generation endpoint (refused, reset, DNS). */
public class GenerationTransportException extends RuntimeException {

  public GenerationTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
