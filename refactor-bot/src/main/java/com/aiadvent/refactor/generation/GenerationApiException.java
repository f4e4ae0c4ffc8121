package com.aiadvent.refactor.generation;

/** The generation endpoint answered with an error status or an unreadable body. */
public class GenerationApiException extends RuntimeException {

  private final int status;
  private final String payload;

  public GenerationApiException(int status, String payload, String message) {
    super(message);
    this.status = status;
    this.payload = payload;
  }

  public GenerationApiException(int status, String payload, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
    this.payload = payload;
  }

  public int getStatus() {
    return status;
  }

  public String getPayload() {
    return payload;
  }

  /** Server errors, throttling and successful responses with a malformed body are worth a retry. */
  public boolean isRetryable() {
    return status >= 500 || status == 429 || (status >= 200 && status < 300);
  }
}
