package com.aiadvent.refactor.github;

/** GitHub API failure with the HTTP status (or -1 when none was received) and response body. */
public class GitHubClientException extends RuntimeException {

  private final int status;
  private final String body;

  public GitHubClientException(String message, int status, String body, Throwable cause) {
    super(message, cause);
    this.status = status;
    this.body = body;
  }

  public GitHubClientException(String message) {
    this(message, -1, null, null);
  }

  public int getStatus() {
    return status;
  }

  public String getBody() {
    return body;
  }
}
