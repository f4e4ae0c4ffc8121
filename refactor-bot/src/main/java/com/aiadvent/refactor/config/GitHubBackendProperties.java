package com.aiadvent.refactor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "github.backend")
public class GitHubBackendProperties {

  private String baseUrl = "https://api.github.com";
  private String personalAccessToken;
  private boolean draftPullRequests = false;

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getPersonalAccessToken() {
    return personalAccessToken;
  }

  public void setPersonalAccessToken(String personalAccessToken) {
    this.personalAccessToken = personalAccessToken;
  }

  public boolean isDraftPullRequests() {
    return draftPullRequests;
  }

  public void setDraftPullRequests(boolean draftPullRequests) {
    this.draftPullRequests = draftPullRequests;
  }
}
