package com.aiadvent.refactor.github;

import com.aiadvent.refactor.config.GitHubBackendProperties;
import java.io.IOException;
import java.util.Objects;
import org.kohsuke.github.AbuseLimitHandler;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.RateLimitHandler;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
class GitHubClientFactory {

  private final GitHubBackendProperties properties;

  GitHubClientFactory(GitHubBackendProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  GitHub createClient() throws IOException {
    String token = properties.getPersonalAccessToken();
    if (!StringUtils.hasText(token)) {
      throw new GitHubClientException(
          "GitHub token is not configured (github.backend.personal-access-token / GITHUB_TOKEN)");
    }
    GitHubBuilder builder = new GitHubBuilder();
    builder.withRateLimitHandler(RateLimitHandler.WAIT);
    builder.withAbuseLimitHandler(AbuseLimitHandler.WAIT);
    if (StringUtils.hasText(properties.getBaseUrl())) {
      builder.withEndpoint(properties.getBaseUrl().trim());
    }
    return builder.withOAuthToken(token.trim()).build();
  }
}
