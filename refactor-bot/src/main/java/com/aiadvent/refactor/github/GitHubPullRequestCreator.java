package com.aiadvent.refactor.github;

import com.aiadvent.refactor.config.GitHubBackendProperties;
import com.aiadvent.refactor.pipeline.PullRequestCreator;
import com.aiadvent.refactor.pipeline.PullRequestRef;
import java.io.IOException;
import java.util.Objects;
import org.kohsuke.github.GHPullRequest;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.HttpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
class GitHubPullRequestCreator implements PullRequestCreator {

  private static final Logger log = LoggerFactory.getLogger(GitHubPullRequestCreator.class);

  private final GitHubClientFactory clientFactory;
  private final GitHubBackendProperties properties;

  GitHubPullRequestCreator(GitHubClientFactory clientFactory, GitHubBackendProperties properties) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public PullRequestRef create(
      String owner, String repository, String title, String body, String head, String base) {
    String fullName = owner + "/" + repository;
    try {
      GitHub github = clientFactory.createClient();
      GHRepository repo = github.getRepository(fullName);
      GHPullRequest pullRequest =
          repo.createPullRequest(title, head, base, body, true, properties.isDraftPullRequests());
      String url = pullRequest.getHtmlUrl() != null ? pullRequest.getHtmlUrl().toString() : "";
      log.info(
          "github.create_pull_request completed: repository={}, number={}, head={}, base={}",
          fullName,
          pullRequest.getNumber(),
          head,
          base);
      return new PullRequestRef(url, pullRequest.getNumber());
    } catch (HttpException ex) {
      throw new GitHubClientException(
          "Failed to create pull request in "
              + fullName
              + ": HTTP "
              + ex.getResponseCode()
              + " "
              + ex.getMessage(),
          ex.getResponseCode(),
          ex.getMessage(),
          ex);
    } catch (IOException ex) {
      throw new GitHubClientException(
          "Failed to create pull request in " + fullName + ": " + ex.getMessage(), -1, null, ex);
    }
  }
}
