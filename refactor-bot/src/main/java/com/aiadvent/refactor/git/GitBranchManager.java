package com.aiadvent.refactor.git;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Turns the staged index into a pushed branch. */
@Component
public class GitBranchManager {

  private static final Logger log = LoggerFactory.getLogger(GitBranchManager.class);

  private final GitClient git;

  public GitBranchManager(GitClient git) {
    this.git = Objects.requireNonNull(git, "git");
  }

  public void configureIdentity(String name, String email) {
    git.run("config", "user.name", name);
    git.run("config", "user.email", email);
  }

  public void createBranch(String branchName) {
    git.run("checkout", "-B", branchName);
  }

  /** Commits the index only; files touched by the test command stay out of the commit. */
  public void commitStaged(String message) {
    git.run("commit", "-m", message);
  }

  public void push(String branchName) {
    git.run("push", "--set-upstream", "origin", branchName);
    log.info("Branch pushed: branch={}", branchName);
  }
}
