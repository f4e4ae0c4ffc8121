package com.aiadvent.refactor.pipeline;

/** Publishes a pushed branch as a pull request against the base branch. */
public interface PullRequestCreator {

  PullRequestRef create(
      String owner, String repository, String title, String body, String head, String base);
}
