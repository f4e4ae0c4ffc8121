package com.aiadvent.refactor.pipeline;

public record PullRequestRef(String url, int number) {}
