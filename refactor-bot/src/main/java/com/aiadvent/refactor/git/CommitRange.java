package com.aiadvent.refactor.git;

import java.util.Objects;

public record CommitRange(String baseSha, String headSha) {

  public CommitRange {
    Objects.requireNonNull(baseSha, "baseSha");
    Objects.requireNonNull(headSha, "headSha");
  }

  public String shortForm() {
    return abbreviate(baseSha) + ".." + abbreviate(headSha);
  }

  private static String abbreviate(String sha) {
    return sha.length() > 12 ? sha.substring(0, 12) : sha;
  }
}
