package com.aiadvent.refactor.patch;

import java.util.Objects;

public record CandidateOutcome(Status status, String detail) {

  public enum Status {
    APPLIED,
    SKIPPED_SCOPE,
    SKIPPED_GUARD,
    SKIPPED_NO_REPAIR,
    HARD_FAILURE
  }

  public CandidateOutcome {
    Objects.requireNonNull(status, "status");
    detail = detail == null ? "" : detail;
  }

  public static CandidateOutcome applied() {
    return new CandidateOutcome(Status.APPLIED, "");
  }

  public static CandidateOutcome of(Status status, String detail) {
    return new CandidateOutcome(status, detail);
  }

  public boolean isHardFailure() {
    return status == Status.HARD_FAILURE;
  }
}
