package com.aiadvent.refactor.pipeline;

import com.aiadvent.refactor.git.CommitRange;
import com.aiadvent.refactor.patch.PatchLifecycleStats;
import java.util.Objects;

public record RunResult(CommitRange range, RunOutcome outcome, PatchLifecycleStats stats) {

  public RunResult {
    Objects.requireNonNull(outcome, "outcome");
    stats = stats == null ? new PatchLifecycleStats() : stats;
  }
}
