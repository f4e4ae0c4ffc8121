package com.aiadvent.refactor.generation;

import com.aiadvent.refactor.patch.DiffChunk;
import java.util.Objects;

public record RepairRequest(
    String repository,
    String baseRef,
    String headRef,
    DiffChunk chunk,
    String failedPatch,
    String applyError,
    UsageStats usage) {

  public RepairRequest {
    Objects.requireNonNull(repository, "repository");
    Objects.requireNonNull(chunk, "chunk");
    Objects.requireNonNull(failedPatch, "failedPatch");
    applyError = applyError == null ? "" : applyError;
  }
}
