package com.aiadvent.refactor.generation;

import com.aiadvent.refactor.patch.PatchCandidate;
import java.util.List;
import java.util.Objects;

public record ChunkGenerationReport(
    List<PatchCandidate> candidates,
    int totalChunks,
    int skippedChunks,
    int failedChunks,
    FailureBreakdown breakdown) {

  public ChunkGenerationReport {
    candidates = candidates == null ? List.of() : List.copyOf(candidates);
    Objects.requireNonNull(breakdown, "breakdown");
  }
}
