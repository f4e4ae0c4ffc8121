package com.aiadvent.refactor.generation;

import com.aiadvent.refactor.patch.DiffChunk;
import java.util.Objects;

public record GenerationRequest(
    String repository, String baseRef, String headRef, DiffChunk chunk, UsageStats usage) {

  public GenerationRequest {
    Objects.requireNonNull(repository, "repository");
    Objects.requireNonNull(baseRef, "baseRef");
    Objects.requireNonNull(headRef, "headRef");
    Objects.requireNonNull(chunk, "chunk");
  }
}
