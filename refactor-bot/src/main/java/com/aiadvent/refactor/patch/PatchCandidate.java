package com.aiadvent.refactor.patch;

import java.util.Objects;

/** A generated patch tied to the chunk it was generated for; the text changes on every repair. */
public final class PatchCandidate {

  private final DiffChunk chunk;
  private String patch;
  private int repairAttempts;

  public PatchCandidate(DiffChunk chunk, String patch) {
    this.chunk = Objects.requireNonNull(chunk, "chunk");
    this.patch = requirePatch(patch);
  }

  public DiffChunk chunk() {
    return chunk;
  }

  public String patch() {
    return patch;
  }

  public int repairAttempts() {
    return repairAttempts;
  }

  void recordRepairAttempt() {
    repairAttempts++;
  }

  void replacePatch(String repaired) {
    this.patch = requirePatch(repaired);
  }

  private static String requirePatch(String patch) {
    if (patch == null || patch.isBlank()) {
      throw new IllegalArgumentException("patch must not be blank");
    }
    return patch;
  }
}
