package com.aiadvent.refactor.patch;

/** Per-run counters of what happened to generated patches. Only ever incremented. */
public final class PatchLifecycleStats {

  private int generated;
  private int applied;
  private int behaviorGuardBlocked;
  private int scopeGuardBlocked;
  private int repairAttempts;
  private int repairNoPatch;
  private int failedChunks;
  private int skippedChunks;

  public void recordGenerated() {
    generated++;
  }

  public void recordApplied() {
    applied++;
  }

  public void recordBehaviorGuardBlocked() {
    behaviorGuardBlocked++;
  }

  public void recordScopeGuardBlocked() {
    scopeGuardBlocked++;
  }

  public void recordRepairAttempt() {
    repairAttempts++;
  }

  public void recordRepairNoPatch() {
    repairNoPatch++;
  }

  public void recordFailedChunk() {
    failedChunks++;
  }

  public void recordSkippedChunk() {
    skippedChunks++;
  }

  public int generated() {
    return generated;
  }

  public int applied() {
    return applied;
  }

  public int behaviorGuardBlocked() {
    return behaviorGuardBlocked;
  }

  public int scopeGuardBlocked() {
    return scopeGuardBlocked;
  }

  public int repairAttempts() {
    return repairAttempts;
  }

  public int repairNoPatch() {
    return repairNoPatch;
  }

  public int failedChunks() {
    return failedChunks;
  }

  public int skippedChunks() {
    return skippedChunks;
  }
}
