package com.aiadvent.refactor.patch;

/** Applies a unified diff to the working tree and index. */
public interface PatchApplier {

  /**
   * @throws PatchApplyException when the patch does not apply cleanly; the message carries the
   *     tool's diagnostics so it can be fed back into a repair request
   */
  void apply(String patch);
}
