package com.aiadvent.refactor.patch;

/** Asks the generator to fix a patch that failed to apply or left its chunk's scope. */
@FunctionalInterface
public interface PatchRepairer {

  GenerationResult repair(DiffChunk chunk, String failedPatch, String applyError);
}
