package com.aiadvent.refactor.generation;

import com.aiadvent.refactor.patch.GenerationResult;

/**
 * Contract with the text generator. Implementations return a validated result or throw; they do
 * not classify their own failures.
 */
public interface GenerationPort {

  GenerationResult generate(GenerationRequest request);

  GenerationResult repair(RepairRequest request);
}
