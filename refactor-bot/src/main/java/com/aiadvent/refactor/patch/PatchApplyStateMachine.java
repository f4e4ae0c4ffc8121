package com.aiadvent.refactor.patch;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Drives one candidate through scope check, behavior guard and apply, requesting repairs while the
 * budget lasts.
 *
 * <pre>
 * PENDING -> APPLYING -> APPLIED
 *                    \-> REPAIR_REQUESTED -> PENDING | ABANDONED
 * </pre>
 *
 * A guard block abandons the candidate immediately. An out-of-scope patch takes the repair path
 * and, once the budget is spent, is skipped rather than failing the run. Only a genuine apply error
 * with no attempts left is surfaced as {@link CandidateOutcome.Status#HARD_FAILURE}.
 */
public class PatchApplyStateMachine {

  private static final Logger log = LoggerFactory.getLogger(PatchApplyStateMachine.class);

  enum CandidateState {
    PENDING,
    APPLYING,
    APPLIED,
    REPAIR_REQUESTED,
    ABANDONED
  }

  private final PatchApplier applier;
  private final BehaviorGuardMode guardMode;
  private final int maxRepairAttempts;
  private final Counter applyAttemptCounter;
  private final Counter appliedCounter;
  private final Counter repairCounter;
  private final Counter guardBlockedCounter;
  private final Counter scopeBlockedCounter;

  public PatchApplyStateMachine(
      PatchApplier applier,
      BehaviorGuardMode guardMode,
      int maxRepairAttempts,
      @Nullable MeterRegistry meterRegistry) {
    this.applier = Objects.requireNonNull(applier, "applier");
    this.guardMode = Objects.requireNonNull(guardMode, "guardMode");
    if (maxRepairAttempts < 0) {
      throw new IllegalArgumentException("maxRepairAttempts must be >= 0");
    }
    this.maxRepairAttempts = maxRepairAttempts;
    MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.applyAttemptCounter = registry.counter("refactor_patch_apply_attempt_total");
    this.appliedCounter = registry.counter("refactor_patch_applied_total");
    this.repairCounter = registry.counter("refactor_patch_repair_total");
    this.guardBlockedCounter = registry.counter("refactor_patch_guard_blocked_total");
    this.scopeBlockedCounter = registry.counter("refactor_patch_scope_blocked_total");
  }

  public CandidateOutcome drive(
      PatchCandidate candidate, PatchRepairer repairer, PatchLifecycleStats stats) {
    Objects.requireNonNull(candidate, "candidate");
    Objects.requireNonNull(repairer, "repairer");
    Objects.requireNonNull(stats, "stats");
    CandidateState state = CandidateState.PENDING;
    while (true) {
      String patch = candidate.patch();
      String failure;
      boolean scopeViolation;

      Set<String> outOfScope = outOfScopeFiles(candidate);
      if (!outOfScope.isEmpty()) {
        scopeViolation = true;
        failure = "Patch touched files outside chunk scope: " + String.join(", ", outOfScope);
      } else {
        scopeViolation = false;
        if (guardMode == BehaviorGuardMode.STRICT) {
          BehaviorAssessment assessment = BehaviorGuard.assess(patch);
          if (!assessment.safe()) {
            stats.recordBehaviorGuardBlocked();
            guardBlockedCounter.increment();
            state = transition(candidate, state, CandidateState.ABANDONED);
            log.warn(
                "Patch blocked by behavior guard: files={}, reasons={}",
                candidate.chunk().files(),
                assessment.summary());
            return CandidateOutcome.of(CandidateOutcome.Status.SKIPPED_GUARD, assessment.summary());
          }
        }
        state = transition(candidate, state, CandidateState.APPLYING);
        applyAttemptCounter.increment();
        try {
          applier.apply(patch);
          stats.recordApplied();
          appliedCounter.increment();
          transition(candidate, state, CandidateState.APPLIED);
          return CandidateOutcome.applied();
        } catch (PatchApplyException ex) {
          failure = ex.getMessage();
        }
      }

      if (candidate.repairAttempts() < maxRepairAttempts) {
        candidate.recordRepairAttempt();
        stats.recordRepairAttempt();
        repairCounter.increment();
        state = transition(candidate, state, CandidateState.REPAIR_REQUESTED);
        log.info(
            "Requesting patch repair: files={}, attempt={}/{}, reason={}",
            candidate.chunk().files(),
            candidate.repairAttempts(),
            maxRepairAttempts,
            failure);
        GenerationResult repaired;
        try {
          repaired = repairer.repair(candidate.chunk(), patch, failure);
        } catch (RuntimeException ex) {
          stats.recordRepairNoPatch();
          transition(candidate, state, CandidateState.ABANDONED);
          log.warn(
              "Patch repair failed: files={}, error={}", candidate.chunk().files(), ex.getMessage());
          return CandidateOutcome.of(
              CandidateOutcome.Status.SKIPPED_NO_REPAIR, "repair failed: " + ex.getMessage());
        }
        if (!repaired.hasPatch()) {
          stats.recordRepairNoPatch();
          transition(candidate, state, CandidateState.ABANDONED);
          return CandidateOutcome.of(
              CandidateOutcome.Status.SKIPPED_NO_REPAIR, "repair did not produce a patch");
        }
        candidate.replacePatch(repaired.patch());
        state = transition(candidate, state, CandidateState.PENDING);
        continue;
      }

      transition(candidate, state, CandidateState.ABANDONED);
      if (scopeViolation) {
        stats.recordScopeGuardBlocked();
        scopeBlockedCounter.increment();
        log.warn("Patch skipped after scope violations: {}", failure);
        return CandidateOutcome.of(CandidateOutcome.Status.SKIPPED_SCOPE, failure);
      }
      return CandidateOutcome.of(CandidateOutcome.Status.HARD_FAILURE, failure);
    }
  }

  static Set<String> outOfScopeFiles(PatchCandidate candidate) {
    Set<String> outside = new LinkedHashSet<>();
    for (String file : PatchFiles.touchedFiles(candidate.patch())) {
      if (!candidate.chunk().covers(file)) {
        outside.add(file);
      }
    }
    return outside;
  }

  private static CandidateState transition(
      PatchCandidate candidate, CandidateState from, CandidateState to) {
    log.debug("patch candidate {} -> {}: files={}", from, to, candidate.chunk().files());
    return to;
  }
}
