package com.aiadvent.refactor.patch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PatchApplyStateMachineTest {

  private static final DiffChunk CHUNK =
      new DiffChunk(List.of("src/app.ts"), "diff --git a/src/app.ts b/src/app.ts", List.of());

  @Mock private PatchApplier applier;
  @Mock private PatchRepairer repairer;

  private MeterRegistry meterRegistry;
  private PatchLifecycleStats stats;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    stats = new PatchLifecycleStats();
  }

  @Test
  void appliesSafeInScopePatch() {
    String patch = formattingPatch("src/app.ts");
    PatchApplyStateMachine machine = machine(BehaviorGuardMode.STRICT, 2);

    CandidateOutcome outcome = machine.drive(new PatchCandidate(CHUNK, patch), repairer, stats);

    assertThat(outcome.status()).isEqualTo(CandidateOutcome.Status.APPLIED);
    verify(applier).apply(patch);
    verifyNoInteractions(repairer);
    assertThat(stats.applied()).isEqualTo(1);
    assertThat(meterRegistry.counter("refactor_patch_applied_total").count()).isEqualTo(1.0d);
  }

  @Test
  void outOfScopePatchIsRepairedBeforeAnyApply() {
    String outOfScope = formattingPatch("src/other.ts");
    String repaired = formattingPatch("src/app.ts");
    when(repairer.repair(eq(CHUNK), eq(outOfScope), contains("outside chunk scope")))
        .thenReturn(GenerationResult.patch(repaired, "raw"));

    CandidateOutcome outcome =
        machine(BehaviorGuardMode.STRICT, 2)
            .drive(new PatchCandidate(CHUNK, outOfScope), repairer, stats);

    assertThat(outcome.status()).isEqualTo(CandidateOutcome.Status.APPLIED);
    verify(applier, never()).apply(outOfScope);
    verify(applier).apply(repaired);
    assertThat(stats.repairAttempts()).isEqualTo(1);
    assertThat(stats.scopeGuardBlocked()).isZero();
  }

  @Test
  void persistentScopeViolationIsSkippedNotFatal() {
    String outOfScope = formattingPatch("src/other.ts");
    when(repairer.repair(any(), anyString(), anyString()))
        .thenReturn(GenerationResult.patch(outOfScope, "raw"));

    CandidateOutcome outcome =
        machine(BehaviorGuardMode.STRICT, 2)
            .drive(new PatchCandidate(CHUNK, outOfScope), repairer, stats);

    assertThat(outcome.status()).isEqualTo(CandidateOutcome.Status.SKIPPED_SCOPE);
    assertThat(outcome.isHardFailure()).isFalse();
    assertThat(stats.repairAttempts()).isEqualTo(2);
    assertThat(stats.scopeGuardBlocked()).isEqualTo(1);
    verifyNoInteractions(applier);
  }

  @Test
  void guardBlockAbandonsWithoutRepair() {
    String semantic = semanticPatch("src/app.ts");

    CandidateOutcome outcome =
        machine(BehaviorGuardMode.STRICT, 2)
            .drive(new PatchCandidate(CHUNK, semantic), repairer, stats);

    assertThat(outcome.status()).isEqualTo(CandidateOutcome.Status.SKIPPED_GUARD);
    assertThat(outcome.detail()).contains("semantic token changes in src/app.ts");
    assertThat(stats.behaviorGuardBlocked()).isEqualTo(1);
    assertThat(stats.repairAttempts()).isZero();
    verifyNoInteractions(applier, repairer);
  }

  @Test
  void guardOffLetsSemanticPatchThrough() {
    String semantic = semanticPatch("src/app.ts");

    CandidateOutcome outcome =
        machine(BehaviorGuardMode.OFF, 2)
            .drive(new PatchCandidate(CHUNK, semantic), repairer, stats);

    assertThat(outcome.status()).isEqualTo(CandidateOutcome.Status.APPLIED);
    verify(applier).apply(semantic);
  }

  @Test
  void applyFailureIsRepairedWithRawError() {
    String broken = formattingPatch("src/app.ts");
    String fixed = broken + "\n ";
    doThrow(new PatchApplyException("error: patch failed: src/app.ts:1"))
        .when(applier)
        .apply(broken);
    doNothing().when(applier).apply(fixed);
    when(repairer.repair(CHUNK, broken, "error: patch failed: src/app.ts:1"))
        .thenReturn(GenerationResult.patch(fixed, "raw"));

    CandidateOutcome outcome =
        machine(BehaviorGuardMode.STRICT, 1)
            .drive(new PatchCandidate(CHUNK, broken), repairer, stats);

    assertThat(outcome.status()).isEqualTo(CandidateOutcome.Status.APPLIED);
    assertThat(stats.repairAttempts()).isEqualTo(1);
    assertThat(meterRegistry.counter("refactor_patch_apply_attempt_total").count())
        .isEqualTo(2.0d);
  }

  @Test
  void repairWithoutPatchAbandonsCandidate() {
    String broken = formattingPatch("src/app.ts");
    doThrow(new PatchApplyException("does not apply")).when(applier).apply(broken);
    when(repairer.repair(any(), anyString(), anyString()))
        .thenReturn(GenerationResult.noChanges("NO_CHANGES_NEEDED"));

    CandidateOutcome outcome =
        machine(BehaviorGuardMode.STRICT, 2)
            .drive(new PatchCandidate(CHUNK, broken), repairer, stats);

    assertThat(outcome.status()).isEqualTo(CandidateOutcome.Status.SKIPPED_NO_REPAIR);
    assertThat(outcome.detail()).isEqualTo("repair did not produce a patch");
    assertThat(stats.repairNoPatch()).isEqualTo(1);
    assertThat(stats.repairAttempts()).isEqualTo(1);
  }

  @Test
  void exhaustedApplyFailureIsHard() {
    String broken = formattingPatch("src/app.ts");
    doThrow(new PatchApplyException("does not apply")).when(applier).apply(anyString());
    when(repairer.repair(any(), anyString(), anyString()))
        .thenReturn(GenerationResult.patch(broken, "raw"));

    CandidateOutcome outcome =
        machine(BehaviorGuardMode.STRICT, 2)
            .drive(new PatchCandidate(CHUNK, broken), repairer, stats);

    assertThat(outcome.isHardFailure()).isTrue();
    assertThat(outcome.detail()).isEqualTo("does not apply");
    verify(applier, times(3)).apply(broken);
    assertThat(stats.repairAttempts()).isEqualTo(2);
  }

  @Test
  void zeroRepairBudgetFailsOnFirstError() {
    String broken = formattingPatch("src/app.ts");
    doThrow(new PatchApplyException("does not apply")).when(applier).apply(broken);

    CandidateOutcome outcome =
        machine(BehaviorGuardMode.STRICT, 0)
            .drive(new PatchCandidate(CHUNK, broken), repairer, stats);

    assertThat(outcome.isHardFailure()).isTrue();
    verifyNoInteractions(repairer);
  }

  private PatchApplyStateMachine machine(BehaviorGuardMode mode, int attempts) {
    return new PatchApplyStateMachine(applier, mode, attempts, meterRegistry);
  }

  private static String formattingPatch(String file) {
    return String.join(
        "\n",
        "diff --git a/" + file + " b/" + file,
        "--- a/" + file,
        "+++ b/" + file,
        "@@ -1 +1 @@",
        "-const x=1;",
        "+const x = 1;");
  }

  private static String semanticPatch(String file) {
    return String.join(
        "\n",
        "diff --git a/" + file + " b/" + file,
        "--- a/" + file,
        "+++ b/" + file,
        "@@ -1 +1 @@",
        "-const x = 1;",
        "+const x = 2;");
  }
}
