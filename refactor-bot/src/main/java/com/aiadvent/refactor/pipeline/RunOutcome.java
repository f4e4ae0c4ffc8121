package com.aiadvent.refactor.pipeline;

import com.aiadvent.refactor.generation.ModelFailureSubtype;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * The single result of a run: skipped for a reason from a closed set, or a created pull request.
 * Fields that do not belong to the case are {@code null} (or zero for chunk counts).
 */
public record RunOutcome(
    Status status,
    SkipReason reason,
    String detail,
    ModelFailureSubtype modelFailureSubtype,
    int failedChunks,
    int totalChunks,
    String branchName,
    String pullRequestUrl,
    List<String> files,
    String changeSummary) {

  public enum Status {
    SKIPPED,
    CREATED
  }

  public enum SkipReason {
    NO_DIFF,
    NO_PATCH,
    TEST_FAILURE,
    PATCH_APPLY_FAILURE,
    MODEL_FAILURE;

    public String code() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public RunOutcome {
    Objects.requireNonNull(status, "status");
    if (status == Status.SKIPPED && reason == null) {
      throw new IllegalArgumentException("skipped outcome requires a reason");
    }
    if (status == Status.CREATED && (branchName == null || pullRequestUrl == null)) {
      throw new IllegalArgumentException("created outcome requires branch and pull request url");
    }
    files = files == null ? List.of() : List.copyOf(files);
  }

  public static RunOutcome skipped(SkipReason reason, String detail) {
    if (reason == SkipReason.MODEL_FAILURE) {
      throw new IllegalArgumentException("use modelFailure(...) for model failures");
    }
    return new RunOutcome(Status.SKIPPED, reason, detail, null, 0, 0, null, null, null, null);
  }

  public static RunOutcome modelFailure(
      ModelFailureSubtype subtype, int failedChunks, int totalChunks) {
    Objects.requireNonNull(subtype, "subtype");
    return new RunOutcome(
        Status.SKIPPED,
        SkipReason.MODEL_FAILURE,
        failedChunks + " of " + totalChunks + " chunks failed (" + subtype.code() + ")",
        subtype,
        failedChunks,
        totalChunks,
        null,
        null,
        null,
        null);
  }

  public static RunOutcome created(
      String branchName, String pullRequestUrl, List<String> files, String changeSummary) {
    return new RunOutcome(
        Status.CREATED, null, null, null, 0, 0, branchName, pullRequestUrl, files, changeSummary);
  }

  public boolean isCreated() {
    return status == Status.CREATED;
  }

  /** {@code created}, or {@code skipped(<reason>)}. */
  public String label() {
    return isCreated() ? "created" : "skipped(" + reason.code() + ")";
  }
}
