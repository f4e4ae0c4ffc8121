package com.aiadvent.refactor.pipeline;

import com.aiadvent.refactor.generation.UsageStats;
import com.aiadvent.refactor.git.CommitRange;
import com.aiadvent.refactor.git.StagedFileStat;
import com.aiadvent.refactor.patch.BehaviorGuardMode;
import com.aiadvent.refactor.patch.FileCategory;
import com.aiadvent.refactor.patch.FileClassifier;
import com.aiadvent.refactor.patch.PatchLifecycleStats;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;

/** Renders the markdown body of the refactor pull request. */
final class PullRequestBodyBuilder {

  private PullRequestBodyBuilder() {}

  record Input(
      CommitRange range,
      int totalChunks,
      int selectedChunks,
      PatchLifecycleStats stats,
      List<StagedFileStat> files,
      String changeSummary,
      UsageStats.Snapshot usage,
      BehaviorGuardMode guardMode,
      String testCommand) {}

  static String build(Input input) {
    PatchLifecycleStats stats = input.stats();
    StringJoiner body = new StringJoiner("\n");
    body.add("## Summary");
    body.add(
        "Automated behavior-preserving refactor of the latest push ("
            + input.changeSummary()
            + ").");
    body.add("");

    body.add("## Why These Changes");
    body.add(
        "- Chunk coverage: "
            + input.selectedChunks()
            + " of "
            + input.totalChunks()
            + " chunks analysed");
    body.add(
        "- Patches: " + stats.generated() + " generated, " + stats.applied() + " applied");
    body.add(
        "- Chunk outcomes: "
            + stats.skippedChunks()
            + " needed no changes, "
            + stats.failedChunks()
            + " failed");
    body.add("");

    body.add("## What Changed");
    if (input.files().isEmpty()) {
      body.add("- (no per-file statistics available)");
    }
    for (StagedFileStat file : input.files()) {
      if (file.binary()) {
        body.add("- `" + file.path() + "` (binary)");
      } else {
        body.add(
            "- `" + file.path() + "` (+" + file.additions() + "/-" + file.deletions() + ")");
      }
    }
    body.add("");

    body.add("## Potential Impact");
    for (String note : impactNotes(input.files(), input.guardMode())) {
      body.add("- " + note);
    }
    body.add("");

    body.add("## Safety Checks");
    body.add("- Behavior guard mode: " + input.guardMode().code());
    body.add("- Patches blocked by behavior guard: " + stats.behaviorGuardBlocked());
    body.add("- Patches blocked by scope guard: " + stats.scopeGuardBlocked());
    body.add(
        "- Repair attempts: "
            + stats.repairAttempts()
            + " (without patch: "
            + stats.repairNoPatch()
            + ")");
    body.add("- Test command passed: `" + input.testCommand() + "`");
    body.add("");

    UsageStats.Snapshot usage = input.usage();
    body.add("## Run Cost");
    body.add(
        "- HTTP requests: "
            + usage.httpRequests()
            + " (retries: "
            + usage.retryCount()
            + ", successful: "
            + usage.successfulResponses()
            + ")");
    body.add(
        "- Tokens: "
            + usage.totalTokens()
            + " (prompt "
            + usage.promptTokens()
            + ", completion "
            + usage.completionTokens()
            + ")");
    body.add("- Cost: $" + String.format(Locale.ROOT, "%.6f", usage.totalCostUsd()));
    body.add(
        "- Latency: avg "
            + usage.averageLatencyMs()
            + " ms, max "
            + usage.maxLatencyMs()
            + " ms");
    body.add("");

    body.add("## Source Range");
    body.add("- Base: `" + input.range().baseSha() + "`");
    body.add("- Head: `" + input.range().headSha() + "`");
    body.add("");
    body.add("No intended behavior changes.");
    return body.toString();
  }

  static List<String> impactNotes(List<StagedFileStat> files, BehaviorGuardMode guardMode) {
    Set<FileCategory> categories = EnumSet.noneOf(FileCategory.class);
    for (StagedFileStat file : files) {
      categories.add(FileClassifier.classify(file.path()));
    }
    List<String> notes = new ArrayList<>();
    if (categories.contains(FileCategory.SOURCE)) {
      notes.add(
          guardMode == BehaviorGuardMode.STRICT
              ? "Source edits are token-equivalent to the original (formatting and layout only)."
              : "Source files changed with the behavior guard disabled; review logic carefully.");
    }
    if (categories.contains(FileCategory.TEST)) {
      notes.add("Test code changed; production behavior is unaffected.");
    }
    if (categories.contains(FileCategory.DOC)) {
      notes.add("Documentation wording changed.");
    }
    if (categories.contains(FileCategory.CONFIG)) {
      notes.add("Configuration files changed; verify environments that consume them.");
    }
    if (categories.contains(FileCategory.GENERATED) || categories.contains(FileCategory.OTHER)) {
      notes.add("Other files changed; review them manually.");
    }
    if (notes.isEmpty()) {
      notes.add("Low risk: no functional files changed.");
    }
    return notes;
  }
}
