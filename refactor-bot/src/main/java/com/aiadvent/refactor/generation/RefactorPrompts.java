package com.aiadvent.refactor.generation;

import com.aiadvent.refactor.patch.DiffChunk;
import com.aiadvent.refactor.patch.FileSnapshot;
import com.aiadvent.refactor.patch.PatchExtractor;
import java.util.StringJoiner;

final class RefactorPrompts {

  static final String SYSTEM_PROMPT =
      """
You are a senior staff engineer reviewing a freshly pushed change. Propose only \
behavior-preserving improvements to the files you are shown.
Rules:
- Do not change observable behavior, outputs, error messages or side effects.
- Improve clarity and naming of local code, reduce duplication, apply obvious performance fixes.
- Keep public APIs, exported names and signatures intact.
- Never modify database schema, migrations or persisted data formats.
- Only touch the files listed under "Changed files"; never create or delete files.
- Return ONLY a unified diff (git diff format with ---/+++ headers and @@ hunks), \
or the single line %s when nothing is worth changing."""
          .formatted(PatchExtractor.NO_CHANGES_SENTINEL);

  private RefactorPrompts() {}

  static String generationPrompt(GenerationRequest request) {
    StringJoiner joiner = header(request.repository(), request.baseRef(), request.headRef());
    appendChunk(joiner, request.chunk());
    joiner.add("");
    joiner.add(
        "Respond with a unified diff that applies to the snapshots above, or "
            + PatchExtractor.NO_CHANGES_SENTINEL
            + " if no safe improvement exists.");
    return joiner.toString();
  }

  static String repairPrompt(RepairRequest request) {
    StringJoiner joiner = header(request.repository(), request.baseRef(), request.headRef());
    appendChunk(joiner, request.chunk());
    joiner.add("");
    joiner.add("## Previous patch (rejected)");
    joiner.add("```diff");
    joiner.add(request.failedPatch().stripTrailing());
    joiner.add("```");
    joiner.add("");
    joiner.add("## Apply error");
    joiner.add(request.applyError().isBlank() ? "(no diagnostics)" : request.applyError().strip());
    joiner.add("");
    joiner.add(
        "Produce a corrected unified diff that applies cleanly and only touches the changed files,"
            + " or "
            + PatchExtractor.NO_CHANGES_SENTINEL
            + " if the improvement should be dropped.");
    return joiner.toString();
  }

  private static StringJoiner header(String repository, String baseRef, String headRef) {
    StringJoiner joiner = new StringJoiner("\n");
    joiner.add("## Repository");
    joiner.add("repository: " + repository);
    joiner.add("base: " + baseRef);
    joiner.add("head: " + headRef);
    joiner.add("");
    return joiner;
  }

  private static void appendChunk(StringJoiner joiner, DiffChunk chunk) {
    joiner.add("## Changed files");
    for (String file : chunk.files()) {
      joiner.add("- " + file);
    }
    joiner.add("");
    joiner.add("## Diff");
    joiner.add("```diff");
    joiner.add(chunk.diff().stripTrailing());
    joiner.add("```");
    if (!chunk.snapshots().isEmpty()) {
      joiner.add("");
      joiner.add("## Current file contents");
      for (FileSnapshot snapshot : chunk.snapshots()) {
        joiner.add("### " + snapshot.path());
        joiner.add("```");
        joiner.add(snapshot.content().stripTrailing());
        joiner.add("```");
      }
    }
  }
}
