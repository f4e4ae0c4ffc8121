package com.aiadvent.refactor.git;

import com.aiadvent.refactor.patch.PatchApplier;
import com.aiadvent.refactor.patch.PatchApplyException;
import com.aiadvent.refactor.process.CommandResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * Applies patches to the index and working tree with {@code git apply}, dry-running first so a
 * rejected patch leaves no partial state behind.
 */
@Component
public class GitApplyEngine implements PatchApplier {

  private static final Logger log = LoggerFactory.getLogger(GitApplyEngine.class);
  static final int MAX_ERROR_LINES = 20;

  private final GitClient git;

  public GitApplyEngine(GitClient git) {
    this.git = Objects.requireNonNull(git, "git");
  }

  @Override
  public void apply(String patch) {
    if (patch == null || patch.isBlank()) {
      throw new PatchApplyException("Patch is empty");
    }
    Path tempDir = null;
    try {
      tempDir = Files.createTempDirectory("refactor-patch-");
      Path patchFile = tempDir.resolve("candidate.patch");
      Files.writeString(patchFile, patch.stripTrailing() + "\n", StandardCharsets.UTF_8);
      String patchPath = patchFile.toAbsolutePath().toString();

      CommandResult check =
          git.runUnchecked("apply", "--check", "--index", "--recount", patchPath);
      if (!check.succeeded()) {
        throw new PatchApplyException(
            "Failed to apply patch with git apply: " + summarizeError(check.diagnostics()));
      }
      CommandResult apply = git.runUnchecked("apply", "--index", "--recount", patchPath);
      if (!apply.succeeded()) {
        throw new PatchApplyException(
            "Failed to apply patch with git apply: " + summarizeError(apply.diagnostics()));
      }
      log.debug("Patch applied to index: {} chars", patch.length());
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to stage patch file for git apply", ex);
    } finally {
      deleteQuietly(tempDir);
    }
  }

  public boolean hasStagedChanges() {
    return !listStagedFiles().isEmpty();
  }

  public List<String> listStagedFiles() {
    return GitClient.lines(git.run("diff", "--cached", "--name-only"));
  }

  public String stagedShortStat() {
    return git.run("diff", "--cached", "--shortstat").trim();
  }

  public List<StagedFileStat> stagedNumstat() {
    return StagedFileStat.parseNumstat(git.run("diff", "--cached", "--numstat"));
  }

  /**
   * Collapses consecutive duplicate lines into {@code (repeated Nx)} and caps the result so apply
   * diagnostics stay readable in logs and repair prompts.
   */
  static String summarizeError(String stderr) {
    if (stderr == null || stderr.isBlank()) {
      return "git apply failed without diagnostics";
    }
    List<String> collapsed = new ArrayList<>();
    String previous = null;
    int repeats = 0;
    for (String raw : stderr.split("\\R")) {
      String line = raw.strip();
      if (line.isEmpty()) {
        continue;
      }
      if (line.equals(previous)) {
        repeats++;
        continue;
      }
      if (previous != null) {
        collapsed.add(repeats > 1 ? previous + " (repeated " + repeats + "x)" : previous);
      }
      previous = line;
      repeats = 1;
    }
    if (previous != null) {
      collapsed.add(repeats > 1 ? previous + " (repeated " + repeats + "x)" : previous);
    }
    if (collapsed.size() > MAX_ERROR_LINES) {
      int omitted = collapsed.size() - MAX_ERROR_LINES;
      List<String> limited = new ArrayList<>(collapsed.subList(0, MAX_ERROR_LINES));
      limited.add("... (" + omitted + " more lines omitted)");
      collapsed = limited;
    }
    return String.join("\n", collapsed);
  }

  private static void deleteQuietly(Path dir) {
    if (dir == null) {
      return;
    }
    try {
      FileSystemUtils.deleteRecursively(dir);
    } catch (IOException ex) {
      log.warn("Failed to delete temporary patch directory {}: {}", dir, ex.getMessage());
    }
  }
}
