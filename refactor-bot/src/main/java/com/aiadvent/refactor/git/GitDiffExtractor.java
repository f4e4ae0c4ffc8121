package com.aiadvent.refactor.git;

import com.aiadvent.refactor.config.RefactorBotProperties;
import com.aiadvent.refactor.patch.DiffChunk;
import com.aiadvent.refactor.patch.FileSnapshot;
import com.aiadvent.refactor.process.CommandResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits the diff of a commit range into chunks bounded by size and file count. Files are never
 * split: a single file larger than the size limit becomes a chunk of its own.
 */
@Component
public class GitDiffExtractor {

  private static final Logger log = LoggerFactory.getLogger(GitDiffExtractor.class);

  private final GitClient git;
  private final RefactorBotProperties properties;

  public GitDiffExtractor(GitClient git, RefactorBotProperties properties) {
    this.git = Objects.requireNonNull(git, "git");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  /**
   * @return the chunked range, or {@code null} when nothing is left to analyse (no changed files,
   *     everything excluded, or only empty per-file diffs)
   */
  public DiffContext extract(CommitRange range) {
    Objects.requireNonNull(range, "range");
    List<String> changedFiles =
        GitClient.lines(git.run("diff", "--name-only", range.baseSha(), range.headSha()));
    if (changedFiles.isEmpty()) {
      return null;
    }
    List<Pattern> excludePatterns = properties.getResolvedExcludePatterns();
    List<String> kept = new ArrayList<>();
    List<String> excluded = new ArrayList<>();
    for (String file : changedFiles) {
      if (isExcluded(file, excludePatterns)) {
        excluded.add(file);
      } else {
        kept.add(file);
      }
    }

    int maxSize = properties.getMaxDiffSize();
    int maxFiles = properties.getMaxFilesPerChunk();
    List<DiffChunk> chunks = new ArrayList<>();
    List<String> currentFiles = new ArrayList<>();
    StringBuilder currentDiff = new StringBuilder();
    int fileDiffs = 0;
    for (String file : kept) {
      String fileDiff =
          git.run("diff", "--unified=3", range.baseSha(), range.headSha(), "--", file)
              .stripTrailing();
      if (fileDiff.isEmpty()) {
        continue;
      }
      fileDiffs++;
      boolean overSize = currentDiff.length() + fileDiff.length() + 1 > maxSize;
      if (!currentFiles.isEmpty() && (overSize || currentFiles.size() >= maxFiles)) {
        chunks.add(buildChunk(range, currentFiles, currentDiff));
        currentFiles = new ArrayList<>();
        currentDiff = new StringBuilder();
      }
      if (currentDiff.length() > 0) {
        currentDiff.append('\n');
      }
      currentDiff.append(fileDiff);
      currentFiles.add(file);
    }
    if (!currentFiles.isEmpty()) {
      chunks.add(buildChunk(range, currentFiles, currentDiff));
    }

    if (fileDiffs == 0) {
      log.info(
          "No analysable diff in {}: changed={}, excluded={}",
          range.shortForm(),
          changedFiles.size(),
          excluded.size());
      return null;
    }
    if (chunks.isEmpty()) {
      throw new IllegalStateException(
          "Diff chunking produced no chunks for " + fileDiffs + " non-empty file diffs");
    }
    log.info(
        "Diff extracted: range={}, files={}, excluded={}, chunks={}",
        range.shortForm(),
        kept.size(),
        excluded.size(),
        chunks.size());
    return new DiffContext(range, kept, excluded, chunks);
  }

  private DiffChunk buildChunk(CommitRange range, List<String> files, StringBuilder diff) {
    List<FileSnapshot> snapshots = new ArrayList<>();
    for (String file : files) {
      CommandResult show = git.runUnchecked("show", range.headSha() + ":" + file);
      if (show.succeeded()) {
        snapshots.add(new FileSnapshot(file, show.stdout()));
      } else {
        log.debug("No snapshot for {} at {}: {}", file, range.headSha(), show.diagnostics());
      }
    }
    return new DiffChunk(files, diff.toString(), snapshots);
  }

  static boolean isExcluded(String file, List<Pattern> patterns) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(file).find()) {
        return true;
      }
    }
    return false;
  }
}
