package com.aiadvent.refactor.git;

import com.aiadvent.refactor.patch.DiffChunk;
import java.util.List;

/** Result of chunking a commit range. */
public record DiffContext(
    CommitRange range,
    List<String> changedFiles,
    List<String> excludedFiles,
    List<DiffChunk> chunks) {

  public DiffContext {
    changedFiles = changedFiles == null ? List.of() : List.copyOf(changedFiles);
    excludedFiles = excludedFiles == null ? List.of() : List.copyOf(excludedFiles);
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
  }
}
