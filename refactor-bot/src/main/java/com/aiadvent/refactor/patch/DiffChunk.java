package com.aiadvent.refactor.patch;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A bounded slice of the commit range: a non-empty ordered set of files, the unified diff covering
 * exactly those files and the snapshots used as generation context.
 */
public record DiffChunk(List<String> files, String diff, List<FileSnapshot> snapshots) {

  public DiffChunk {
    Objects.requireNonNull(files, "files");
    Objects.requireNonNull(diff, "diff");
    if (files.isEmpty()) {
      throw new IllegalArgumentException("chunk must contain at least one file");
    }
    Set<String> unique = new HashSet<>(files);
    if (unique.size() != files.size()) {
      throw new IllegalArgumentException("chunk files must be unique: " + files);
    }
    files = List.copyOf(files);
    snapshots = snapshots == null ? List.of() : List.copyOf(snapshots);
  }

  public boolean covers(String path) {
    return files.contains(path);
  }

  public int size() {
    return diff.length();
  }
}
