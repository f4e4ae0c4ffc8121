package com.aiadvent.refactor.patch;

import java.util.Objects;

/** Full text of a file as it stands at the head of the analysed range. */
public record FileSnapshot(String path, String content) {

  public FileSnapshot {
    Objects.requireNonNull(path, "path");
    content = content == null ? "" : content;
  }
}
