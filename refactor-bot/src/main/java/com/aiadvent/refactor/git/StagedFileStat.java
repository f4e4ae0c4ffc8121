package com.aiadvent.refactor.git;

import java.util.ArrayList;
import java.util.List;

/** One line of {@code git diff --numstat}; binary files report no line counts. */
public record StagedFileStat(String path, int additions, int deletions, boolean binary) {

  public static List<StagedFileStat> parseNumstat(String output) {
    List<StagedFileStat> stats = new ArrayList<>();
    if (output == null) {
      return stats;
    }
    for (String line : output.split("\\R")) {
      if (line.isBlank()) {
        continue;
      }
      String[] parts = line.split("\t", 3);
      if (parts.length < 3) {
        continue;
      }
      boolean binary = "-".equals(parts[0]) || "-".equals(parts[1]);
      int additions = binary ? 0 : parseCount(parts[0]);
      int deletions = binary ? 0 : parseCount(parts[1]);
      stats.add(new StagedFileStat(parts[2].trim(), additions, deletions, binary));
    }
    return stats;
  }

  private static int parseCount(String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      return 0;
    }
  }
}
