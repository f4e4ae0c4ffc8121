package com.aiadvent.refactor.patch;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Path bookkeeping for unified diffs. */
public final class PatchFiles {

  private static final Pattern DIFF_GIT_HEADER = Pattern.compile("^diff --git (\\S+) (\\S+)$");

  private PatchFiles() {}

  /**
   * Files a patch writes to: the right-hand side of {@code diff --git} headers and every {@code
   * +++} target. Null-device entries are ignored and {@code a/}/{@code b/} prefixes are stripped.
   */
  public static Set<String> touchedFiles(String patch) {
    Set<String> files = new LinkedHashSet<>();
    if (patch == null) {
      return files;
    }
    for (String line : patch.replace("\r\n", "\n").split("\n")) {
      if (line.startsWith("diff --git ")) {
        Matcher matcher = DIFF_GIT_HEADER.matcher(line.stripTrailing());
        if (matcher.matches()) {
          addPath(files, matcher.group(2));
        }
      } else if (line.startsWith("+++ ")) {
        addPath(files, line.substring(4));
      }
    }
    return files;
  }

  static String normalizePath(String raw) {
    String path = raw.trim();
    int tab = path.indexOf('\t');
    if (tab >= 0) {
      path = path.substring(0, tab);
    }
    if (path.length() >= 2 && path.startsWith("\"") && path.endsWith("\"")) {
      path = path.substring(1, path.length() - 1);
    }
    if (path.startsWith("a/") || path.startsWith("b/")) {
      path = path.substring(2);
    }
    return path;
  }

  private static void addPath(Set<String> files, String raw) {
    String path = normalizePath(raw);
    if (path.isEmpty() || "/dev/null".equals(path) || "dev/null".equals(path)) {
      return;
    }
    files.add(path);
  }
}
