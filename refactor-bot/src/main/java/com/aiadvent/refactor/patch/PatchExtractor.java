package com.aiadvent.refactor.patch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form generator output into either a no-changes decision or a sanitized unified diff
 * that passed structural validation.
 */
public final class PatchExtractor {

  public static final String NO_CHANGES_SENTINEL = "NO_CHANGES_NEEDED";

  // Fences open and close at column 0. Hunk lines always carry a prefix, so a "+```" line added
  // to a markdown file never closes the fence.
  private static final Pattern LABELLED_FENCE =
      Pattern.compile(
          "^```[ \\t]*(?:diff|patch)[^\\n]*\\n(.*?)^```",
          Pattern.DOTALL | Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);
  private static final Pattern ANY_FENCE =
      Pattern.compile("^```[^\\n]*\\n(.*?)^```", Pattern.DOTALL | Pattern.MULTILINE);
  private static final Pattern DIFF_HEADER = Pattern.compile("(?m)^(diff --git |--- \\S)");
  private static final Pattern HUNK_HEADER =
      Pattern.compile("^@@ -\\d+(?:,\\d+)? \\+\\d+(?:,\\d+)? @@.*$");
  private static final int EXCERPT_LENGTH = 80;

  private PatchExtractor() {}

  public static GenerationResult extract(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidPatchOutputException("Generator returned an empty response");
    }
    String text = raw.replace("\r\n", "\n");
    if (containsSentinel(text)) {
      return GenerationResult.noChanges(raw);
    }
    String candidate = locateDiff(text);
    if (candidate == null) {
      throw new InvalidPatchOutputException(
          "Generator output is invalid: expected unified diff or " + NO_CHANGES_SENTINEL);
    }
    String sanitized = sanitize(candidate);
    validate(sanitized);
    return GenerationResult.patch(sanitized, raw);
  }

  static boolean containsSentinel(String text) {
    for (String line : text.split("\n", -1)) {
      String trimmed = line.trim();
      while (trimmed.length() > 1 && trimmed.startsWith("`") && trimmed.endsWith("`")) {
        trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
      }
      if (NO_CHANGES_SENTINEL.equals(trimmed)) {
        return true;
      }
    }
    return false;
  }

  static String locateDiff(String text) {
    Matcher labelled = LABELLED_FENCE.matcher(text);
    while (labelled.find()) {
      if (!labelled.group(1).isBlank()) {
        return labelled.group(1);
      }
    }
    Matcher fenced = ANY_FENCE.matcher(text);
    while (fenced.find()) {
      if (DIFF_HEADER.matcher(fenced.group(1)).find()) {
        return fenced.group(1);
      }
    }
    String[] lines = text.split("\n", -1);
    int start = -1;
    for (int i = 0; i < lines.length; i++) {
      if (lines[i].startsWith("diff --git ") || lines[i].startsWith("--- ")) {
        start = i;
        break;
      }
    }
    if (start < 0) {
      return null;
    }
    List<String> collected = new ArrayList<>();
    for (int i = start; i < lines.length; i++) {
      if (lines[i].startsWith("```")) {
        break;
      }
      collected.add(lines[i]);
    }
    return String.join("\n", collected);
  }

  /**
   * Drops everything that cannot belong to a diff. Inside a hunk only space, {@code +} and {@code
   * -} prefixed lines survive (plus the no-newline marker); blank lines between hunk lines become
   * blank context lines and trailing ones disappear. Outside a hunk lines are trimmed and kept when
   * non-empty.
   */
  static String sanitize(String diff) {
    String[] lines = diff.split("\n", -1);
    List<String> out = new ArrayList<>();
    boolean inHunk = false;
    int pendingBlanks = 0;
    for (int i = 0; i < lines.length; i++) {
      String line = stripTrailingCarriageReturn(lines[i]);
      if (line.startsWith("diff --git ")) {
        inHunk = false;
        pendingBlanks = 0;
        out.add(line.stripTrailing());
        continue;
      }
      if (isHeaderPair(lines, i)) {
        inHunk = false;
        pendingBlanks = 0;
        out.add(line.stripTrailing());
        out.add(stripTrailingCarriageReturn(lines[i + 1]).stripTrailing());
        i++;
        continue;
      }
      if (HUNK_HEADER.matcher(line.stripTrailing()).matches()) {
        inHunk = true;
        pendingBlanks = 0;
        out.add(line.stripTrailing());
        continue;
      }
      if (inHunk) {
        if (line.isEmpty()) {
          pendingBlanks++;
          continue;
        }
        if (isHunkBodyLine(line)) {
          for (; pendingBlanks > 0; pendingBlanks--) {
            out.add(" ");
          }
          out.add(line);
        }
        continue;
      }
      String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        out.add(trimmed);
      }
    }
    return String.join("\n", out);
  }

  /**
   * Structural check of a unified diff: at least one {@code ---}/{@code +++} header pair, at least
   * one hunk, no null-device headers, no binary payloads, and only prefixed lines inside hunks.
   */
  public static void validate(String diff) {
    if (diff == null || diff.isBlank()) {
      throw new PatchValidationException("Patch is empty");
    }
    String[] lines = diff.replace("\r\n", "\n").split("\n", -1);
    boolean inHunk = false;
    boolean sawHeaderPair = false;
    boolean sawHunk = false;
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      if (line.startsWith("diff --git ")) {
        inHunk = false;
        continue;
      }
      if (isHeaderPair(lines, i)) {
        rejectNullDevice(line);
        rejectNullDevice(lines[i + 1]);
        sawHeaderPair = true;
        inHunk = false;
        i++;
        continue;
      }
      if (line.startsWith("@@")) {
        if (!HUNK_HEADER.matcher(line.stripTrailing()).matches()) {
          throw new PatchValidationException(
              "Malformed hunk header at line " + (i + 1) + ": " + excerpt(line));
        }
        inHunk = true;
        sawHunk = true;
        continue;
      }
      if (line.startsWith("GIT binary patch")
          || (line.startsWith("Binary files ") && line.contains(" differ"))) {
        throw new PatchValidationException("Binary patches are not supported");
      }
      if (inHunk) {
        if (!line.isEmpty() && !isHunkBodyLine(line)) {
          throw new PatchValidationException(
              "Invalid line inside hunk at line " + (i + 1) + ": " + excerpt(line));
        }
      } else if (line.startsWith("--- ") || line.startsWith("+++ ")) {
        rejectNullDevice(line);
      }
    }
    if (!sawHeaderPair) {
      throw new PatchValidationException("Patch has no ---/+++ file header pair");
    }
    if (!sawHunk) {
      throw new PatchValidationException("Patch has no @@ hunk");
    }
  }

  private static boolean isHeaderPair(String[] lines, int index) {
    return lines[index].startsWith("--- ")
        && index + 1 < lines.length
        && lines[index + 1].startsWith("+++ ");
  }

  private static boolean isHunkBodyLine(String line) {
    char prefix = line.charAt(0);
    return prefix == ' ' || prefix == '+' || prefix == '-' || line.startsWith("\\ No newline");
  }

  private static void rejectNullDevice(String headerLine) {
    if (headerLine.substring(4).trim().startsWith("/dev/null")) {
      throw new PatchValidationException(
          "Patch must not use /dev/null headers (new or deleted files are not allowed)");
    }
  }

  private static String stripTrailingCarriageReturn(String line) {
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }

  private static String excerpt(String line) {
    String trimmed = line.strip();
    return trimmed.length() <= EXCERPT_LENGTH ? trimmed : trimmed.substring(0, EXCERPT_LENGTH) + "...";
  }
}
