package com.aiadvent.refactor.patch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static, conservative check that a patch leaves source semantics alone. For every source file the
 * removed and added lines are tokenized separately; any difference in the token sequences blocks
 * the patch. Formatting-only edits therefore pass while renamed identifiers or altered operators do
 * not. Tests, docs and config are exempt; unknown file types are blocked outright.
 */
public final class BehaviorGuard {

  private static final Pattern TOKEN =
      Pattern.compile(
          "[A-Za-z_][A-Za-z0-9_]*|\\d+|===?|!==|!=|<=|>=|=>|\\+\\+|--|&&|\\|\\||"
              + "[{}()\\[\\].,;:+\\-*/%?<>!=&|^~]");
  private static final Pattern DIFF_GIT_HEADER = Pattern.compile("^diff --git (\\S+) (\\S+)$");

  private BehaviorGuard() {}

  public static BehaviorAssessment assess(String patch) {
    Map<String, FileChanges> changes = collectChanges(patch);
    List<String> reasons = new ArrayList<>();
    for (Map.Entry<String, FileChanges> entry : changes.entrySet()) {
      String file = entry.getKey();
      if (FileClassifier.isGuardExempt(file)) {
        continue;
      }
      if (!FileClassifier.isSource(file)) {
        reasons.add("Behavior guard blocked unsupported source file type: " + file);
        continue;
      }
      List<String> removed = tokenize(entry.getValue().removed);
      List<String> added = tokenize(entry.getValue().added);
      if (removed.isEmpty() && added.isEmpty()) {
        continue;
      }
      if (!removed.equals(added)) {
        reasons.add("Behavior guard blocked semantic token changes in " + file);
      }
    }
    return reasons.isEmpty() ? BehaviorAssessment.approved() : BehaviorAssessment.blocked(reasons);
  }

  static List<String> tokenize(CharSequence text) {
    List<String> tokens = new ArrayList<>();
    Matcher matcher = TOKEN.matcher(text);
    while (matcher.find()) {
      tokens.add(matcher.group());
    }
    return tokens;
  }

  private static Map<String, FileChanges> collectChanges(String patch) {
    Map<String, FileChanges> changes = new LinkedHashMap<>();
    if (patch == null) {
      return changes;
    }
    String[] lines = patch.replace("\r\n", "\n").split("\n");
    FileChanges current = null;
    boolean inHunk = false;
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      if (line.startsWith("diff --git ")) {
        Matcher matcher = DIFF_GIT_HEADER.matcher(line.stripTrailing());
        current =
            matcher.matches()
                ? changes.computeIfAbsent(
                    PatchFiles.normalizePath(matcher.group(2)), path -> new FileChanges())
                : null;
        inHunk = false;
        continue;
      }
      if (line.startsWith("--- ") && i + 1 < lines.length && lines[i + 1].startsWith("+++ ")) {
        String target = PatchFiles.normalizePath(lines[i + 1].substring(4));
        if ("/dev/null".equals(target)) {
          target = PatchFiles.normalizePath(line.substring(4));
        }
        current = changes.computeIfAbsent(target, path -> new FileChanges());
        inHunk = false;
        i++;
        continue;
      }
      if (line.startsWith("@@")) {
        inHunk = true;
        continue;
      }
      if (!inHunk || current == null || line.isEmpty()) {
        continue;
      }
      if (line.charAt(0) == '-') {
        current.removed.append(line, 1, line.length()).append('\n');
      } else if (line.charAt(0) == '+') {
        current.added.append(line, 1, line.length()).append('\n');
      }
    }
    return changes;
  }

  private static final class FileChanges {
    private final StringBuilder removed = new StringBuilder();
    private final StringBuilder added = new StringBuilder();
  }
}
