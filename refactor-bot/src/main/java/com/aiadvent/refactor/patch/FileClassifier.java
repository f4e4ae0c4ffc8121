package com.aiadvent.refactor.patch;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Single source of truth for path classification. The prioritizer, the behavior guard and the pull
 * request body all ask this class, so a path can never be a test file for one and source for
 * another.
 */
public final class FileClassifier {

  private static final Set<String> SOURCE_EXTENSIONS =
      Set.of(
          ".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs", ".py", ".go", ".rs", ".java", ".kt",
          ".swift", ".php", ".rb", ".cs", ".cpp", ".c", ".h");

  private static final Set<String> DOC_EXTENSIONS = Set.of(".md", ".mdx", ".txt", ".rst");

  private static final Set<String> CONFIG_EXTENSIONS = Set.of(".json", ".yml", ".yaml", ".toml");

  private static final List<String> TEST_SUFFIXES =
      List.of(
          ".test.ts", ".test.tsx", ".test.js", ".test.jsx", ".spec.ts", ".spec.js", "_test.go",
          "_test.py");

  private static final Pattern JVM_TEST_CLASS =
      Pattern.compile("(^|/)(Test[A-Z0-9]\\w*|\\w+Tests?|\\w+TestCase)\\.(java|kt)$");

  private static final List<Pattern> LOW_SIGNAL_PATTERNS =
      List.of(
          Pattern.compile("(^|/)(dist|build|coverage|node_modules|vendor|generated)/"),
          Pattern.compile("(^|/)rule-\\d+\\.[a-z0-9]+$"),
          Pattern.compile("\\.min\\.js$"),
          Pattern.compile("\\.map$"));

  private FileClassifier() {}

  public static FileCategory classify(String path) {
    String normalized = normalize(path);
    if (isTest(path)) {
      return FileCategory.TEST;
    }
    if (DOC_EXTENSIONS.contains(extension(normalized))) {
      return FileCategory.DOC;
    }
    if (CONFIG_EXTENSIONS.contains(extension(normalized))) {
      return FileCategory.CONFIG;
    }
    if (isGenerated(normalized)) {
      return FileCategory.GENERATED;
    }
    if (isSource(normalized)) {
      return FileCategory.SOURCE;
    }
    return FileCategory.OTHER;
  }

  public static boolean isTest(String path) {
    if (path != null && JVM_TEST_CLASS.matcher(path.trim().replace('\\', '/')).find()) {
      return true;
    }
    String normalized = "/" + normalize(path);
    if (normalized.contains("/test/")
        || normalized.contains("/tests/")
        || normalized.contains("/__tests__/")) {
      return true;
    }
    for (String suffix : TEST_SUFFIXES) {
      if (normalized.endsWith(suffix)) {
        return true;
      }
    }
    return false;
  }

  public static boolean isSource(String path) {
    return SOURCE_EXTENSIONS.contains(extension(normalize(path)));
  }

  public static boolean isGenerated(String path) {
    String normalized = normalize(path);
    for (Pattern pattern : LOW_SIGNAL_PATTERNS) {
      if (pattern.matcher(normalized).find()) {
        return true;
      }
    }
    return false;
  }

  /** Tests, documentation and configuration may change freely under the behavior guard. */
  public static boolean isGuardExempt(String path) {
    FileCategory category = classify(path);
    return category == FileCategory.TEST
        || category == FileCategory.DOC
        || category == FileCategory.CONFIG;
  }

  static String normalize(String path) {
    if (path == null) {
      return "";
    }
    String normalized = path.trim().replace('\\', '/').toLowerCase(Locale.ROOT);
    while (normalized.startsWith("./")) {
      normalized = normalized.substring(2);
    }
    return normalized;
  }

  private static String extension(String normalized) {
    int slash = normalized.lastIndexOf('/');
    int dot = normalized.lastIndexOf('.');
    if (dot <= slash) {
      return "";
    }
    return normalized.substring(dot);
  }
}
