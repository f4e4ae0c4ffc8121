package com.aiadvent.refactor.patch;

import java.util.Objects;

/**
 * Interpreted generator reply. Exactly one of two cases: the generator declared that nothing needs
 * to change, or it produced a validated unified diff.
 */
public record GenerationResult(Kind kind, String patch, String raw) {

  public enum Kind {
    NO_CHANGES,
    PATCH
  }

  public GenerationResult {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.PATCH && (patch == null || patch.isBlank())) {
      throw new IllegalArgumentException("patch result requires diff text");
    }
    if (kind == Kind.NO_CHANGES && patch != null) {
      throw new IllegalArgumentException("no-changes result must not carry a diff");
    }
    raw = raw == null ? "" : raw;
  }

  public static GenerationResult noChanges(String raw) {
    return new GenerationResult(Kind.NO_CHANGES, null, raw);
  }

  public static GenerationResult patch(String patch, String raw) {
    return new GenerationResult(Kind.PATCH, patch, raw);
  }

  public boolean hasPatch() {
    return kind == Kind.PATCH;
  }
}
