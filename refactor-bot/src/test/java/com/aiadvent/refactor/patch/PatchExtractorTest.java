package com.aiadvent.refactor.patch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PatchExtractorTest {

  private static final String DIFF =
      String.join(
          "\n",
          "diff --git a/src/app.ts b/src/app.ts",
          "--- a/src/app.ts",
          "+++ b/src/app.ts",
          "@@ -1,3 +1,3 @@",
          " const a = 1;",
          "-const b=2;",
          "+const b = 2;",
          " export { a, b };");

  @Test
  void sentinelOnItsOwnLineMeansNoChanges() {
    GenerationResult result =
        PatchExtractor.extract("I reviewed the diff.\nNO_CHANGES_NEEDED\nThanks.");

    assertThat(result.kind()).isEqualTo(GenerationResult.Kind.NO_CHANGES);
    assertThat(result.hasPatch()).isFalse();
  }

  @Test
  void sentinelInsideProseIsNotADecision() {
    assertThatThrownBy(
            () -> PatchExtractor.extract("Reply NO_CHANGES_NEEDED if nothing changes"))
        .isInstanceOf(InvalidPatchOutputException.class)
        .hasMessageContaining("expected unified diff");
  }

  @Test
  void extractsLabelledFenceFirst() {
    String raw = "Here you go:\n```diff\n" + DIFF + "\n```\nLet me know.";

    GenerationResult result = PatchExtractor.extract(raw);

    assertThat(result.hasPatch()).isTrue();
    assertThat(result.patch()).isEqualTo(DIFF);
    assertThat(result.raw()).isEqualTo(raw);
  }

  @Test
  void addedCodeFenceInsideHunkDoesNotEndTheDiff() {
    String readmeDiff =
        String.join(
            "\n",
            "diff --git a/README.md b/README.md",
            "--- a/README.md",
            "+++ b/README.md",
            "@@ -1,2 +1,5 @@",
            " # Title",
            "+```java",
            "+int x = 1;",
            "+```",
            " Footer");

    GenerationResult labelled = PatchExtractor.extract("```diff\n" + readmeDiff + "\n```\nDone.");
    GenerationResult unlabelled = PatchExtractor.extract("```\n" + readmeDiff + "\n```");

    assertThat(labelled.patch()).isEqualTo(readmeDiff);
    assertThat(unlabelled.patch()).isEqualTo(readmeDiff);
  }

  @Test
  void fallsBackToUnlabelledFenceContainingDiff() {
    String raw = "```\nnot a diff\n```\n\n```\n" + DIFF + "\n```";

    assertThat(PatchExtractor.extract(raw).patch()).isEqualTo(DIFF);
  }

  @Test
  void scansBareDiffWhenNoFencePresent() {
    String raw = "Some explanation first.\n" + DIFF + "\n";

    assertThat(PatchExtractor.extract(raw).patch()).isEqualTo(DIFF);
  }

  @Test
  void sanitizeDropsProseInsideHunksAndKeepsInnerBlankContext() {
    String noisy =
        String.join(
            "\n",
            "diff --git a/src/app.ts b/src/app.ts",
            "--- a/src/app.ts",
            "+++ b/src/app.ts",
            "@@ -1,4 +1,4 @@",
            " const a = 1;",
            "",
            "-const b=2;",
            "This line explains the change",
            "+const b = 2;",
            "",
            "");

    String sanitized = PatchExtractor.sanitize(noisy);

    assertThat(sanitized)
        .isEqualTo(
            String.join(
                "\n",
                "diff --git a/src/app.ts b/src/app.ts",
                "--- a/src/app.ts",
                "+++ b/src/app.ts",
                "@@ -1,4 +1,4 @@",
                " const a = 1;",
                " ",
                "-const b=2;",
                "+const b = 2;"));
  }

  @Test
  void validationRejectsUnprefixedHunkLineAndCitesIt() {
    String invalid =
        String.join(
            "\n",
            "--- a/src/app.ts",
            "+++ b/src/app.ts",
            "@@ -1,2 +1,2 @@",
            " const a = 1;",
            "oops this is prose",
            "+const b = 2;");

    assertThatThrownBy(() -> PatchExtractor.validate(invalid))
        .isInstanceOf(PatchValidationException.class)
        .hasMessageContaining("line 5")
        .hasMessageContaining("oops this is prose");
  }

  @Test
  void rejectsNullDeviceHeaders() {
    String raw =
        "```diff\n"
            + String.join(
                "\n",
                "diff --git a/src/new.ts b/src/new.ts",
                "new file mode 100644",
                "--- /dev/null",
                "+++ b/src/new.ts",
                "@@ -0,0 +1 @@",
                "+export const x = 1;")
            + "\n```";

    assertThatThrownBy(() -> PatchExtractor.extract(raw))
        .isInstanceOf(PatchValidationException.class)
        .hasMessageContaining("/dev/null");
  }

  @Test
  void rejectsDiffWithoutHunks() {
    assertThatThrownBy(() -> PatchExtractor.validate("--- a/x.ts\n+++ b/x.ts\n"))
        .isInstanceOf(PatchValidationException.class)
        .hasMessageContaining("hunk");
  }

  @Test
  void rejectsBinaryPatches() {
    String binary =
        String.join(
            "\n",
            "--- a/logo.png",
            "+++ b/logo.png",
            "@@ -1 +1 @@",
            "-a",
            "+b",
            "diff --git a/img.png b/img.png",
            "GIT binary patch",
            "literal 10");

    assertThatThrownBy(() -> PatchExtractor.validate(binary))
        .isInstanceOf(PatchValidationException.class)
        .hasMessageContaining("Binary");
  }

  @Test
  void emptyOrGarbageOutputIsInvalid() {
    assertThatThrownBy(() -> PatchExtractor.extract("   "))
        .isInstanceOf(InvalidPatchOutputException.class);
    assertThatThrownBy(() -> PatchExtractor.extract("I would rename a few variables."))
        .isInstanceOf(InvalidPatchOutputException.class)
        .isNotInstanceOf(PatchValidationException.class);
  }
}
