package com.aiadvent.refactor.git;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aiadvent.refactor.patch.PatchApplyException;
import com.aiadvent.refactor.process.CommandExecutor;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GitApplyEngineTest {

  private static final String FORMATTING_PATCH =
      String.join(
          "\n",
          "diff --git a/src/app.ts b/src/app.ts",
          "--- a/src/app.ts",
          "+++ b/src/app.ts",
          "@@ -1,2 +1,2 @@",
          "-const x=1;",
          "+const x = 1;",
          " export { x };");

  @TempDir Path tempDir;

  private Path repo;
  private GitClient git;
  private GitApplyEngine engine;

  @BeforeEach
  void setUp() throws Exception {
    repo = tempDir.resolve("repo");
    Files.createDirectories(repo.resolve("src"));
    runGit(repo, "init", "-q");
    runGit(repo, "config", "user.name", "Test");
    runGit(repo, "config", "user.email", "test@example.com");
    Files.writeString(
        repo.resolve("src/app.ts"), "const x=1;\nexport { x };\n", StandardCharsets.UTF_8);
    runGit(repo, "add", "src/app.ts");
    runGit(repo, "commit", "-q", "-m", "init");
    git = new GitClient(new CommandExecutor(), repo, Duration.ofSeconds(30));
    engine = new GitApplyEngine(git);
  }

  @Test
  void appliesPatchToIndexAndWorkingTree() throws Exception {
    engine.apply(FORMATTING_PATCH);

    assertThat(Files.readString(repo.resolve("src/app.ts"))).startsWith("const x = 1;\n");
    assertThat(engine.hasStagedChanges()).isTrue();
    assertThat(engine.listStagedFiles()).containsExactly("src/app.ts");
    assertThat(engine.stagedNumstat())
        .containsExactly(new StagedFileStat("src/app.ts", 1, 1, false));
    assertThat(engine.stagedShortStat()).contains("1 file changed");
  }

  @Test
  void rejectedPatchLeavesIndexUntouched() throws Exception {
    String stale = FORMATTING_PATCH.replace("-const x=1;", "-const y=2;");

    assertThatThrownBy(() -> engine.apply(stale))
        .isInstanceOf(PatchApplyException.class)
        .hasMessageStartingWith("Failed to apply patch with git apply: ");
    assertThat(engine.hasStagedChanges()).isFalse();
    assertThat(Files.readString(repo.resolve("src/app.ts"))).startsWith("const x=1;\n");
  }

  @Test
  void commitsOnlyStagedChangesAndPushesBranch() throws Exception {
    Path remote = tempDir.resolve("remote.git");
    runGit(tempDir, "init", "-q", "--bare", remote.toString());
    runGit(repo, "remote", "add", "origin", remote.toString());
    engine.apply(FORMATTING_PATCH);
    Files.writeString(repo.resolve("build.log"), "test output\n", StandardCharsets.UTF_8);

    GitBranchManager branches = new GitBranchManager(git);
    branches.configureIdentity("Refactor Bot", "bot@example.com");
    branches.createBranch("refactor/minimax-20240101000000");
    branches.commitStaged("auto: minimax refactor & optimization");
    branches.push("refactor/minimax-20240101000000");

    assertThat(runGit(repo, "show", "--name-only", "--format=%an", "HEAD"))
        .contains("Refactor Bot")
        .contains("src/app.ts")
        .doesNotContain("build.log");
    assertThat(runGit(remote, "branch", "--list")).contains("refactor/minimax-20240101000000");
  }

  @Test
  void scansTrackedFiles() {
    RepositoryScanner.RepositorySummary summary = new RepositoryScanner(git).scan();

    assertThat(summary.trackedFileCount()).isEqualTo(1);
    assertThat(summary.topLevelDirectories()).containsExactly("src");
  }

  @Test
  void summarizeErrorCollapsesRepeatsAndCapsLength() {
    StringBuilder stderr = new StringBuilder("error: patch failed\nerror: patch failed\n");
    for (int i = 0; i < 25; i++) {
      stderr.append("line ").append(i).append('\n');
    }

    String summary = GitApplyEngine.summarizeError(stderr.toString());

    assertThat(summary).startsWith("error: patch failed (repeated 2x)\nline 0");
    assertThat(summary).endsWith("... (6 more lines omitted)");
    assertThat(GitApplyEngine.summarizeError(" ")).isEqualTo("git apply failed without diagnostics");
  }

  @Test
  void parsesNumstatIncludingBinaryEntries() {
    assertThat(StagedFileStat.parseNumstat("3\t1\tsrc/a.ts\n-\t-\tlogo.png\n"))
        .containsExactly(
            new StagedFileStat("src/a.ts", 3, 1, false), new StagedFileStat("logo.png", 0, 0, true));
  }

  private String runGit(Path directory, String... command) throws Exception {
    ProcessBuilder builder = new ProcessBuilder();
    builder.command(concat("git", command));
    builder.directory(directory.toFile());
    builder.environment().put("GIT_TERMINAL_PROMPT", "0");
    builder.redirectErrorStream(true);
    Process process = builder.start();
    byte[] output = process.getInputStream().readAllBytes();
    if (!process.waitFor(30, TimeUnit.SECONDS)) {
      process.destroyForcibly();
      throw new IllegalStateException("git command timed out");
    }
    if (process.exitValue() != 0) {
      throw new IllegalStateException(
          "git command failed: " + new String(output, StandardCharsets.UTF_8));
    }
    return new String(output, StandardCharsets.UTF_8);
  }

  private List<String> concat(String first, String... rest) {
    List<String> commands = new ArrayList<>();
    commands.add(first);
    commands.addAll(Arrays.asList(rest));
    return commands;
  }
}
