package com.aiadvent.refactor.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CommandExecutorTest {

  @TempDir Path tempDir;

  private final CommandExecutor executor = new CommandExecutor();

  @Test
  void capturesOutputAndExitCode() {
    CommandResult result =
        executor.run(
            List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"), tempDir, Duration.ofSeconds(10));

    assertThat(result.exitCode()).isEqualTo(3);
    assertThat(result.succeeded()).isFalse();
    assertThat(result.stdout()).isEqualTo("out\n");
    assertThat(result.diagnostics()).isEqualTo("err");
  }

  @Test
  void runsInWorkdirWithPromptsDisabled() {
    CommandResult result =
        executor.run(
            List.of("sh", "-c", "pwd; echo $GIT_TERMINAL_PROMPT"), tempDir, Duration.ofSeconds(10));

    assertThat(result.stdout())
        .contains(tempDir.toAbsolutePath().toString())
        .endsWith("0\n");
  }

  @Test
  void stdinIsClosedSoReadersSeeEndOfInput() {
    CommandResult result = executor.run(List.of("cat"), tempDir, Duration.ofSeconds(10));

    assertThat(result.succeeded()).isTrue();
    assertThat(result.stdout()).isEmpty();
  }

  @Test
  void checkedRunRaisesWithDiagnostics() {
    assertThatThrownBy(
            () ->
                executor.runChecked(
                    List.of("sh", "-c", "echo 'fatal: bad revision' 1>&2; exit 128"),
                    tempDir,
                    Duration.ofSeconds(10)))
        .isInstanceOfSatisfying(
            CommandExecutionException.class,
            ex -> {
              assertThat(ex.getExitCode()).isEqualTo(128);
              assertThat(ex.getStderr()).contains("fatal: bad revision");
              assertThat(ex.getMessage()).contains("exit 128").contains("fatal: bad revision");
            });
  }

  @Test
  void timeoutKillsProcess() {
    assertThatThrownBy(
            () -> executor.run(List.of("sleep", "5"), tempDir, Duration.ofMillis(200)))
        .isInstanceOf(CommandExecutionException.class)
        .hasMessageContaining("timed out");
  }

  @Test
  void missingProgramCannotStart() {
    assertThatThrownBy(
            () ->
                executor.run(
                    List.of("definitely-not-a-real-binary-42"), tempDir, Duration.ofSeconds(5)))
        .isInstanceOf(CommandExecutionException.class)
        .hasMessageStartingWith("Failed to start command");
  }

  @Test
  void diagnosticsStripAnsiAndFallBackToStdout() {
    CommandResult colored =
        new CommandResult(List.of("npm", "test"), 1, "", "\u001B[31mFAIL\u001B[0m app.test.ts\n");
    CommandResult quiet = new CommandResult(List.of("npm", "test"), 1, "only stdout\n", " ");

    assertThat(colored.diagnostics()).isEqualTo("FAIL app.test.ts");
    assertThat(quiet.diagnostics()).isEqualTo("only stdout");
  }
}
