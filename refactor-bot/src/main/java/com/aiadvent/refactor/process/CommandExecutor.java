package com.aiadvent.refactor.process;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs external programs (git, the project test command) with a bounded wall-clock time. Output
 * streams are drained on background threads so a chatty process cannot block on a full pipe.
 */
@Component
public class CommandExecutor {

  private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

  public CommandResult run(List<String> command, Path workdir, Duration timeout) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(timeout, "timeout");
    if (command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    ProcessBuilder builder = new ProcessBuilder(command);
    if (workdir != null) {
      builder.directory(workdir.toFile());
    }
    Map<String, String> environment = builder.environment();
    environment.put("GIT_TERMINAL_PROMPT", "0");
    environment.putIfAbsent("LC_ALL", "C");

    Process process;
    try {
      process = builder.start();
    } catch (IOException ex) {
      throw new CommandExecutionException(
          command, "Failed to start command: " + String.join(" ", command), ex);
    }
    try {
      process.getOutputStream().close();
    } catch (IOException ex) {
      log.debug("Failed to close stdin of {}: {}", command.get(0), ex.getMessage());
    }

    StreamCollector stdout = new StreamCollector();
    StreamCollector stderr = new StreamCollector();
    Thread stdoutThread = new Thread(() -> stdout.collect(process.getInputStream()));
    Thread stderrThread = new Thread(() -> stderr.collect(process.getErrorStream()));
    stdoutThread.start();
    stderrThread.start();
    boolean finished;
    try {
      finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new CommandExecutionException(
          command, "Command interrupted: " + String.join(" ", command), ex);
    }
    if (!finished) {
      process.destroyForcibly();
      throw new CommandExecutionException(
          command,
          "Command timed out after " + timeout.toSeconds() + "s: " + String.join(" ", command),
          null);
    }
    try {
      stdoutThread.join();
      stderrThread.join();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    CommandResult result =
        new CommandResult(command, process.exitValue(), stdout.content(), stderr.content());
    log.debug("command finished: command={}, exitCode={}", command, result.exitCode());
    return result;
  }

  /** Same as {@link #run} but raises {@link CommandExecutionException} on a non-zero exit code. */
  public CommandResult runChecked(List<String> command, Path workdir, Duration timeout) {
    CommandResult result = run(command, workdir, timeout);
    if (!result.succeeded()) {
      throw new CommandExecutionException(result);
    }
    return result;
  }

  private static class StreamCollector {
    private final StringBuilder buffer = new StringBuilder();

    void collect(InputStream stream) {
      try (stream) {
        byte[] data = stream.readAllBytes();
        buffer.append(new String(data, StandardCharsets.UTF_8));
      } catch (IOException ex) {
        buffer.append(ex.getMessage());
      }
    }

    String content() {
      return buffer.toString();
    }
  }
}
