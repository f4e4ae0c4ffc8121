package com.aiadvent.refactor.git;

import com.aiadvent.refactor.config.RefactorBotProperties;
import com.aiadvent.refactor.process.CommandExecutor;
import com.aiadvent.refactor.process.CommandResult;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Runs git in the configured working tree. */
@Component
public class GitClient {

  private final CommandExecutor executor;
  private final Path workdir;
  private final Duration timeout;

  @Autowired
  public GitClient(CommandExecutor executor, RefactorBotProperties properties) {
    this(executor, properties.getWorkdir(), properties.getCommandTimeout());
  }

  public GitClient(CommandExecutor executor, Path workdir, Duration timeout) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.workdir = Objects.requireNonNull(workdir, "workdir").toAbsolutePath().normalize();
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  /** Runs {@code git <args>} and returns stdout; a non-zero exit raises. */
  public String run(String... args) {
    return executor.runChecked(command(args), workdir, timeout).stdout();
  }

  /** Runs {@code git <args>} and leaves exit code interpretation to the caller. */
  public CommandResult runUnchecked(String... args) {
    return executor.run(command(args), workdir, timeout);
  }

  public Path workdir() {
    return workdir;
  }

  public Duration timeout() {
    return timeout;
  }

  public String revParse(String ref) {
    return run("rev-parse", ref).trim();
  }

  static List<String> lines(String output) {
    List<String> lines = new ArrayList<>();
    for (String line : output.split("\\R")) {
      String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        lines.add(trimmed);
      }
    }
    return lines;
  }

  private static List<String> command(String... args) {
    List<String> command = new ArrayList<>(args.length + 1);
    command.add("git");
    command.addAll(Arrays.asList(args));
    return command;
  }
}
