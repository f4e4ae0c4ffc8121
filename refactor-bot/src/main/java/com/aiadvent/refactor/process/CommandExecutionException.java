package com.aiadvent.refactor.process;

import java.util.List;

/** Raised when an external command exits with a non-zero status, times out or cannot start. */
public class CommandExecutionException extends RuntimeException {

  private final List<String> command;
  private final int exitCode;
  private final String stdout;
  private final String stderr;

  public CommandExecutionException(CommandResult result) {
    super(describe(result));
    this.command = result.command();
    this.exitCode = result.exitCode();
    this.stdout = result.stdout();
    this.stderr = result.stderr();
  }

  public CommandExecutionException(List<String> command, String message, Throwable cause) {
    super(message, cause);
    this.command = command == null ? List.of() : List.copyOf(command);
    this.exitCode = -1;
    this.stdout = "";
    this.stderr = "";
  }

  public List<String> getCommand() {
    return command;
  }

  public int getExitCode() {
    return exitCode;
  }

  public String getStdout() {
    return stdout;
  }

  public String getStderr() {
    return stderr;
  }

  private static String describe(CommandResult result) {
    return "Command failed ("
        + String.join(" ", result.command())
        + ", exit "
        + result.exitCode()
        + "): "
        + result.diagnostics();
  }
}
