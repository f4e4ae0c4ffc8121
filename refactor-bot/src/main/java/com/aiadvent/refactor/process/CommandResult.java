package com.aiadvent.refactor.process;

import java.util.List;
import java.util.regex.Pattern;

public record CommandResult(List<String> command, int exitCode, String stdout, String stderr) {

  private static final Pattern ANSI_ESCAPE = Pattern.compile("\u001B\\[[;\\d]*[ -/]*[@-~]");

  public CommandResult {
    command = command == null ? List.of() : List.copyOf(command);
    stdout = stdout == null ? "" : stdout;
    stderr = stderr == null ? "" : stderr;
  }

  public boolean succeeded() {
    return exitCode == 0;
  }

  /** Stderr when present, otherwise stdout, with terminal colour codes removed. */
  public String diagnostics() {
    String output = stderr.isBlank() ? stdout : stderr;
    return ANSI_ESCAPE.matcher(output).replaceAll("").trim();
  }
}
