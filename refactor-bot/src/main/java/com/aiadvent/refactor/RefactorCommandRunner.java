package com.aiadvent.refactor;

import com.aiadvent.refactor.config.RefactorBotProperties;
import com.aiadvent.refactor.generation.UsageStats;
import com.aiadvent.refactor.pipeline.RefactorPipeline;
import com.aiadvent.refactor.pipeline.RunResult;
import com.aiadvent.refactor.pipeline.RunSummaryReporter;
import com.aiadvent.refactor.watch.PollingPushWatcher;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Command line entry: {@code run} processes the configured push event once, {@code watch} polls the
 * base branch until the process is stopped.
 */
@Component
class RefactorCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(RefactorCommandRunner.class);

  static final String USAGE =
      """
Usage: refactor-bot <command>

Commands:
  run     analyse the pushed commit range once and open a pull request when safe
  watch   poll origin/<base-branch> and run for every new push

Configuration is read from application.yml, environment variables and --refactor.* options.""";

  private final RefactorPipeline pipeline;
  private final PollingPushWatcher watcher;
  private final RunSummaryReporter reporter;
  private final RefactorBotProperties properties;
  private volatile int exitCode;

  RefactorCommandRunner(
      RefactorPipeline pipeline,
      PollingPushWatcher watcher,
      RunSummaryReporter reporter,
      RefactorBotProperties properties) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.watcher = Objects.requireNonNull(watcher, "watcher");
    this.reporter = Objects.requireNonNull(reporter, "reporter");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> commands = args.getNonOptionArgs();
    if (commands.isEmpty() || args.containsOption("help")) {
      System.out.println(USAGE);
      exitCode = 0;
      return;
    }
    String command = commands.get(0);
    switch (command) {
      case "run" -> exitCode = runOnce("run", eventPath()) ? 0 : 1;
      case "watch" -> {
        watchUntilStopped();
        exitCode = 0;
      }
      default -> {
        System.err.println("Unknown command: " + command);
        System.err.println(USAGE);
        exitCode = 1;
      }
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  /** @return {@code false} when the run ended with an exception instead of an outcome */
  boolean runOnce(String mode, Path eventPath) {
    UsageStats usage = new UsageStats();
    long started = System.nanoTime();
    RunResult result = null;
    Throwable error = null;
    try {
      result = pipeline.run(eventPath, usage);
    } catch (RuntimeException ex) {
      error = ex;
      log.error("Refactor run failed", ex);
    }
    reporter.report(mode, result, error, Duration.ofNanos(System.nanoTime() - started), usage);
    return error == null;
  }

  private void watchUntilStopped() {
    Thread hook = new Thread(watcher::stop, "refactor-watch-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    watcher.watch(
        event -> {
          if (!runOnce("watch", event.eventPath())) {
            throw new IllegalStateException(
                "Run for " + event.baseSha() + ".." + event.headSha() + " failed");
          }
        });
  }

  private Path eventPath() {
    String configured = properties.getEventPath();
    return StringUtils.hasText(configured) ? Path.of(configured.trim()) : null;
  }
}
