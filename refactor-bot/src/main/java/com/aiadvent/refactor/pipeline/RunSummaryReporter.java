package com.aiadvent.refactor.pipeline;

import com.aiadvent.refactor.config.RefactorBotProperties;
import com.aiadvent.refactor.generation.UsageStats;
import com.aiadvent.refactor.git.CommitRange;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Logs the end-of-run summary and optionally writes it as JSON for CI consumers. */
@Component
public class RunSummaryReporter {

  private static final Logger log = LoggerFactory.getLogger(RunSummaryReporter.class);

  private final RefactorBotProperties properties;
  private final ObjectMapper objectMapper;

  public RunSummaryReporter(RefactorBotProperties properties, ObjectMapper objectMapper) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public RunReport report(
      String mode, RunResult result, Throwable error, Duration duration, UsageStats usage) {
    RunReport report = toReport(mode, result, error, duration, usage.snapshot());
    log.info(
        "run summary: mode={}, repo={}, base={}",
        report.mode(),
        report.repository(),
        report.baseBranch());
    log.info("run summary: outcome={}, duration={}ms", report.outcome(), report.durationMs());
    if (report.baseSha() != null) {
      log.info("run summary: range={}..{}", report.baseSha(), report.headSha());
    }
    if (report.pullRequestUrl() != null) {
      log.info("run summary: pr_url={}", report.pullRequestUrl());
    }
    UsageStats.Snapshot snapshot = report.usage();
    log.info(
        "run summary: usage requests={}, retries={}, tokens={}, cost=${}, avgLatency={}ms,"
            + " maxLatency={}ms",
        snapshot.httpRequests(),
        snapshot.retryCount(),
        snapshot.totalTokens(),
        String.format(Locale.ROOT, "%.6f", snapshot.totalCostUsd()),
        snapshot.averageLatencyMs(),
        snapshot.maxLatencyMs());
    log.info("run summary: value={}", report.value());
    writeReport(report);
    return report;
  }

  RunReport toReport(
      String mode,
      RunResult result,
      Throwable error,
      Duration duration,
      UsageStats.Snapshot usage) {
    RunOutcome outcome = result != null ? result.outcome() : null;
    CommitRange range = result != null ? result.range() : null;
    boolean modelFailure =
        outcome != null && outcome.reason() == RunOutcome.SkipReason.MODEL_FAILURE;
    return new RunReport(
        mode,
        properties.getRepository(),
        properties.getBaseBranch(),
        outcome != null ? outcome.label() : "failed(exception)",
        outcome != null && outcome.reason() != null ? outcome.reason().code() : null,
        outcome != null ? outcome.detail() : null,
        modelFailure ? outcome.modelFailureSubtype().code() : null,
        modelFailure ? outcome.failedChunks() : null,
        modelFailure ? outcome.totalChunks() : null,
        range != null ? range.baseSha() : null,
        range != null ? range.headSha() : null,
        outcome != null ? outcome.branchName() : null,
        outcome != null ? outcome.pullRequestUrl() : null,
        outcome != null && outcome.isCreated() ? outcome.files() : null,
        outcome != null ? outcome.changeSummary() : null,
        duration.toMillis(),
        error != null ? error.getMessage() : null,
        describeValue(outcome, error),
        usage);
  }

  static String describeValue(RunOutcome outcome, Throwable error) {
    if (outcome == null) {
      return "Run failed before producing an outcome: "
          + (error != null ? error.getMessage() : "unknown error");
    }
    if (outcome.isCreated()) {
      return "Opened a refactor pull request touching "
          + outcome.files().size()
          + " file(s) ("
          + outcome.changeSummary()
          + ").";
    }
    return switch (outcome.reason()) {
      case NO_DIFF -> "No analysable changes in the commit range; nothing to refactor.";
      case NO_PATCH -> "The model found nothing worth changing, or no patch survived the checks.";
      case TEST_FAILURE -> "Refactor patch was discarded because the test command failed.";
      case PATCH_APPLY_FAILURE -> "Refactor patch could not be applied even after repair attempts.";
      case MODEL_FAILURE ->
          "The model failed on every chunk ("
              + outcome.modelFailureSubtype().code()
              + ", "
              + outcome.failedChunks()
              + "/"
              + outcome.totalChunks()
              + " chunks).";
    };
  }

  private void writeReport(RunReport report) {
    Path reportPath = properties.resolveReportPath();
    try {
      String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
      log.debug("run report: {}", json);
      if (reportPath != null) {
        Path parent = reportPath.toAbsolutePath().getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        Files.writeString(reportPath, json + "\n", StandardCharsets.UTF_8);
        log.info("run report written to {}", reportPath);
      }
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize run report", ex);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to write run report to " + reportPath, ex);
    }
  }
}
