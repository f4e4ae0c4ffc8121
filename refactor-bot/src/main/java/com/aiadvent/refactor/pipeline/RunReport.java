package com.aiadvent.refactor.pipeline;

import com.aiadvent.refactor.generation.UsageStats;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** Flat, serialisable account of one run. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunReport(
    String mode,
    String repository,
    String baseBranch,
    String outcome,
    String reason,
    String detail,
    String modelFailureSubtype,
    Integer failedChunks,
    Integer totalChunks,
    String baseSha,
    String headSha,
    String branchName,
    String pullRequestUrl,
    List<String> files,
    String changeSummary,
    long durationMs,
    String error,
    String value,
    UsageStats.Snapshot usage) {}
