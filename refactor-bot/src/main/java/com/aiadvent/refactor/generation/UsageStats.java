package com.aiadvent.refactor.generation;

/**
 * Generation usage of a single run. A fresh instance is created when a run starts and handed to
 * every generation call of that run, so concurrent or consecutive runs never share counters.
 */
public final class UsageStats {

  private int httpRequests;
  private int successfulResponses;
  private int retryCount;
  private long promptTokens;
  private long completionTokens;
  private long totalTokens;
  private double totalCostUsd;
  private long totalLatencyMs;
  private long maxLatencyMs;

  synchronized void recordRequest(boolean retry) {
    httpRequests++;
    if (retry) {
      retryCount++;
    }
  }

  synchronized void recordLatency(long latencyMs) {
    totalLatencyMs += latencyMs;
    maxLatencyMs = Math.max(maxLatencyMs, latencyMs);
  }

  synchronized void recordSuccess(ChatCompletionResponse.Usage usage) {
    successfulResponses++;
    if (usage == null) {
      return;
    }
    promptTokens += nonNegative(usage.promptTokens());
    completionTokens += nonNegative(usage.completionTokens());
    long total = nonNegative(usage.totalTokens());
    totalTokens +=
        total > 0 ? total : nonNegative(usage.promptTokens()) + nonNegative(usage.completionTokens());
    Double cost = usage.totalCost() != null ? usage.totalCost() : usage.cost();
    if (cost != null && cost > 0) {
      totalCostUsd += cost;
    }
  }

  public synchronized Snapshot snapshot() {
    long average = httpRequests == 0 ? 0 : Math.round((double) totalLatencyMs / httpRequests);
    return new Snapshot(
        httpRequests,
        successfulResponses,
        retryCount,
        promptTokens,
        completionTokens,
        totalTokens,
        totalCostUsd,
        totalLatencyMs,
        average,
        maxLatencyMs);
  }

  private static long nonNegative(Long value) {
    return value == null || value < 0 ? 0 : value;
  }

  public record Snapshot(
      int httpRequests,
      int successfulResponses,
      int retryCount,
      long promptTokens,
      long completionTokens,
      long totalTokens,
      double totalCostUsd,
      long totalLatencyMs,
      long averageLatencyMs,
      long maxLatencyMs) {

    public static Snapshot empty() {
      return new Snapshot(0, 0, 0, 0, 0, 0, 0.0d, 0, 0, 0);
    }
  }
}
