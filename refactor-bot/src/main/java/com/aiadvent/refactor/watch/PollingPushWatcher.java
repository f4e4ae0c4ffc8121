package com.aiadvent.refactor.watch;

import com.aiadvent.refactor.config.RefactorBotProperties;
import com.aiadvent.refactor.git.GitClient;
import com.aiadvent.refactor.git.PushEventPayload;
import com.aiadvent.refactor.process.CommandExecutionException;
import com.aiadvent.refactor.process.CommandResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * Polls the remote base branch and hands every new range to a callback, one at a time. The
 * baseline only advances after a successful callback, so a failed range is attempted again on the
 * next poll.
 */
@Component
public class PollingPushWatcher {

  private static final Logger log = LoggerFactory.getLogger(PollingPushWatcher.class);
  private static final Duration SLEEP_SLICE = Duration.ofMillis(500);

  public enum PollResult {
    IDLE,
    PROCESSED,
    FAILED
  }

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final GitClient git;
  private final ObjectMapper objectMapper;
  private final String baseBranch;
  private final Duration pollInterval;
  private final Sleeper sleeper;
  private final AtomicBoolean stopped = new AtomicBoolean(false);
  private volatile String lastSeenHead;

  @Autowired
  public PollingPushWatcher(
      GitClient git, ObjectMapper objectMapper, RefactorBotProperties properties) {
    this(
        git,
        objectMapper,
        properties.getBaseBranch(),
        properties.getWatch().getPollInterval(),
        duration -> Thread.sleep(duration.toMillis()));
  }

  PollingPushWatcher(
      GitClient git,
      ObjectMapper objectMapper,
      String baseBranch,
      Duration pollInterval,
      Sleeper sleeper) {
    this.git = Objects.requireNonNull(git, "git");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.baseBranch = Objects.requireNonNull(baseBranch, "baseBranch");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /** Records the current remote head as the baseline; ranges before it are never processed. */
  public void initialize() {
    lastSeenHead = fetchRemoteHead();
    log.info("Watch baseline: branch={}, head={}", baseBranch, lastSeenHead);
  }

  public PollResult pollOnce(WatchCallback callback) {
    Objects.requireNonNull(callback, "callback");
    String remoteHead = fetchRemoteHead();
    String previous = lastSeenHead;
    if (remoteHead.equals(previous)) {
      return PollResult.IDLE;
    }
    String baseSha = resolveBaseSha(previous, remoteHead);
    log.info("New push detected: branch={}, range={}..{}", baseBranch, baseSha, remoteHead);
    Path tempDir = null;
    try {
      tempDir = Files.createTempDirectory("refactor-watch-");
      Path eventPath = tempDir.resolve("event.json");
      objectMapper.writeValue(
          eventPath.toFile(),
          new PushEventPayload(baseSha, remoteHead, "refs/heads/" + baseBranch));
      syncBaseBranch();
      callback.onRange(new WatchEvent(eventPath, baseSha, remoteHead));
      lastSeenHead = remoteHead;
      return PollResult.PROCESSED;
    } catch (IOException ex) {
      log.error("Failed to prepare push event for {}..{}: {}", baseSha, remoteHead, ex.getMessage());
      return PollResult.FAILED;
    } catch (RuntimeException ex) {
      log.error("Processing {}..{} failed, will retry on next poll", baseSha, remoteHead, ex);
      return PollResult.FAILED;
    } finally {
      deleteTempDir(tempDir);
      restoreBaseBranch();
    }
  }

  /** Blocks until {@link #stop()} is called, polling at the configured interval. */
  public void watch(WatchCallback callback) {
    initialize();
    log.info("Watching origin/{} every {}s", baseBranch, pollInterval.toSeconds());
    while (!stopped.get()) {
      if (!sleepUntilNextPoll()) {
        break;
      }
      if (stopped.get()) {
        break;
      }
      try {
        PollResult result = pollOnce(callback);
        log.debug("Watch poll finished: result={}", result);
      } catch (CommandExecutionException ex) {
        log.error("Watch poll failed: {}", ex.getMessage());
      }
    }
    log.info("Watch stopped");
  }

  public void stop() {
    stopped.set(true);
  }

  public boolean isStopped() {
    return stopped.get();
  }

  String lastSeenHead() {
    return lastSeenHead;
  }

  String resolveBaseSha(String previous, String head) {
    if (previous == null) {
      String parent = revParseOrNull(head + "~1");
      return parent != null ? parent : head;
    }
    if (isAncestor(previous, head)) {
      return previous;
    }
    CommandResult mergeBase = git.runUnchecked("merge-base", previous, head);
    if (mergeBase.succeeded() && !mergeBase.stdout().isBlank()) {
      return mergeBase.stdout().trim();
    }
    String parent = revParseOrNull(head + "~1");
    return parent != null ? parent : previous;
  }

  private boolean isAncestor(String ancestor, String descendant) {
    CommandResult result = git.runUnchecked("merge-base", "--is-ancestor", ancestor, descendant);
    if (result.exitCode() == 0) {
      return true;
    }
    if (result.exitCode() == 1) {
      return false;
    }
    log.warn("Ancestry check {} -> {} failed: {}", ancestor, descendant, result.diagnostics());
    return false;
  }

  private String revParseOrNull(String ref) {
    CommandResult result = git.runUnchecked("rev-parse", "--verify", "--quiet", ref);
    return result.succeeded() && !result.stdout().isBlank() ? result.stdout().trim() : null;
  }

  private String fetchRemoteHead() {
    git.run("fetch", "origin", baseBranch);
    return git.revParse("origin/" + baseBranch);
  }

  private void syncBaseBranch() {
    git.run("checkout", baseBranch);
    git.run("merge", "--ff-only", "origin/" + baseBranch);
  }

  private void restoreBaseBranch() {
    try {
      git.run("checkout", "--force", baseBranch);
    } catch (CommandExecutionException ex) {
      log.warn("Failed to restore {} after poll: {}", baseBranch, ex.getMessage());
    }
  }

  private boolean sleepUntilNextPoll() {
    long remaining = pollInterval.toMillis();
    try {
      while (remaining > 0 && !stopped.get()) {
        long slice = Math.min(remaining, SLEEP_SLICE.toMillis());
        sleeper.sleep(Duration.ofMillis(slice));
        remaining -= slice;
      }
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      stopped.set(true);
      return false;
    }
  }

  private static void deleteTempDir(Path dir) {
    if (dir == null) {
      return;
    }
    try {
      FileSystemUtils.deleteRecursively(dir);
    } catch (IOException ex) {
      log.warn("Failed to delete watch event directory {}: {}", dir, ex.getMessage());
    }
  }
}
