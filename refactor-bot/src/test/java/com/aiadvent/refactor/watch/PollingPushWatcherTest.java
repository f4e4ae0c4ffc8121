package com.aiadvent.refactor.watch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aiadvent.refactor.git.GitClient;
import com.aiadvent.refactor.git.PushEventPayload;
import com.aiadvent.refactor.process.CommandResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PollingPushWatcherTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private GitClient git;
  private PollingPushWatcher watcher;

  @BeforeEach
  void setUp() {
    git = mock(GitClient.class);
    when(git.run("fetch", "origin", "main")).thenReturn("");
    watcher = new PollingPushWatcher(git, objectMapper, "main", Duration.ofSeconds(1), d -> {});
  }

  @Test
  void unchangedHeadIsIdle() {
    when(git.revParse("origin/main")).thenReturn("h1");
    watcher.initialize();

    PollingPushWatcher.PollResult result =
        watcher.pollOnce(event -> {
          throw new AssertionError("callback must not run");
        });

    assertThat(result).isEqualTo(PollingPushWatcher.PollResult.IDLE);
    verify(git, never()).run("checkout", "main");
  }

  @Test
  void newHeadIsProcessedWithTemporaryEventPayload() {
    when(git.revParse("origin/main")).thenReturn("h1", "h2");
    when(git.runUnchecked("merge-base", "--is-ancestor", "h1", "h2"))
        .thenReturn(new CommandResult(List.of(), 0, "", ""));
    watcher.initialize();
    AtomicReference<WatchEvent> seen = new AtomicReference<>();
    AtomicReference<PushEventPayload> payload = new AtomicReference<>();

    PollingPushWatcher.PollResult result =
        watcher.pollOnce(
            event -> {
              seen.set(event);
              try {
                payload.set(
                    objectMapper.readValue(event.eventPath().toFile(), PushEventPayload.class));
              } catch (IOException ex) {
                throw new IllegalStateException(ex);
              }
            });

    assertThat(result).isEqualTo(PollingPushWatcher.PollResult.PROCESSED);
    assertThat(seen.get().baseSha()).isEqualTo("h1");
    assertThat(seen.get().headSha()).isEqualTo("h2");
    assertThat(payload.get()).isEqualTo(new PushEventPayload("h1", "h2", "refs/heads/main"));
    assertThat(Files.exists(seen.get().eventPath())).isFalse();
    assertThat(watcher.lastSeenHead()).isEqualTo("h2");
    verify(git).run("merge", "--ff-only", "origin/main");
    verify(git).run("checkout", "--force", "main");
  }

  @Test
  void failedCallbackKeepsBaselineForRetry() {
    when(git.revParse("origin/main")).thenReturn("h1", "h2", "h2");
    when(git.runUnchecked("merge-base", "--is-ancestor", "h1", "h2"))
        .thenReturn(new CommandResult(List.of(), 0, "", ""));
    watcher.initialize();
    List<String> ranges = new ArrayList<>();

    PollingPushWatcher.PollResult first =
        watcher.pollOnce(
            event -> {
              ranges.add(event.baseSha() + ".." + event.headSha());
              throw new IllegalStateException("run failed");
            });
    PollingPushWatcher.PollResult second =
        watcher.pollOnce(event -> ranges.add(event.baseSha() + ".." + event.headSha()));

    assertThat(first).isEqualTo(PollingPushWatcher.PollResult.FAILED);
    assertThat(second).isEqualTo(PollingPushWatcher.PollResult.PROCESSED);
    assertThat(ranges).containsExactly("h1..h2", "h1..h2");
    verify(git, times(2)).run("checkout", "--force", "main");
  }

  @Test
  void rewrittenHistoryFallsBackToMergeBase() {
    when(git.runUnchecked("merge-base", "--is-ancestor", "old", "new"))
        .thenReturn(new CommandResult(List.of(), 1, "", ""));
    when(git.runUnchecked("merge-base", "old", "new"))
        .thenReturn(new CommandResult(List.of(), 0, "common\n", ""));

    assertThat(watcher.resolveBaseSha("old", "new")).isEqualTo("common");
  }

  @Test
  void unrelatedHistoryFallsBackToParentOfHead() {
    when(git.runUnchecked("merge-base", "--is-ancestor", "old", "new"))
        .thenReturn(new CommandResult(List.of(), 1, "", ""));
    when(git.runUnchecked("merge-base", "old", "new"))
        .thenReturn(new CommandResult(List.of(), 1, "", ""));
    when(git.runUnchecked("rev-parse", "--verify", "--quiet", "new~1"))
        .thenReturn(new CommandResult(List.of(), 0, "parent\n", ""));

    assertThat(watcher.resolveBaseSha("old", "new")).isEqualTo("parent");
  }

  @Test
  void stopEndsWatchLoopBeforeNextPoll() {
    when(git.revParse("origin/main")).thenReturn("h1");
    AtomicReference<PollingPushWatcher> holder = new AtomicReference<>();
    PollingPushWatcher stoppable =
        new PollingPushWatcher(
            git, objectMapper, "main", Duration.ofSeconds(5), d -> holder.get().stop());
    holder.set(stoppable);

    stoppable.watch(event -> {});

    assertThat(stoppable.isStopped()).isTrue();
    verify(git, times(1)).run("fetch", "origin", "main");
  }

  @Test
  void interruptedSleepStopsWatcher() {
    when(git.revParse("origin/main")).thenReturn("h1");
    PollingPushWatcher interrupted =
        new PollingPushWatcher(
            git,
            objectMapper,
            "main",
            Duration.ofSeconds(5),
            d -> {
              throw new InterruptedException("shutdown");
            });

    interrupted.watch(event -> {});

    assertThat(interrupted.isStopped()).isTrue();
    assertThat(Thread.interrupted()).isTrue();
  }
}
