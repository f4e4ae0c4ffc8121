package com.aiadvent.refactor.watch;

/** Processes one observed range; throwing marks the range as failed so it is retried. */
@FunctionalInterface
public interface WatchCallback {

  void onRange(WatchEvent event);
}
