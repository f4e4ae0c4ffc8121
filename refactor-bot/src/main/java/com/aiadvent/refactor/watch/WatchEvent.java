package com.aiadvent.refactor.watch;

import java.nio.file.Path;

/** A newly observed range on the base branch, with the push payload written for it. */
public record WatchEvent(Path eventPath, String baseSha, String headSha) {}
