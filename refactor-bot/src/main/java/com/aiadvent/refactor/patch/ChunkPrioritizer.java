package com.aiadvent.refactor.patch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders chunks so the safest, most useful work is attempted first. Under strict guarding source
 * files rank below tests, docs and config because their patches are the likeliest to be blocked.
 */
public final class ChunkPrioritizer {

  static final int TEST_SCORE = 100;
  static final int DOC_OR_CONFIG_SCORE = 80;
  static final int SOURCE_SCORE = 70;
  static final int STRICT_SOURCE_SCORE = 40;
  static final int OTHER_SCORE = 50;
  static final int LOW_SIGNAL_SCORE = 10;

  private ChunkPrioritizer() {}

  public static List<DiffChunk> prioritize(List<DiffChunk> chunks, BehaviorGuardMode mode) {
    List<DiffChunk> ordered = new ArrayList<>(chunks);
    ordered.sort(
        Comparator.comparingInt((DiffChunk chunk) -> score(chunk, mode))
            .reversed()
            .thenComparingInt(DiffChunk::size));
    return ordered;
  }

  public static int score(DiffChunk chunk, BehaviorGuardMode mode) {
    int best = Integer.MIN_VALUE;
    for (String file : chunk.files()) {
      best = Math.max(best, fileScore(file, mode));
    }
    return best;
  }

  static int fileScore(String path, BehaviorGuardMode mode) {
    return switch (FileClassifier.classify(path)) {
      case TEST -> TEST_SCORE;
      case DOC, CONFIG -> DOC_OR_CONFIG_SCORE;
      case GENERATED -> LOW_SIGNAL_SCORE;
      case SOURCE -> mode == BehaviorGuardMode.STRICT ? STRICT_SOURCE_SCORE : SOURCE_SCORE;
      case OTHER -> OTHER_SCORE;
    };
  }
}
