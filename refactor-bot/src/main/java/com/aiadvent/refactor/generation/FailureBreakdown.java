package com.aiadvent.refactor.generation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Per-kind counts of chunk generation failures within one run. */
public final class FailureBreakdown {

  private final EnumMap<ChunkFailureType, Integer> counts = new EnumMap<>(ChunkFailureType.class);

  public void record(ChunkFailureType type) {
    counts.merge(type, 1, Integer::sum);
  }

  public int count(ChunkFailureType type) {
    return counts.getOrDefault(type, 0);
  }

  public int total() {
    int total = 0;
    for (int value : counts.values()) {
      total += value;
    }
    return total;
  }

  public Map<ChunkFailureType, Integer> asMap() {
    return Collections.unmodifiableMap(new EnumMap<>(counts));
  }

  public ModelFailureSubtype subtype() {
    ChunkFailureType single = null;
    int kinds = 0;
    for (Map.Entry<ChunkFailureType, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > 0) {
        kinds++;
        single = entry.getKey();
      }
    }
    if (kinds == 0) {
      return ModelFailureSubtype.UNKNOWN;
    }
    return kinds == 1 ? ModelFailureSubtype.of(single) : ModelFailureSubtype.MIXED;
  }
}
