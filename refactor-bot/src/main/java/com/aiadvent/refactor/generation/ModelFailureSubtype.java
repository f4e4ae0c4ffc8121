package com.aiadvent.refactor.generation;

import java.util.Locale;

/** Why a run produced no patch at all: one failure kind, or {@link #MIXED} when several occurred. */
public enum ModelFailureSubtype {
  TIMEOUT,
  INVALID_OUTPUT,
  API_ERROR,
  UNKNOWN,
  MIXED;

  static ModelFailureSubtype of(ChunkFailureType type) {
    return valueOf(type.name());
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
