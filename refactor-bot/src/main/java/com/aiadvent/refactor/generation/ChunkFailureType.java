package com.aiadvent.refactor.generation;

import java.util.Locale;

public enum ChunkFailureType {
  TIMEOUT,
  INVALID_OUTPUT,
  API_ERROR,
  UNKNOWN;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
