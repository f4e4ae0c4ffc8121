package com.aiadvent.refactor.patch;

import java.util.Locale;

public enum BehaviorGuardMode {
  STRICT,
  OFF;

  public static BehaviorGuardMode parse(String value) {
    if (value == null || value.isBlank()) {
      return STRICT;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException(
          "Unsupported behavior guard mode '" + value + "', expected strict or off", ex);
    }
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
