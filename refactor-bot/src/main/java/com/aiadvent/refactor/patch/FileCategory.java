package com.aiadvent.refactor.patch;

public enum FileCategory {
  TEST,
  DOC,
  CONFIG,
  GENERATED,
  SOURCE,
  OTHER
}
