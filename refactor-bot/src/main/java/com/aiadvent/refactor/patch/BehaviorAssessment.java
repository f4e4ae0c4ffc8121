package com.aiadvent.refactor.patch;

import java.util.List;

public record BehaviorAssessment(boolean safe, List<String> reasons) {

  public BehaviorAssessment {
    reasons = reasons == null ? List.of() : List.copyOf(reasons);
  }

  public static BehaviorAssessment approved() {
    return new BehaviorAssessment(true, List.of());
  }

  public static BehaviorAssessment blocked(List<String> reasons) {
    return new BehaviorAssessment(false, reasons);
  }

  public String summary() {
    return String.join("; ", reasons);
  }
}
