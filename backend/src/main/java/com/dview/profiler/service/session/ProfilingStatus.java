package com.dview.profiler.service.session;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProfilingStatus {
  NOT_STARTED("not_started"),
  RUNNING("running"),
  COMPLETED("completed"),
  ERROR("error");

  private final String label;

  ProfilingStatus(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
