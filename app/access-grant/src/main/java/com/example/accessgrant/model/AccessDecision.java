package com.example.accessgrant.model;

import java.util.Locale;

public enum AccessDecision {
  ALLOW,
  DENY;

  public boolean isAllowed() {
    return this == ALLOW;
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
