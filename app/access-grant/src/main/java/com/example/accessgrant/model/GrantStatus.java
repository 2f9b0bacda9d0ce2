/*
 * どこで: Access grant ドメインモデル
 * 何を: grant のライフサイクル状態を定義する
 * なぜ: invited -> active -> revoked の遷移を列挙型で固定するため
 */
package com.example.accessgrant.model;

public enum GrantStatus {
  INVITED("invited"),
  ACTIVE("active"),
  REVOKED("revoked");

  private final String value;

  GrantStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public boolean isTerminal() {
    return this == REVOKED;
  }

  public static GrantStatus fromValue(String status) {
    for (GrantStatus grantStatus : values()) {
      if (grantStatus.value.equalsIgnoreCase(status)) {
        return grantStatus;
      }
    }
    throw new IllegalArgumentException("unsupported status: " + status);
  }
}
