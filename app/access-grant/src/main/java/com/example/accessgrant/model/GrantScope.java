/*
 * どこで: Access grant ドメインモデル
 * 何を: 委任可能な scope の閉じた集合 (scope カタログ) を定義する
 * なぜ: 未知の scope を列挙型で機械的に拒否できるようにするため
 */
package com.example.accessgrant.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

public enum GrantScope {
  PET_READ("pet:read"),
  PET_EDIT_PROFILE("pet:edit_profile"),
  EVENTS_READ("events:read"),
  EVENTS_CREATE("events:create"),
  EVENTS_VOID("events:void"),
  ATTACHMENTS_ADD("attachments:add");

  // 空の scope 指定で招待されたときに付与する最小セット (プロダクト判断)。
  private static final Set<GrantScope> DEFAULT_SCOPES =
      Collections.unmodifiableSet(EnumSet.of(PET_READ, EVENTS_READ));

  private final String value;

  GrantScope(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** scope 文字列がカタログに含まれるかを返す。大文字小文字は区別する。 */
  public static boolean isValid(String scope) {
    return find(scope).isPresent();
  }

  public static Optional<GrantScope> find(String scope) {
    if (scope == null) {
      return Optional.empty();
    }
    for (GrantScope grantScope : values()) {
      if (grantScope.value.equals(scope)) {
        return Optional.of(grantScope);
      }
    }
    return Optional.empty();
  }

  /**
   * 役割: 永続化層や API から受け取った scope 文字列を列挙型へ変換する。
   * 動作: 完全一致で判定し、未知の値は IllegalArgumentException を送出する。
   */
  public static GrantScope fromValue(String scope) {
    return find(scope).orElseThrow(() -> new IllegalArgumentException("unknown scope: " + scope));
  }

  public static Set<GrantScope> defaultScopes() {
    return DEFAULT_SCOPES;
  }
}
