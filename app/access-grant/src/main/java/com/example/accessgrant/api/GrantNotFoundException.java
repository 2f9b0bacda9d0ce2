/*
 * どこで: Access grant API
 * 何を: grant 未検出を表現する
 * なぜ: accept/revoke/参照の 404 応答へ変換するため
 */
package com.example.accessgrant.api;

public class GrantNotFoundException extends RuntimeException {

  public GrantNotFoundException(String grantId) {
    super("grant not found: " + grantId);
  }

  public static GrantNotFoundException forActivePair(String petId, String granteeUserId) {
    return new GrantNotFoundException("active grant for pet " + petId + " and " + granteeUserId);
  }
}
