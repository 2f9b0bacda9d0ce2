/*
 * どこで: Access grant ドメインモデル
 * 何を: 1 pet に対する owner -> grantee の委任 (grant) のスナップショットを表す
 * なぜ: Store/Engine/API 間で不変条件を満たした値だけを受け渡すため
 */
package com.example.accessgrant.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public record GrantRecord(
    String grantId,
    String petId,
    String ownerUserId,
    String granteeUserId,
    Set<GrantScope> scopes,
    GrantStatus status,
    Instant createdAt,
    Instant updatedAt,
    Instant revokedAt) {

  public GrantRecord {
    requireText(grantId, "grantId");
    requireText(petId, "petId");
    requireText(ownerUserId, "ownerUserId");
    requireText(granteeUserId, "granteeUserId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
    if (ownerUserId.equals(granteeUserId)) {
      throw new IllegalArgumentException("owner and grantee must differ");
    }
    if (scopes == null || scopes.isEmpty()) {
      throw new IllegalArgumentException("scopes must not be empty");
    }
    if ((status == GrantStatus.REVOKED) != (revokedAt != null)) {
      throw new IllegalArgumentException("revokedAt must be set only for revoked grants");
    }
    scopes = Collections.unmodifiableSet(EnumSet.copyOf(scopes));
  }

  public static GrantRecord invite(
      String grantId,
      String petId,
      String ownerUserId,
      String granteeUserId,
      Set<GrantScope> scopes,
      Instant now) {
    return new GrantRecord(
        grantId, petId, ownerUserId, granteeUserId, scopes, GrantStatus.INVITED, now, now, null);
  }

  public boolean isRevoked() {
    return status == GrantStatus.REVOKED;
  }

  public boolean isActive() {
    return status == GrantStatus.ACTIVE;
  }

  public boolean hasScope(GrantScope scope) {
    return scopes.contains(scope);
  }

  public boolean isForPair(String otherPetId, String otherGranteeUserId) {
    return petId.equals(otherPetId) && granteeUserId.equals(otherGranteeUserId);
  }

  public GrantRecord activate(Instant now) {
    if (status != GrantStatus.INVITED) {
      throw new IllegalStateException("only invited grants can be activated: " + status);
    }
    return new GrantRecord(
        grantId, petId, ownerUserId, granteeUserId, scopes, GrantStatus.ACTIVE, createdAt, now,
        null);
  }

  public GrantRecord revoke(Instant now) {
    if (isRevoked()) {
      return this;
    }
    return new GrantRecord(
        grantId, petId, ownerUserId, granteeUserId, scopes, GrantStatus.REVOKED, createdAt, now,
        now);
  }

  // 再招待: scope を置き換えて updated_at だけ進める。状態 (invited/active) は維持する。
  public GrantRecord withScopes(Set<GrantScope> newScopes, Instant now) {
    if (isRevoked()) {
      throw new IllegalStateException("revoked grants cannot be changed");
    }
    return new GrantRecord(
        grantId, petId, ownerUserId, granteeUserId, newScopes, status, createdAt, now, null);
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
