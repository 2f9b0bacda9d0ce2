/*
 * どこで: Access grant リソース層の補助
 * 何を: pet の owner 解決と認可判定をまとめ、owner 限定操作と scope 必須操作のチェックを提供する
 * なぜ: ハンドラごとに owner 解決や拒否メッセージがぶれないようにするため
 */
package com.example.accessgrant.service;

import com.example.accessgrant.api.GrantForbiddenException;
import com.example.accessgrant.model.AccessDecision;
import com.example.accessgrant.model.CallContext;
import com.example.accessgrant.model.GrantScope;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PetAccessService {

  static final String FORBIDDEN_MESSAGE = "access to pet is not allowed";

  private final PetOwnershipLookup petOwnershipLookup;
  private final AccessAuthorizer accessAuthorizer;

  /** owner 本人でなければ Forbidden。戻り値は解決済みの owner user id。 */
  public String requireOwner(CallContext ctx, String callerUserId, String petId) {
    final String ownerUserId = petOwnershipLookup.ownerOf(ctx, petId);
    if (callerUserId == null || !callerUserId.equals(ownerUserId)) {
      throw new GrantForbiddenException(FORBIDDEN_MESSAGE);
    }
    return ownerUserId;
  }

  public AccessDecision authorize(
      CallContext ctx, String callerUserId, String petId, GrantScope scope) {
    final String ownerUserId = petOwnershipLookup.ownerOf(ctx, petId);
    return accessAuthorizer.authorize(ctx, callerUserId, ownerUserId, petId, scope);
  }

  // grant がない場合と scope が足りない場合を区別しない。
  public void requireScope(CallContext ctx, String callerUserId, String petId, GrantScope scope) {
    if (!authorize(ctx, callerUserId, petId, scope).isAllowed()) {
      throw new GrantForbiddenException(FORBIDDEN_MESSAGE);
    }
  }
}
