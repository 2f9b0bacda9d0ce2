/*
 * どこで: Access grant 認可判定
 * 何を: 「この呼び出し元はこの pet に対してこの scope の操作をしてよいか」を allow/deny で返す
 * なぜ: リソース層が owner 判定と grant の scope 判定を同じ規則で行えるようにするため
 */
package com.example.accessgrant.service;

import com.example.accessgrant.model.AccessDecision;
import com.example.accessgrant.model.CallContext;
import com.example.accessgrant.model.GrantRecord;
import com.example.accessgrant.model.GrantScope;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AccessAuthorizer {

  private static final Logger logger = LoggerFactory.getLogger(AccessAuthorizer.class);

  private final AccessGrantService accessGrantService;
  private final AccessGrantMetrics metrics;

  /**
   * owner は grant の有無や scope に関係なく常に allow。
   * それ以外は (pet, caller) の active grant が必要な scope を含む場合だけ allow。
   * 判定は毎回 Store を引き直し、キャッシュしない。
   */
  public AccessDecision authorize(
      CallContext ctx, String callerUserId, String petOwnerUserId, String petId, GrantScope scope) {
    final AccessDecision decision = decide(ctx, callerUserId, petOwnerUserId, petId, scope);
    metrics.recordDecision(decision);
    logger.debug(
        "access decision petId={} callerUserId={} scope={} decision={}",
        petId,
        callerUserId,
        scope == null ? null : scope.value(),
        decision.value());
    return decision;
  }

  private AccessDecision decide(
      CallContext ctx, String callerUserId, String petOwnerUserId, String petId, GrantScope scope) {
    if (isBlank(callerUserId) || isBlank(petId)) {
      return AccessDecision.DENY;
    }
    if (callerUserId.equals(petOwnerUserId)) {
      return AccessDecision.ALLOW;
    }
    // scope なしはカタログ外の scope を意味し、どの grant にも含まれない。
    if (scope == null) {
      return AccessDecision.DENY;
    }
    final Optional<GrantRecord> active =
        accessGrantService.findActiveGrant(ctx, petId, callerUserId);
    if (active.isPresent() && active.get().hasScope(scope)) {
      return AccessDecision.ALLOW;
    }
    return AccessDecision.DENY;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
