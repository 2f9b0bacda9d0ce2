/*
 * どこで: Access grant サービス層
 * 何を: invite -> accept -> revoke の状態遷移と (pet, grantee) ごとの単一 active 不変条件を担う
 * なぜ: 同時実行や汚れたデータがあっても active grant が 1 件に収束するようにするため
 */
package com.example.accessgrant.service;

import com.example.accessgrant.api.GrantForbiddenException;
import com.example.accessgrant.api.GrantNotFoundException;
import com.example.accessgrant.api.InvalidGrantInputException;
import com.example.accessgrant.api.InvalidGrantTransitionException;
import com.example.accessgrant.api.OperationCancelledException;
import com.example.accessgrant.model.CallContext;
import com.example.accessgrant.model.GrantOrdering;
import com.example.accessgrant.model.GrantRecord;
import com.example.accessgrant.model.GrantResult;
import com.example.accessgrant.model.GrantScope;
import com.example.accessgrant.model.GrantStatus;
import com.example.accessgrant.model.RepairFailure;
import com.example.accessgrant.repository.GrantStore;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AccessGrantService {

  private static final Logger logger = LoggerFactory.getLogger(AccessGrantService.class);

  static final String ACTION_INVITE = "INVITE";
  static final String ACTION_ACCEPT = "ACCEPT";
  static final String ACTION_REVOKE = "REVOKE";

  private final GrantStore grantStore;
  private final AccessGrantMetrics metrics;
  private final Clock clock;

  /**
   * 役割: owner から grantee への招待を作成、または既存招待の scope を置き換える。
   * 動作: 同じ (pet, owner, grantee) の未失効 grant があれば最新の 1 件を再利用し、残りは best-effort で失効させる。
   * 前提: scope が空なら既定の最小セットを使い、未知の scope が 1 つでもあれば全体を拒否する。
   */
  public GrantResult invite(
      CallContext ctx,
      String petId,
      String ownerUserId,
      String granteeUserId,
      Collection<String> requestedScopes) {
    return recorded(
        ACTION_INVITE,
        () -> {
          requireText(petId, "pet_id is required");
          requireText(ownerUserId, "owner_user_id is required");
          requireText(granteeUserId, "grantee_user_id is required");
          if (ownerUserId.equals(granteeUserId)) {
            throw new InvalidGrantInputException("owner cannot grant access to themselves");
          }
          final Set<GrantScope> scopes = resolveScopes(requestedScopes);
          return grantStore.withPairLock(
              ctx,
              petId,
              granteeUserId,
              () -> inviteLocked(ctx, petId, ownerUserId, granteeUserId, scopes));
        });
  }

  /**
   * 役割: grantee が招待を受諾し grant を active にする。
   * 動作: active 化 (または既に active であることの確認) の直後に、同じ (pet, grantee) の他の未失効 grant を失効させる。
   * 前提: revoked の grant は受諾できない。
   */
  public GrantResult accept(CallContext ctx, String grantId, String granteeUserId) {
    return recorded(
        ACTION_ACCEPT,
        () -> {
          requireText(grantId, "grant_id is required");
          requireText(granteeUserId, "grantee_user_id is required");
          final GrantRecord current = requireGrant(ctx, grantId);
          ensureGrantee(current, granteeUserId);
          return grantStore.withPairLock(
              ctx,
              current.petId(),
              current.granteeUserId(),
              () -> acceptLocked(ctx, grantId, granteeUserId));
        });
  }

  /**
   * 役割: owner が grant を失効させる。
   * 動作: invited/active から revoked へ遷移する。既に revoked なら何もせずそのまま返す。
   * 前提: grantee 自身は失効できない。
   */
  public GrantRecord revoke(CallContext ctx, String grantId, String ownerUserId) {
    return recorded(
        ACTION_REVOKE,
        () -> {
          requireText(grantId, "grant_id is required");
          requireText(ownerUserId, "owner_user_id is required");
          final GrantRecord current = requireGrant(ctx, grantId);
          ensureOwner(current, ownerUserId);
          if (current.isRevoked()) {
            return current;
          }
          return grantStore.withPairLock(
              ctx,
              current.petId(),
              current.granteeUserId(),
              () -> revokeLocked(ctx, grantId));
        });
  }

  public GrantRecord getActiveGrant(CallContext ctx, String petId, String granteeUserId) {
    return findActiveGrant(ctx, petId, granteeUserId)
        .orElseThrow(() -> GrantNotFoundException.forActivePair(petId, granteeUserId));
  }

  public Optional<GrantRecord> findActiveGrant(
      CallContext ctx, String petId, String granteeUserId) {
    requireText(petId, "pet_id is required");
    requireText(granteeUserId, "grantee_user_id is required");
    return grantStore.findActiveGrant(ctx, petId, granteeUserId);
  }

  public List<GrantRecord> listByPet(CallContext ctx, String petId) {
    requireText(petId, "pet_id is required");
    return grantStore.listByPet(ctx, petId);
  }

  /** statuses が空なら全件、指定があればその状態の grant だけを返す。 */
  public List<GrantRecord> listByGrantee(
      CallContext ctx, String granteeUserId, Set<GrantStatus> statuses) {
    requireText(granteeUserId, "grantee_user_id is required");
    final List<GrantRecord> grants = grantStore.listByGrantee(ctx, granteeUserId);
    if (statuses == null || statuses.isEmpty()) {
      return grants;
    }
    return grants.stream().filter(grant -> statuses.contains(grant.status())).toList();
  }

  private GrantResult inviteLocked(
      CallContext ctx,
      String petId,
      String ownerUserId,
      String granteeUserId,
      Set<GrantScope> scopes) {
    final List<GrantRecord> candidates =
        grantStore.listByPet(ctx, petId).stream()
            .filter(grant -> !grant.isRevoked())
            .filter(grant -> grant.ownerUserId().equals(ownerUserId))
            .filter(grant -> grant.granteeUserId().equals(granteeUserId))
            .sorted(GrantOrdering.MOST_RECENT_FIRST)
            .toList();
    final Instant now = now();
    if (candidates.isEmpty()) {
      final GrantRecord created =
          GrantRecord.invite(
              UUID.randomUUID().toString(), petId, ownerUserId, granteeUserId, scopes, now);
      grantStore.create(ctx, created);
      logger.info(
          "access grant invited grantId={} petId={} granteeUserId={} scopes={}",
          created.grantId(),
          petId,
          granteeUserId,
          created.scopes());
      return GrantResult.of(created);
    }
    // 再招待は新しい grant を作らず、最新の未失効 grant の scope を置き換える。
    final GrantRecord reinvited = candidates.get(0).withScopes(scopes, now);
    grantStore.update(ctx, reinvited);
    logger.info(
        "access grant re-invited grantId={} petId={} granteeUserId={} status={} scopes={}",
        reinvited.grantId(),
        petId,
        granteeUserId,
        reinvited.status().value(),
        reinvited.scopes());
    final List<RepairFailure> failures =
        revokeDuplicates(ctx, ACTION_INVITE, candidates.subList(1, candidates.size()), now);
    return new GrantResult(reinvited, failures);
  }

  private GrantResult acceptLocked(CallContext ctx, String grantId, String granteeUserId) {
    // ロック取得前に読んだ状態は古い可能性があるため、ロック内で読み直す。
    final GrantRecord grant = requireGrant(ctx, grantId);
    ensureGrantee(grant, granteeUserId);
    if (grant.isRevoked()) {
      throw new InvalidGrantTransitionException("revoked grant cannot be accepted");
    }
    final Instant now = now();
    GrantRecord accepted = grant;
    if (grant.status() == GrantStatus.INVITED) {
      accepted = grant.activate(now);
      grantStore.update(ctx, accepted);
      logger.info(
          "access grant accepted grantId={} petId={} granteeUserId={}",
          grantId,
          accepted.petId(),
          granteeUserId);
    }
    // ここから先は修復なので、失敗しても保存済みの activate は取り消さない。
    final List<GrantRecord> others;
    try {
      others = pairDuplicates(ctx, accepted);
    } catch (RuntimeException ex) {
      metrics.recordRepair(ACTION_ACCEPT, "failed");
      logger.warn(
          "access grant duplicate lookup failed action={} grantId={} petId={}",
          ACTION_ACCEPT,
          grantId,
          accepted.petId(),
          ex);
      return new GrantResult(accepted, List.of(new RepairFailure(grantId, describe(ex))));
    }
    final List<RepairFailure> failures = revokeDuplicates(ctx, ACTION_ACCEPT, others, now);
    return new GrantResult(accepted, failures);
  }

  private List<GrantRecord> pairDuplicates(CallContext ctx, GrantRecord winner) {
    return grantStore.listByPet(ctx, winner.petId()).stream()
        .filter(other -> !other.isRevoked())
        .filter(other -> other.isForPair(winner.petId(), winner.granteeUserId()))
        .filter(other -> !other.grantId().equals(winner.grantId()))
        .toList();
  }

  private GrantRecord revokeLocked(CallContext ctx, String grantId) {
    final GrantRecord grant = requireGrant(ctx, grantId);
    if (grant.isRevoked()) {
      return grant;
    }
    final GrantRecord revoked = grant.revoke(now());
    grantStore.update(ctx, revoked);
    logger.info(
        "access grant revoked grantId={} petId={} granteeUserId={} previousStatus={}",
        grantId,
        revoked.petId(),
        revoked.granteeUserId(),
        grant.status().value());
    return revoked;
  }

  // 修復は助言的な処理なので、個々の失敗は主たる遷移を失敗させずに結果へ積む。
  private List<RepairFailure> revokeDuplicates(
      CallContext ctx, String action, List<GrantRecord> duplicates, Instant now) {
    final List<RepairFailure> failures = new ArrayList<>();
    for (GrantRecord duplicate : duplicates) {
      try {
        grantStore.update(ctx, duplicate.revoke(now));
        metrics.recordRepair(action, "revoked");
        logger.warn(
            "access grant duplicate revoked action={} grantId={} petId={} granteeUserId={}",
            action,
            duplicate.grantId(),
            duplicate.petId(),
            duplicate.granteeUserId());
      } catch (RuntimeException ex) {
        failures.add(new RepairFailure(duplicate.grantId(), describe(ex)));
        metrics.recordRepair(action, "failed");
        logger.warn(
            "access grant duplicate revoke failed action={} grantId={} petId={}",
            action,
            duplicate.grantId(),
            duplicate.petId(),
            ex);
      }
    }
    return failures;
  }

  private Set<GrantScope> resolveScopes(Collection<String> requestedScopes) {
    final Set<String> normalized = new LinkedHashSet<>();
    if (requestedScopes != null) {
      for (String scope : requestedScopes) {
        if (scope == null || scope.isBlank()) {
          continue;
        }
        normalized.add(scope.trim());
      }
    }
    if (normalized.isEmpty()) {
      return GrantScope.defaultScopes();
    }
    final Set<GrantScope> resolved = EnumSet.noneOf(GrantScope.class);
    for (String scope : normalized) {
      resolved.add(
          GrantScope.find(scope)
              .orElseThrow(() -> new InvalidGrantInputException("unknown scope: " + scope)));
    }
    return resolved;
  }

  private GrantRecord requireGrant(CallContext ctx, String grantId) {
    return grantStore
        .findById(ctx, grantId)
        .orElseThrow(() -> new GrantNotFoundException(grantId));
  }

  private void ensureGrantee(GrantRecord grant, String granteeUserId) {
    if (!grant.granteeUserId().equals(granteeUserId)) {
      throw new GrantForbiddenException("only the grantee can accept grant " + grant.grantId());
    }
  }

  private void ensureOwner(GrantRecord grant, String ownerUserId) {
    if (!grant.ownerUserId().equals(ownerUserId)) {
      throw new GrantForbiddenException("only the owner can revoke grant " + grant.grantId());
    }
  }

  private void requireText(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new InvalidGrantInputException(message);
    }
  }

  // timestamptz はマイクロ秒精度なので、Store 間で往復しても値が変わらないよう揃える。
  private Instant now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
  }

  private <T> T recorded(String action, Supplier<T> operation) {
    try {
      final T result = operation.get();
      metrics.recordCommand(action, "success");
      return result;
    } catch (RuntimeException ex) {
      metrics.recordCommand(action, resultOf(ex));
      throw ex;
    }
  }

  private String resultOf(RuntimeException ex) {
    if (ex instanceof InvalidGrantInputException) {
      return "invalid_input";
    }
    if (ex instanceof GrantForbiddenException) {
      return "forbidden";
    }
    if (ex instanceof GrantNotFoundException) {
      return "not_found";
    }
    if (ex instanceof InvalidGrantTransitionException) {
      return "bad_state";
    }
    if (ex instanceof OperationCancelledException) {
      return "cancelled";
    }
    return "error";
  }

  private String describe(RuntimeException ex) {
    final String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }
}
