/*
 * どこで: Access grant Repository 層
 * 何を: grant をプロセス内の Map に保持する参照実装
 * なぜ: DB なしでの起動やテストで、Store 契約どおりに振る舞う実装を提供するため
 */
package com.example.accessgrant.repository;

import com.example.accessgrant.api.GrantAlreadyExistsException;
import com.example.accessgrant.api.GrantNotFoundException;
import com.example.accessgrant.api.OperationCancelledException;
import com.example.accessgrant.model.CallContext;
import com.example.accessgrant.model.GrantOrdering;
import com.example.accessgrant.model.GrantRecord;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "access-grant.store.type", havingValue = "memory")
public class InMemoryGrantStore implements GrantStore {

  // インスタンス単位の単一ロック。読み取りと書き込みを同じロックで直列化する。
  // 再入可能なので withPairLock 区間の中から他のメソッドを呼べる。
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, GrantRecord> grantsById = new HashMap<>();

  @Override
  public void create(CallContext ctx, GrantRecord grant) {
    acquire(ctx);
    try {
      ctx.ensureActive();
      if (grantsById.containsKey(grant.grantId())) {
        throw new GrantAlreadyExistsException(grant.grantId());
      }
      grantsById.put(grant.grantId(), grant);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void update(CallContext ctx, GrantRecord grant) {
    acquire(ctx);
    try {
      ctx.ensureActive();
      if (!grantsById.containsKey(grant.grantId())) {
        throw new GrantNotFoundException(grant.grantId());
      }
      grantsById.put(grant.grantId(), grant);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<GrantRecord> findById(CallContext ctx, String grantId) {
    acquire(ctx);
    try {
      return Optional.ofNullable(grantsById.get(grantId));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<GrantRecord> listByPet(CallContext ctx, String petId) {
    acquire(ctx);
    try {
      return grantsById.values().stream()
          .filter(grant -> grant.petId().equals(petId))
          .sorted(GrantOrdering.OLDEST_FIRST)
          .toList();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<GrantRecord> listByGrantee(CallContext ctx, String granteeUserId) {
    acquire(ctx);
    try {
      return grantsById.values().stream()
          .filter(grant -> grant.granteeUserId().equals(granteeUserId))
          .sorted(GrantOrdering.MOST_RECENT_FIRST)
          .toList();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<GrantRecord> findActiveGrant(
      CallContext ctx, String petId, String granteeUserId) {
    acquire(ctx);
    try {
      return grantsById.values().stream()
          .filter(grant -> grant.isActive() && grant.isForPair(petId, granteeUserId))
          .min(GrantOrdering.MOST_RECENT_FIRST);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public <T> T withPairLock(
      CallContext ctx, String petId, String granteeUserId, Supplier<T> action) {
    acquire(ctx);
    try {
      ctx.ensureActive();
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  private void acquire(CallContext ctx) {
    ctx.ensureActive();
    final Optional<Duration> remaining = ctx.remaining();
    if (remaining.isEmpty()) {
      lock.lock();
      return;
    }
    try {
      if (!lock.tryLock(remaining.get().toNanos(), TimeUnit.NANOSECONDS)) {
        throw new OperationCancelledException("grant store lock wait exceeded deadline");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new OperationCancelledException("interrupted while waiting for grant store lock", ex);
    }
  }
}
