/*
 * どこで: Access grant ドメインモデル
 * 何を: 呼び出し元から渡される取消シグナル (期限/明示キャンセル) を保持する
 * なぜ: Engine から Store まで同じ期限を伝播し、期限切れ後の書き込みを防ぐため
 */
package com.example.accessgrant.model;

import com.example.accessgrant.api.OperationCancelledException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

public final class CallContext {

  private final Clock clock;
  private final Instant deadline;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  private CallContext(Clock clock, Instant deadline) {
    this.clock = clock;
    this.deadline = deadline;
  }

  /** 期限なし。バッチやテストからの呼び出し用。 */
  public static CallContext background() {
    return new CallContext(Clock.systemUTC(), null);
  }

  public static CallContext withTimeout(Clock clock, Duration timeout) {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    return new CallContext(clock, Instant.now(clock).plus(timeout));
  }

  public void cancel() {
    cancelled.set(true);
  }

  /** 期限までの残り時間。期限なしなら empty、期限切れなら ZERO。 */
  public Optional<Duration> remaining() {
    if (deadline == null) {
      return Optional.empty();
    }
    final Duration remaining = Duration.between(Instant.now(clock), deadline);
    return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
  }

  public void ensureActive() {
    if (cancelled.get()) {
      throw new OperationCancelledException("operation cancelled");
    }
    if (deadline != null && !Instant.now(clock).isBefore(deadline)) {
      throw new OperationCancelledException("operation deadline exceeded");
    }
  }
}
