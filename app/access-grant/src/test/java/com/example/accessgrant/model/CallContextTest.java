package com.example.accessgrant.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.accessgrant.MutableClock;
import com.example.accessgrant.api.OperationCancelledException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CallContextTest {

  @Test
  void backgroundContextNeverExpires() {
    final CallContext ctx = CallContext.background();

    assertThat(ctx.remaining()).isEmpty();
    assertThatCode(ctx::ensureActive).doesNotThrowAnyException();
  }

  @Test
  void deadlineExpiresWithClock() {
    final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    final CallContext ctx = CallContext.withTimeout(clock, Duration.ofSeconds(2));

    assertThat(ctx.remaining()).contains(Duration.ofSeconds(2));
    assertThatCode(ctx::ensureActive).doesNotThrowAnyException();

    clock.advance(Duration.ofSeconds(3));

    assertThat(ctx.remaining()).contains(Duration.ZERO);
    assertThatThrownBy(ctx::ensureActive)
        .isInstanceOf(OperationCancelledException.class)
        .hasMessage("operation deadline exceeded");
  }

  @Test
  void explicitCancelIsObserved() {
    final CallContext ctx = CallContext.background();

    ctx.cancel();

    assertThatThrownBy(ctx::ensureActive)
        .isInstanceOf(OperationCancelledException.class)
        .hasMessage("operation cancelled");
  }

  @Test
  void rejectsNonPositiveTimeout() {
    final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));

    assertThatThrownBy(() -> CallContext.withTimeout(clock, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
