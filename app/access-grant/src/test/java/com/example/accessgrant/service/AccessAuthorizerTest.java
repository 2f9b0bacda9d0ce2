/*
 * どこで: AccessAuthorizer の単体テスト
 * 何を: owner bypass と grant の scope 判定を招待から失効までの流れで検証する
 * なぜ: 失効が次の判定から即座に反映されることを保証するため
 */
package com.example.accessgrant.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.accessgrant.MutableClock;
import com.example.accessgrant.model.AccessDecision;
import com.example.accessgrant.model.CallContext;
import com.example.accessgrant.model.GrantRecord;
import com.example.accessgrant.model.GrantScope;
import com.example.accessgrant.repository.InMemoryGrantStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class AccessAuthorizerTest {

  private static final String PET_ID = "pet-1";
  private static final String OWNER_ID = "owner-1";
  private static final String GRANTEE_ID = "user-2";

  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
  private final CallContext ctx = CallContext.background();
  private SimpleMeterRegistry registry;
  private AccessGrantService accessGrantService;
  private AccessAuthorizer authorizer;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    final AccessGrantMetrics metrics = new AccessGrantMetrics(registry);
    accessGrantService = new AccessGrantService(new InMemoryGrantStore(), metrics, clock);
    authorizer = new AccessAuthorizer(accessGrantService, metrics);
  }

  @ParameterizedTest
  @EnumSource(GrantScope.class)
  void ownerIsAllowedWithoutAnyGrant(GrantScope scope) {
    assertThat(authorizer.authorize(ctx, OWNER_ID, OWNER_ID, PET_ID, scope))
        .isEqualTo(AccessDecision.ALLOW);
  }

  @Test
  void scopeOutsideCatalogIsAllowedOnlyForOwner() {
    final GrantRecord invited =
        accessGrantService
            .invite(ctx, PET_ID, OWNER_ID, GRANTEE_ID, List.of("pet:read", "events:read"))
            .grant();
    accessGrantService.accept(ctx, invited.grantId(), GRANTEE_ID);

    assertThat(authorizer.authorize(ctx, OWNER_ID, OWNER_ID, PET_ID, null))
        .isEqualTo(AccessDecision.ALLOW);
    assertThat(authorizer.authorize(ctx, GRANTEE_ID, OWNER_ID, PET_ID, null))
        .isEqualTo(AccessDecision.DENY);
  }

  @Test
  void inviteAcceptRevokeFlow() {
    final GrantRecord invited =
        accessGrantService
            .invite(
                ctx,
                PET_ID,
                OWNER_ID,
                GRANTEE_ID,
                List.of("pet:read", "events:read", "events:create"))
            .grant();

    assertThat(authorize(GrantScope.PET_READ)).isEqualTo(AccessDecision.DENY);

    clock.advance(Duration.ofSeconds(1));
    accessGrantService.accept(ctx, invited.grantId(), GRANTEE_ID);
    assertThat(authorize(GrantScope.PET_READ)).isEqualTo(AccessDecision.ALLOW);
    assertThat(authorize(GrantScope.EVENTS_CREATE)).isEqualTo(AccessDecision.ALLOW);

    clock.advance(Duration.ofSeconds(1));
    accessGrantService.revoke(ctx, invited.grantId(), OWNER_ID);
    assertThat(authorize(GrantScope.PET_READ)).isEqualTo(AccessDecision.DENY);
  }

  @Test
  void readOnlyDelegationCannotCreateEvents() {
    final GrantRecord invited =
        accessGrantService
            .invite(ctx, PET_ID, OWNER_ID, GRANTEE_ID, List.of("events:read"))
            .grant();
    accessGrantService.accept(ctx, invited.grantId(), GRANTEE_ID);

    assertThat(authorize(GrantScope.EVENTS_READ)).isEqualTo(AccessDecision.ALLOW);
    assertThat(authorize(GrantScope.EVENTS_CREATE)).isEqualTo(AccessDecision.DENY);
  }

  @Test
  void grantOnAnotherPetDoesNotApply() {
    final GrantRecord invited =
        accessGrantService.invite(ctx, "pet-2", OWNER_ID, GRANTEE_ID, List.of()).grant();
    accessGrantService.accept(ctx, invited.grantId(), GRANTEE_ID);

    assertThat(authorize(GrantScope.PET_READ)).isEqualTo(AccessDecision.DENY);
  }

  @Test
  void blankCallerIsDeniedAndDecisionsAreCounted() {
    assertThat(authorizer.authorize(ctx, " ", OWNER_ID, PET_ID, GrantScope.PET_READ))
        .isEqualTo(AccessDecision.DENY);
    assertThat(authorizer.authorize(ctx, OWNER_ID, OWNER_ID, PET_ID, GrantScope.PET_READ))
        .isEqualTo(AccessDecision.ALLOW);

    assertThat(decisionCount("deny")).isEqualTo(1.0d);
    assertThat(decisionCount("allow")).isEqualTo(1.0d);
  }

  private double decisionCount(String decision) {
    return registry
        .get("access_grant.authorization.total")
        .tag("decision", decision)
        .counter()
        .count();
  }

  private AccessDecision authorize(GrantScope scope) {
    return authorizer.authorize(ctx, GRANTEE_ID, OWNER_ID, PET_ID, scope);
  }
}
