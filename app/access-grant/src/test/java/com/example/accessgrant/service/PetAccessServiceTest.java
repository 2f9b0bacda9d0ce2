package com.example.accessgrant.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.accessgrant.api.GrantForbiddenException;
import com.example.accessgrant.api.PetNotFoundException;
import com.example.accessgrant.model.AccessDecision;
import com.example.accessgrant.model.CallContext;
import com.example.accessgrant.model.GrantScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PetAccessServiceTest {

  private final CallContext ctx = CallContext.background();

  @Mock private PetOwnershipLookup lookup;

  @Mock private AccessAuthorizer authorizer;

  private PetAccessService service;

  @BeforeEach
  void setUp() {
    service = new PetAccessService(lookup, authorizer);
  }

  @Test
  void requireOwnerReturnsResolvedOwner() {
    when(lookup.ownerOf(ctx, "pet-1")).thenReturn("owner-1");

    assertThat(service.requireOwner(ctx, "owner-1", "pet-1")).isEqualTo("owner-1");
  }

  @Test
  void requireOwnerRejectsOtherCaller() {
    when(lookup.ownerOf(ctx, "pet-1")).thenReturn("owner-1");

    assertThatThrownBy(() -> service.requireOwner(ctx, "user-2", "pet-1"))
        .isInstanceOf(GrantForbiddenException.class);
  }

  @Test
  void unknownPetPropagatesNotFound() {
    when(lookup.ownerOf(ctx, "pet-404")).thenThrow(new PetNotFoundException("pet-404"));

    assertThatThrownBy(() -> service.authorize(ctx, "user-2", "pet-404", GrantScope.PET_READ))
        .isInstanceOf(PetNotFoundException.class);
    verifyNoInteractions(authorizer);
  }

  @Test
  void requireScopeUsesResolvedOwner() {
    when(lookup.ownerOf(ctx, "pet-1")).thenReturn("owner-1");
    when(authorizer.authorize(ctx, "user-2", "owner-1", "pet-1", GrantScope.EVENTS_READ))
        .thenReturn(AccessDecision.ALLOW);
    when(authorizer.authorize(ctx, "user-2", "owner-1", "pet-1", GrantScope.EVENTS_VOID))
        .thenReturn(AccessDecision.DENY);

    assertThatCode(() -> service.requireScope(ctx, "user-2", "pet-1", GrantScope.EVENTS_READ))
        .doesNotThrowAnyException();
    assertThatThrownBy(
            () -> service.requireScope(ctx, "user-2", "pet-1", GrantScope.EVENTS_VOID))
        .isInstanceOf(GrantForbiddenException.class)
        .hasMessage(PetAccessService.FORBIDDEN_MESSAGE);
  }
}
