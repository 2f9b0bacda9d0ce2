package com.example.accessgrant.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.accessgrant.config.CallContextFactory;
import com.example.accessgrant.model.AccessDecision;
import com.example.accessgrant.model.CallContext;
import com.example.accessgrant.model.GrantScope;
import com.example.accessgrant.service.PetAccessService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AuthorizationController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class AuthorizationControllerTest {

  private static final CallContext CTX = CallContext.background();

  @Autowired private MockMvc mockMvc;

  @MockitoBean private PetAccessService petAccessService;

  @MockitoBean private CallContextFactory callContextFactory;

  @BeforeEach
  void setUp() {
    when(callContextFactory.forRequest()).thenReturn(CTX);
  }

  @Test
  void returnsDecisionForScope() throws Exception {
    when(petAccessService.authorize(CTX, "user-2", "pet-1", GrantScope.EVENTS_CREATE))
        .thenReturn(AccessDecision.DENY);

    mockMvc
        .perform(
            get("/v1/pets/pet-1/authorization")
                .param("scope", "events:create")
                .header("X-User-Id", "user-2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.pet_id").value("pet-1"))
        .andExpect(jsonPath("$.scope").value("events:create"))
        .andExpect(jsonPath("$.decision").value("deny"));
  }

  @Test
  void scopeOutsideCatalogIsPassedOnWithoutScope() throws Exception {
    when(petAccessService.authorize(CTX, "user-2", "pet-1", null))
        .thenReturn(AccessDecision.DENY);

    mockMvc
        .perform(
            get("/v1/pets/pet-1/authorization")
                .param("scope", "pet:delete")
                .header("X-User-Id", "user-2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.scope").value("pet:delete"))
        .andExpect(jsonPath("$.decision").value("deny"));
  }

  @Test
  void rejectsMissingScopeParameter() throws Exception {
    mockMvc
        .perform(get("/v1/pets/pet-1/authorization").header("X-User-Id", "user-2"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("scope is required"));
  }

  @Test
  void requiresCallerHeader() throws Exception {
    mockMvc
        .perform(get("/v1/pets/pet-1/authorization").param("scope", "pet:read"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
  }
}
