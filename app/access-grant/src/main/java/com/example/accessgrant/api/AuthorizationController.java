package com.example.accessgrant.api;

import com.example.accessgrant.api.response.AuthorizationResponse;
import com.example.accessgrant.config.CallContextFactory;
import com.example.accessgrant.model.AccessDecision;
import com.example.accessgrant.model.GrantScope;
import com.example.accessgrant.service.PetAccessService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** 他サービスのリソースハンドラが「この呼び出し元はこの操作をしてよいか」を問い合わせる。 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class AuthorizationController {

  private final PetAccessService petAccessService;
  private final CallContextFactory callContextFactory;

  @GetMapping("/pets/{pet_id}/authorization")
  public AuthorizationResponse authorize(
      @RequestHeader(value = CallerHeaders.HEADER_USER_ID, required = false) String userId,
      @PathVariable("pet_id") String petId,
      @RequestParam("scope") String scope) {
    final String callerUserId = CallerHeaders.requireCaller(userId);
    final String requestedScope = scope.trim();
    // カタログ外の scope は 400 にせず判定に回す。owner 以外には他の拒否と同じ deny になる。
    final GrantScope requiredScope = GrantScope.find(requestedScope).orElse(null);
    final AccessDecision decision =
        petAccessService.authorize(
            callContextFactory.forRequest(), callerUserId, petId, requiredScope);
    return new AuthorizationResponse(petId, requestedScope, decision.value());
  }
}
