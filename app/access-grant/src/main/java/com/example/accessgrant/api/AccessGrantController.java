/*
 * どこで: Access grant API
 * 何を: 招待/受諾/失効/一覧のエンドポイントを提供する
 * なぜ: owner と grantee がそれぞれの操作を HTTP 経由で行えるようにするため
 */
package com.example.accessgrant.api;

import com.example.accessgrant.api.request.InviteGrantRequest;
import com.example.accessgrant.api.response.GrantResponse;
import com.example.accessgrant.api.response.GrantsResponse;
import com.example.accessgrant.config.CallContextFactory;
import com.example.accessgrant.model.CallContext;
import com.example.accessgrant.model.GrantResult;
import com.example.accessgrant.model.GrantStatus;
import com.example.accessgrant.service.AccessGrantService;
import com.example.accessgrant.service.PetAccessService;
import jakarta.validation.Valid;
import java.util.EnumSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class AccessGrantController {

  private final AccessGrantService accessGrantService;
  private final PetAccessService petAccessService;
  private final CallContextFactory callContextFactory;

  @PostMapping("/pets/{pet_id}/grants")
  public ResponseEntity<GrantResponse> invite(
      @RequestHeader(value = CallerHeaders.HEADER_USER_ID, required = false) String userId,
      @PathVariable("pet_id") String petId,
      @Valid @RequestBody InviteGrantRequest request) {
    final String callerUserId = CallerHeaders.requireCaller(userId);
    final CallContext ctx = callContextFactory.forRequest();
    final String ownerUserId = petAccessService.requireOwner(ctx, callerUserId, petId);
    final GrantResult result =
        accessGrantService.invite(
            ctx, petId, ownerUserId, request.granteeUserId().trim(), request.scopes());
    return ResponseEntity.status(HttpStatus.CREATED).body(GrantResponse.from(result.grant()));
  }

  @GetMapping("/pets/{pet_id}/grants")
  public GrantsResponse listByPet(
      @RequestHeader(value = CallerHeaders.HEADER_USER_ID, required = false) String userId,
      @PathVariable("pet_id") String petId) {
    final String callerUserId = CallerHeaders.requireCaller(userId);
    final CallContext ctx = callContextFactory.forRequest();
    petAccessService.requireOwner(ctx, callerUserId, petId);
    return GrantsResponse.from(accessGrantService.listByPet(ctx, petId));
  }

  @PostMapping("/grants/{grant_id}/accept")
  public GrantResponse accept(
      @RequestHeader(value = CallerHeaders.HEADER_USER_ID, required = false) String userId,
      @PathVariable("grant_id") String grantId) {
    final String callerUserId = CallerHeaders.requireCaller(userId);
    final GrantResult result =
        accessGrantService.accept(callContextFactory.forRequest(), grantId, callerUserId);
    return GrantResponse.from(result.grant());
  }

  @PostMapping("/grants/{grant_id}/revoke")
  public GrantResponse revoke(
      @RequestHeader(value = CallerHeaders.HEADER_USER_ID, required = false) String userId,
      @PathVariable("grant_id") String grantId) {
    final String callerUserId = CallerHeaders.requireCaller(userId);
    return GrantResponse.from(
        accessGrantService.revoke(callContextFactory.forRequest(), grantId, callerUserId));
  }

  @GetMapping("/me/grants")
  public GrantsResponse listMine(
      @RequestHeader(value = CallerHeaders.HEADER_USER_ID, required = false) String userId,
      @RequestParam(value = "status", required = false) String status) {
    final String callerUserId = CallerHeaders.requireCaller(userId);
    return GrantsResponse.from(
        accessGrantService.listByGrantee(
            callContextFactory.forRequest(), callerUserId, parseStatuses(status)));
  }

  // "invited,active" のようなカンマ区切り。未指定なら全状態。
  private Set<GrantStatus> parseStatuses(String status) {
    final Set<GrantStatus> statuses = EnumSet.noneOf(GrantStatus.class);
    if (status == null || status.isBlank()) {
      return statuses;
    }
    for (String value : status.split(",")) {
      if (!value.isBlank()) {
        statuses.add(GrantStatus.fromValue(value.trim()));
      }
    }
    return statuses;
  }
}
