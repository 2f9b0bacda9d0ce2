package com.example.accessgrant.api.response;

import com.example.accessgrant.model.GrantRecord;
import com.example.accessgrant.model.GrantScope;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GrantResponse(
    String grantId,
    String petId,
    String ownerUserId,
    String granteeUserId,
    List<String> scopes,
    String status,
    Instant createdAt,
    Instant updatedAt,
    Instant revokedAt) {

  public static GrantResponse from(GrantRecord grant) {
    return new GrantResponse(
        grant.grantId(),
        grant.petId(),
        grant.ownerUserId(),
        grant.granteeUserId(),
        grant.scopes().stream().map(GrantScope::value).toList(),
        grant.status().value(),
        grant.createdAt(),
        grant.updatedAt(),
        grant.revokedAt());
  }
}
