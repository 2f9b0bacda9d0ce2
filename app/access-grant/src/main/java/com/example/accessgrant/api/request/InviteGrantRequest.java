package com.example.accessgrant.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

/** scopes が空または未指定なら既定の scope で招待する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InviteGrantRequest(
    @NotBlank(message = "grantee_user_id is required") String granteeUserId,
    List<String> scopes) {}
