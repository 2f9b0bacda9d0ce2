package com.example.accessgrant.api.response;

import com.example.accessgrant.model.GrantRecord;
import java.util.List;

public record GrantsResponse(List<GrantResponse> items) {

  public static GrantsResponse from(List<GrantRecord> grants) {
    return new GrantsResponse(grants.stream().map(GrantResponse::from).toList());
  }
}
