package com.example.accessgrant.service;

import com.example.accessgrant.model.CallContext;

/** pet の owner user id を解決する外部依存。見つからない場合は PetNotFoundException。 */
public interface PetOwnershipLookup {

  String ownerOf(CallContext ctx, String petId);
}
