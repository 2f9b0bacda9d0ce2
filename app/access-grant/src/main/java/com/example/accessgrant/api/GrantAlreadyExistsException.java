package com.example.accessgrant.api;

public class GrantAlreadyExistsException extends RuntimeException {

  public GrantAlreadyExistsException(String grantId) {
    super("grant already exists: " + grantId);
  }
}
