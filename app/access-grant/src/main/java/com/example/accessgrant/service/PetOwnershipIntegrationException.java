package com.example.accessgrant.service;

public class PetOwnershipIntegrationException extends RuntimeException {

  public enum Reason {
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public PetOwnershipIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public PetOwnershipIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
