package com.example.accessgrant.api;

public class GrantForbiddenException extends RuntimeException {

  public GrantForbiddenException(String message) {
    super(message);
  }
}
