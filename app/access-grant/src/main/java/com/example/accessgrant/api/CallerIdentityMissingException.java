package com.example.accessgrant.api;

public class CallerIdentityMissingException extends RuntimeException {

  public CallerIdentityMissingException(String headerName) {
    super(headerName + " is required");
  }
}
