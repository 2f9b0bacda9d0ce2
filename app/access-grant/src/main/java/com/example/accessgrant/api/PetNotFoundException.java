package com.example.accessgrant.api;

public class PetNotFoundException extends RuntimeException {

  public PetNotFoundException(String petId) {
    super("pet not found: " + petId);
  }
}
