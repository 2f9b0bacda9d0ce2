package com.example.accessgrant.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pet-ownership")
public record PetOwnershipClientProperties(
    String baseUrl, String ownerPath, Duration connectTimeout, Duration readTimeout) {

  public PetOwnershipClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://pet-profile:80" : baseUrl;
    ownerPath = ownerPath == null || ownerPath.isBlank() ? "/v1/pets/{petId}" : ownerPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(1) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(2) : readTimeout;
  }
}
