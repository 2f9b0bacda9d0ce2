/*
 * どこで: Access grant 外部連携
 * 何を: pet profile サービスへ HTTP で問い合わせ、pet の owner user id を取得する
 * なぜ: pet の所有関係は別サービスが正であり、このサービスでは保持しないため
 */
package com.example.accessgrant.service;

import com.example.accessgrant.api.PetNotFoundException;
import com.example.accessgrant.config.PetOwnershipClientProperties;
import com.example.accessgrant.model.CallContext;
import com.example.accessgrant.service.dto.PetOwnerResponse;
import java.net.SocketTimeoutException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@RequiredArgsConstructor
public class PetOwnershipClient implements PetOwnershipLookup {

  private static final Logger logger = LoggerFactory.getLogger(PetOwnershipClient.class);

  private final RestClient petOwnershipRestClient;
  private final PetOwnershipClientProperties properties;

  @Override
  public String ownerOf(CallContext ctx, String petId) {
    if (petId == null || petId.isBlank()) {
      throw new IllegalArgumentException("petId is required");
    }
    ctx.ensureActive();
    final PetOwnerResponse response = callGetPet(petId);
    return response.ownerUserId();
  }

  private PetOwnerResponse callGetPet(String petId) {
    try {
      return requireValid(
          petId,
          petOwnershipRestClient
              .get()
              .uri(properties.ownerPath(), petId)
              .retrieve()
              .body(PetOwnerResponse.class));
    } catch (RestClientResponseException ex) {
      throw mapResponseException(petId, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (PetOwnershipIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new PetOwnershipIntegrationException(
          PetOwnershipIntegrationException.Reason.INVALID_RESPONSE,
          "pet ownership response parse failed",
          ex);
    }
  }

  private PetOwnerResponse requireValid(String petId, PetOwnerResponse response) {
    if (response == null || isBlank(response.ownerUserId())) {
      throw new PetOwnershipIntegrationException(
          PetOwnershipIntegrationException.Reason.INVALID_RESPONSE,
          "pet ownership response is invalid");
    }
    if (!isBlank(response.petId()) && !response.petId().equals(petId)) {
      throw new PetOwnershipIntegrationException(
          PetOwnershipIntegrationException.Reason.INVALID_RESPONSE,
          "pet ownership response is for another pet");
    }
    return response;
  }

  private RuntimeException mapResponseException(String petId, RestClientResponseException ex) {
    if (ex.getStatusCode().value() == 404) {
      return new PetNotFoundException(petId);
    }
    logger.warn(
        "pet ownership request failed petId={} status={}", petId, ex.getStatusCode().value());
    return new PetOwnershipIntegrationException(
        PetOwnershipIntegrationException.Reason.BAD_GATEWAY,
        ex.getStatusCode().is5xxServerError()
            ? "pet ownership server error"
            : "pet ownership request failed",
        ex);
  }

  private PetOwnershipIntegrationException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      return new PetOwnershipIntegrationException(
          PetOwnershipIntegrationException.Reason.TIMEOUT, "pet ownership request timeout", ex);
    }
    return new PetOwnershipIntegrationException(
        PetOwnershipIntegrationException.Reason.BAD_GATEWAY,
        "pet ownership connection failed",
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
