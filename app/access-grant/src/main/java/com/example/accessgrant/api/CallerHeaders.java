package com.example.accessgrant.api;

/** 認証はゲートウェイ側で済んでおり、呼び出し元は X-User-Id で渡される。 */
final class CallerHeaders {

  static final String HEADER_USER_ID = "X-User-Id";

  private CallerHeaders() {}

  static String requireCaller(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      throw new CallerIdentityMissingException(HEADER_USER_ID);
    }
    return headerValue.trim();
  }
}
