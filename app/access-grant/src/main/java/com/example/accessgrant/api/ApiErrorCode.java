/*
 * どこで: Access grant API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.accessgrant.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNAUTHORIZED,
  FORBIDDEN,
  GRANT_NOT_FOUND,
  PET_NOT_FOUND,
  GRANT_STATE_CONFLICT,
  PET_OWNERSHIP_UNAVAILABLE,
  REQUEST_CANCELLED
}
