/*
 * どこで: Access grant API
 * 何を: 現在の状態では許されない遷移 (BadState) を表す例外を定義する
 * なぜ: revoked の grant を accept するような要求を 409 で返すため
 */
package com.example.accessgrant.api;

public class InvalidGrantTransitionException extends RuntimeException {

  public InvalidGrantTransitionException(String message) {
    super(message);
  }
}
