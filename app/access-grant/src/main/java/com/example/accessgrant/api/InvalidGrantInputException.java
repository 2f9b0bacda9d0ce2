/*
 * どこで: Access grant API
 * 何を: 呼び出し元の入力不備 (InvalidInput) を表す例外を定義する
 * なぜ: 400 応答へ変換し、権限不足 (403) と区別するため
 */
package com.example.accessgrant.api;

public class InvalidGrantInputException extends RuntimeException {

  public InvalidGrantInputException(String message) {
    super(message);
  }
}
