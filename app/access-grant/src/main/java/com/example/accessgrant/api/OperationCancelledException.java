/*
 * どこで: Access grant API
 * 何を: 取消/期限切れで処理を打ち切ったことを表す例外を定義する
 * なぜ: 部分的な書き込みをせずに 503 応答へ変換するため
 */
package com.example.accessgrant.api;

public class OperationCancelledException extends RuntimeException {

  public OperationCancelledException(String message) {
    super(message);
  }

  public OperationCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
