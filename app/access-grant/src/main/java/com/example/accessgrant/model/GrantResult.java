/*
 * どこで: Access grant ドメインモデル
 * 何を: 主たる状態遷移の結果と、付随する修復処理の失敗一覧をまとめる
 * なぜ: 修復失敗を握りつぶさず、呼び出し側が観測できるようにするため
 */
package com.example.accessgrant.model;

import java.util.List;

public record GrantResult(GrantRecord grant, List<RepairFailure> repairFailures) {

  public GrantResult {
    repairFailures = repairFailures == null ? List.of() : List.copyOf(repairFailures);
  }

  public static GrantResult of(GrantRecord grant) {
    return new GrantResult(grant, List.of());
  }

  public boolean hasRepairFailures() {
    return !repairFailures.isEmpty();
  }
}
