/*
 * どこで: Access grant ドメインモデル
 * 何を: grant 一覧と重複 active grant の勝者決定に使う全順序を定義する
 * なぜ: Map の反復順に依存せず、全 Store 実装で同じ結果を返すため
 */
package com.example.accessgrant.model;

import java.util.Comparator;

public final class GrantOrdering {

  /** updated_at 降順、created_at 降順、grant_id 昇順。先頭が重複時の勝者になる。 */
  public static final Comparator<GrantRecord> MOST_RECENT_FIRST =
      Comparator.comparing(GrantRecord::updatedAt, Comparator.reverseOrder())
          .thenComparing(GrantRecord::createdAt, Comparator.reverseOrder())
          .thenComparing(GrantRecord::grantId);

  /** created_at 昇順、grant_id 昇順。pet 単位の一覧に使う。 */
  public static final Comparator<GrantRecord> OLDEST_FIRST =
      Comparator.comparing(GrantRecord::createdAt).thenComparing(GrantRecord::grantId);

  private GrantOrdering() {}
}
