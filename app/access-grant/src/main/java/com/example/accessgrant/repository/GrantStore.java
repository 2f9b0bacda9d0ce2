/*
 * どこで: Access grant Repository 層
 * 何を: grant の永続化操作と (pet, grantee) 単位の排他区間を抽象化する
 * なぜ: in-memory/PostgreSQL の実装詳細を Engine から切り離すため
 */
package com.example.accessgrant.repository;

import com.example.accessgrant.model.CallContext;
import com.example.accessgrant.model.GrantRecord;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

public interface GrantStore {

  /**
   * 役割: 新しい grant を保存する。
   * 動作: 同じ grantId が既にあれば GrantAlreadyExistsException を送出する。
   * 前提: ctx が取消済みなら何も書き込まない。
   */
  void create(CallContext ctx, GrantRecord grant);

  /**
   * 役割: 既存 grant を丸ごと置き換える。
   * 動作: grantId が存在しなければ GrantNotFoundException を送出する。
   * 前提: ctx が取消済みなら何も書き込まない。
   */
  void update(CallContext ctx, GrantRecord grant);

  Optional<GrantRecord> findById(CallContext ctx, String grantId);

  /** pet に紐づく全 grant を created_at 昇順 (GrantOrdering.OLDEST_FIRST) で返す。 */
  List<GrantRecord> listByPet(CallContext ctx, String petId);

  /** grantee に紐づく全 grant を GrantOrdering.MOST_RECENT_FIRST で返す。 */
  List<GrantRecord> listByGrantee(CallContext ctx, String granteeUserId);

  /**
   * 役割: (pet, grantee) の active grant を 1 件返す。
   * 動作: 複数 active が存在する場合は GrantOrdering.MOST_RECENT_FIRST の先頭を返す。
   */
  Optional<GrantRecord> findActiveGrant(CallContext ctx, String petId, String granteeUserId);

  /**
   * 役割: (pet, grantee) に対する read-modify-write を排他的に実行する。
   * 動作: 同じ組に対する他の withPairLock 区間と重ならないことを保証する。
   * 前提: action 内の Store 呼び出しには同じ ctx を渡すこと。
   */
  <T> T withPairLock(CallContext ctx, String petId, String granteeUserId, Supplier<T> action);
}
