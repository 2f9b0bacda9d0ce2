/*
 * どこで: Access grant データアクセス
 * 何を: access_grants テーブルの登録/更新/参照と pair 単位の advisory lock を担う
 * なぜ: 複数インスタンス構成でも (pet, grantee) ごとの遷移を直列化するため
 */
package com.example.accessgrant.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.accessgrant.api.GrantAlreadyExistsException;
import com.example.accessgrant.api.GrantNotFoundException;
import com.example.accessgrant.model.CallContext;
import com.example.accessgrant.model.GrantRecord;
import com.example.accessgrant.model.GrantScope;
import com.example.accessgrant.model.GrantStatus;
import com.example.common.AdvisoryLockKeys;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Repository
@ConditionalOnProperty(
    name = "access-grant.store.type",
    havingValue = "jdbc",
    matchIfMissing = true)
public class JdbcGrantStore implements GrantStore {

  static final String LOCK_NAMESPACE = "access_grant_pair";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final TransactionTemplate pairTransaction;
  private final TransactionTemplate writeTransaction;

  public JdbcGrantStore(
      NamedParameterJdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
    this.jdbcTemplate = jdbcTemplate;
    this.pairTransaction = new TransactionTemplate(transactionManager);
    // 書き込みは savepoint 付きで実行し、修復処理の失敗が外側の遷移を巻き込まないようにする。
    this.writeTransaction = new TransactionTemplate(transactionManager);
    this.writeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
  }

  @Override
  public void create(CallContext ctx, GrantRecord grant) {
    ctx.ensureActive();
    final String sql =
        """
        INSERT INTO access_grants (
          grant_id,
          pet_id,
          owner_user_id,
          grantee_user_id,
          scopes,
          status,
          created_at,
          updated_at,
          revoked_at
        ) VALUES (
          :grantId,
          :petId,
          :ownerUserId,
          :granteeUserId,
          string_to_array(:scopes, ','),
          :status,
          :createdAt,
          :updatedAt,
          :revokedAt
        )
        """;
    try {
      writeTransaction.executeWithoutResult(status -> jdbcTemplate.update(sql, toParams(grant)));
    } catch (DuplicateKeyException ex) {
      throw new GrantAlreadyExistsException(grant.grantId());
    }
  }

  @Override
  public void update(CallContext ctx, GrantRecord grant) {
    ctx.ensureActive();
    final String sql =
        """
        UPDATE access_grants
        SET scopes = string_to_array(:scopes, ','),
            status = :status,
            updated_at = :updatedAt,
            revoked_at = :revokedAt
        WHERE grant_id = :grantId
        """;
    final Integer updated =
        writeTransaction.execute(status -> jdbcTemplate.update(sql, toParams(grant)));
    if (updated == null || updated == 0) {
      throw new GrantNotFoundException(grant.grantId());
    }
  }

  @Override
  public Optional<GrantRecord> findById(CallContext ctx, String grantId) {
    ctx.ensureActive();
    final String sql =
        """
        SELECT grant_id, pet_id, owner_user_id, grantee_user_id, scopes, status,
               created_at, updated_at, revoked_at
        FROM access_grants
        WHERE grant_id = :grantId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("grantId", grantId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<GrantRecord> listByPet(CallContext ctx, String petId) {
    ctx.ensureActive();
    final String sql =
        """
        SELECT grant_id, pet_id, owner_user_id, grantee_user_id, scopes, status,
               created_at, updated_at, revoked_at
        FROM access_grants
        WHERE pet_id = :petId
        ORDER BY created_at ASC, grant_id COLLATE "C" ASC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("petId", petId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public List<GrantRecord> listByGrantee(CallContext ctx, String granteeUserId) {
    ctx.ensureActive();
    final String sql =
        """
        SELECT grant_id, pet_id, owner_user_id, grantee_user_id, scopes, status,
               created_at, updated_at, revoked_at
        FROM access_grants
        WHERE grantee_user_id = :granteeUserId
        ORDER BY updated_at DESC, created_at DESC, grant_id COLLATE "C" ASC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("granteeUserId", granteeUserId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public Optional<GrantRecord> findActiveGrant(
      CallContext ctx, String petId, String granteeUserId) {
    ctx.ensureActive();
    // 重複 active がある場合も GrantOrdering.MOST_RECENT_FIRST と同じ順で先頭を選ぶ。
    final String sql =
        """
        SELECT grant_id, pet_id, owner_user_id, grantee_user_id, scopes, status,
               created_at, updated_at, revoked_at
        FROM access_grants
        WHERE pet_id = :petId
          AND grantee_user_id = :granteeUserId
          AND status = 'ACTIVE'
        ORDER BY updated_at DESC, created_at DESC, grant_id COLLATE "C" ASC
        LIMIT 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("petId", petId)
            .addValue("granteeUserId", granteeUserId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public <T> T withPairLock(
      CallContext ctx, String petId, String granteeUserId, Supplier<T> action) {
    ctx.ensureActive();
    return pairTransaction.execute(
        status -> {
          lockPair(petId, granteeUserId);
          return action.get();
        });
  }

  private void lockPair(String petId, String granteeUserId) {
    // トランザクション終了時に自動解放される advisory lock で pair を直列化する。
    final long lockKey = AdvisoryLockKeys.forParts(LOCK_NAMESPACE, petId, granteeUserId);
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  private MapSqlParameterSource toParams(GrantRecord grant) {
    return new MapSqlParameterSource()
        .addValue("grantId", grant.grantId())
        .addValue("petId", grant.petId())
        .addValue("ownerUserId", grant.ownerUserId())
        .addValue("granteeUserId", grant.granteeUserId())
        .addValue("scopes", toScopeText(grant.scopes()))
        .addValue("status", grant.status().name())
        .addValue("createdAt", toTimestamp(grant.createdAt()))
        .addValue("updatedAt", toTimestamp(grant.updatedAt()))
        .addValue("revokedAt", toTimestamp(grant.revokedAt()));
  }

  private String toScopeText(Set<GrantScope> scopes) {
    // scope 値はカンマを含まないため string_to_array でそのまま text[] に戻せる。
    return scopes.stream().map(GrantScope::value).collect(Collectors.joining(","));
  }

  private GrantRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new GrantRecord(
        rs.getString("grant_id"),
        rs.getString("pet_id"),
        rs.getString("owner_user_id"),
        rs.getString("grantee_user_id"),
        readScopes(rs.getArray("scopes")),
        GrantStatus.valueOf(rs.getString("status")),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant(),
        toInstant(rs.getTimestamp("revoked_at")));
  }

  private Set<GrantScope> readScopes(Array array) throws SQLException {
    final Set<GrantScope> scopes = EnumSet.noneOf(GrantScope.class);
    if (array == null) {
      return scopes;
    }
    try {
      final String[] values = (String[]) array.getArray();
      Arrays.stream(values).map(GrantScope::fromValue).forEach(scopes::add);
      return scopes;
    } finally {
      array.free();
    }
  }
}
