/*
 * どこで: Access grant サービス層
 * 何を: ライフサイクル操作・修復処理・認可判定のメトリクス記録を集約する
 * なぜ: 重複 grant の発生頻度や判定結果の傾向を運用で継続監視できるようにするため
 */
package com.example.accessgrant.service;

import com.example.accessgrant.model.AccessDecision;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AccessGrantMetrics {

  static final String METRIC_COMMAND_TOTAL = "access_grant.command.total";
  static final String METRIC_REPAIR_TOTAL = "access_grant.repair.total";
  static final String METRIC_AUTHORIZATION_TOTAL = "access_grant.authorization.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public AccessGrantMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordCommand(String action, String result) {
    counter(METRIC_COMMAND_TOTAL, "Access grant command executions", "action", action, "result",
            result)
        .increment();
  }

  public void recordRepair(String action, String outcome) {
    counter(METRIC_REPAIR_TOTAL, "Duplicate grant repair attempts", "action", action, "outcome",
            outcome)
        .increment();
  }

  public void recordDecision(AccessDecision decision) {
    final Counter counter =
        counters.computeIfAbsent(
            METRIC_AUTHORIZATION_TOTAL + ":" + decision.value(),
            ignored ->
                Counter.builder(METRIC_AUTHORIZATION_TOTAL)
                    .description("Pet access authorization decisions")
                    .tags(Tags.of("decision", decision.value()))
                    .register(meterRegistry));
    counter.increment();
  }

  private Counter counter(
      String name,
      String description,
      String firstTag,
      String firstValue,
      String secondTag,
      String secondValue) {
    final String key = name + ":" + firstValue + ":" + secondValue;
    return counters.computeIfAbsent(
        key,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(firstTag, firstValue, secondTag, secondValue))
                .register(meterRegistry));
  }
}
