/*
 * どこで: Access grant アプリの設定バインド
 * 何を: 1 リクエストあたりの処理期限を保持する
 * なぜ: ロック待ちや DB 待ちで API が無期限に滞留しないようにするため
 */
package com.example.accessgrant.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "access-grant")
public record AccessGrantProperties(Duration requestTimeout) {

  public AccessGrantProperties {
    requestTimeout =
        requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Duration.ofSeconds(5)
            : requestTimeout;
  }
}
