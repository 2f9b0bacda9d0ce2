/*
 * どこで: Access grant のログ設定テスト
 * 何を: JSON ログ設定と MDC フィールド定義の存在を検証する
 * なぜ: 設定変更で構造化ログや pet/grant の識別子が欠落する回帰を防ぐため
 */
package com.example.accessgrant;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackConfigurationContainsJsonEncoderAndMdcKeys() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String configText =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(configText).contains("LoggingEventCompositeJsonEncoder");
    assertThat(configText)
        .contains(
            "<includeMdcKeyName>request_id</includeMdcKeyName>",
            "<includeMdcKeyName>user_id</includeMdcKeyName>",
            "<includeMdcKeyName>pet_id</includeMdcKeyName>",
            "<includeMdcKeyName>grant_id</includeMdcKeyName>");
  }
}
