/*
 * どこで: Access grant 設定バインドのテスト
 * 何を: Duration 設定のバインドと未指定時の既定値を検証する
 * なぜ: 期限やタイムアウトの設定ミスが起動時に黙って 0 にならないことを保証するため
 */
package com.example.accessgrant.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class AccessGrantPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsDurationFields() {
    contextRunner
        .withPropertyValues(
            "access-grant.request-timeout=750ms",
            "pet-ownership.base-url=http://pets.internal",
            "pet-ownership.owner-path=/internal/pets/{petId}",
            "pet-ownership.connect-timeout=300ms",
            "pet-ownership.read-timeout=3s")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final AccessGrantProperties accessGrant =
                  context.getBean(AccessGrantProperties.class);
              final PetOwnershipClientProperties petOwnership =
                  context.getBean(PetOwnershipClientProperties.class);

              assertThat(accessGrant.requestTimeout()).isEqualTo(Duration.ofMillis(750));
              assertThat(petOwnership.baseUrl()).isEqualTo("http://pets.internal");
              assertThat(petOwnership.ownerPath()).isEqualTo("/internal/pets/{petId}");
              assertThat(petOwnership.connectTimeout()).isEqualTo(Duration.ofMillis(300));
              assertThat(petOwnership.readTimeout()).isEqualTo(Duration.ofSeconds(3));
            });
  }

  @Test
  void appliesDefaultsWhenUnset() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          assertThat(context.getBean(AccessGrantProperties.class).requestTimeout())
              .isEqualTo(Duration.ofSeconds(5));
          final PetOwnershipClientProperties petOwnership =
              context.getBean(PetOwnershipClientProperties.class);
          assertThat(petOwnership.ownerPath()).isEqualTo("/v1/pets/{petId}");
          assertThat(petOwnership.readTimeout()).isEqualTo(Duration.ofSeconds(2));
        });
  }

  @Configuration
  @EnableConfigurationProperties({
    AccessGrantProperties.class,
    PetOwnershipClientProperties.class
  })
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
