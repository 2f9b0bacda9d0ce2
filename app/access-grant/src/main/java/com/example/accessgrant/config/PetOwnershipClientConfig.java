package com.example.accessgrant.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class PetOwnershipClientConfig {

  @Bean
  RestClient petOwnershipRestClient(
      RestClient.Builder builder, PetOwnershipClientProperties properties) {
    // pet profile service 呼び出し専用 RestClient。タイムアウトは TIMEOUT 判定の前提。
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
