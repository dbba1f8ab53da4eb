package com.studiobooking.orchestrator.config;

import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "generation")
public record GenerationProperties(
    String baseUrl,
    String apiKey,
    String folderId,
    String model,
    Duration timeout,
    double temperature,
    int maxTokens,
    BigDecimal pricePer1kTokens) {

  public GenerationProperties {
    if (baseUrl == null || baseUrl.isBlank()) {
      baseUrl = "https://llm.api.cloud.yandex.net/foundationModels/v1";
    }
    if (apiKey == null) apiKey = "";
    if (folderId == null) folderId = "";
    if (model == null || model.isBlank()) model = "yandexgpt/latest";
    if (timeout == null) timeout = Duration.ofSeconds(30);
    if (maxTokens <= 0) maxTokens = 2000;
    if (pricePer1kTokens == null) pricePer1kTokens = new BigDecimal("0.0046");
  }
}
