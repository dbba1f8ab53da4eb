package com.studiobooking.orchestrator.generation;

import com.studiobooking.orchestrator.config.GenerationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class GenerationClientConfig {

  @Bean
  public RestClient generationRestClient(
      RestClient.Builder builder, GenerationProperties properties) {
    int timeoutMillis = Math.toIntExact(properties.timeout().toMillis());
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(timeoutMillis);
    requestFactory.setReadTimeout(timeoutMillis);
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader("Authorization", "Api-Key " + properties.apiKey())
        .defaultHeader("x-folder-id", properties.folderId())
        .build();
  }
}
