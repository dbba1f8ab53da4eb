package com.studiobooking.orchestrator.crm;

import com.studiobooking.orchestrator.config.CrmProperties;
import java.util.Map;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

@Configuration
public class CrmClientConfig {

  @Bean
  public RestClient crmRestClient(RestClient.Builder builder, CrmProperties properties) {
    int timeoutMillis = Math.toIntExact(properties.timeout().toMillis());
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(timeoutMillis);
    requestFactory.setReadTimeout(timeoutMillis);
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeaders(
            headers -> {
              // the API key is the user name, password stays empty
              headers.setBasicAuth(properties.apiKey(), "");
              headers.setContentType(MediaType.APPLICATION_JSON);
            })
        .build();
  }

  /** Retries network and timeout failures only; HTTP answers go straight to the caller. */
  @Bean
  public RetryTemplate crmRetryTemplate(CrmProperties properties) {
    return buildRetryTemplate(properties, null);
  }

  static RetryTemplate buildRetryTemplate(CrmProperties properties, Sleeper sleeper) {
    SimpleRetryPolicy retryPolicy =
        new SimpleRetryPolicy(
            properties.maxAttempts(), Map.of(ResourceAccessException.class, true), true);
    ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
    backOff.setInitialInterval(properties.initialBackoff().toMillis());
    backOff.setMultiplier(2.0);
    backOff.setMaxInterval(properties.maxBackoff().toMillis());
    if (sleeper != null) {
      backOff.setSleeper(sleeper);
    }
    RetryTemplate template = new RetryTemplate();
    template.setRetryPolicy(retryPolicy);
    template.setBackOffPolicy(backOff);
    return template;
  }
}
