package com.studiobooking.orchestrator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crm")
public record CrmProperties(
    String baseUrl,
    String apiKey,
    Duration timeout,
    int failureThreshold,
    Duration resetTimeout,
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    Duration scheduleCacheTtl,
    Duration groupsCacheTtl,
    Duration teachersCacheTtl) {

  public CrmProperties {
    if (apiKey == null) apiKey = "";
    if (timeout == null) timeout = Duration.ofSeconds(30);
    if (failureThreshold <= 0) failureThreshold = 5;
    if (resetTimeout == null) resetTimeout = Duration.ofSeconds(60);
    if (maxAttempts <= 0) maxAttempts = 3;
    if (initialBackoff == null) initialBackoff = Duration.ofSeconds(1);
    if (maxBackoff == null) maxBackoff = Duration.ofSeconds(10);
    if (scheduleCacheTtl == null) scheduleCacheTtl = Duration.ofMinutes(15);
    if (groupsCacheTtl == null) groupsCacheTtl = Duration.ofHours(1);
    if (teachersCacheTtl == null) teachersCacheTtl = Duration.ofHours(1);
  }
}
