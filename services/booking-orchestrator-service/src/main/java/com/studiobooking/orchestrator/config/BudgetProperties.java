package com.studiobooking.orchestrator.config;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limits for the paid generation backend. {@code maxCostPerDay} is in major currency units; the
 * counters keep minor units.
 */
@ConfigurationProperties(prefix = "budget")
public record BudgetProperties(
    long maxRequestsPerMinute,
    long maxTokensPerHour,
    BigDecimal maxCostPerDay,
    long maxErrorsPerHour) {

  public BudgetProperties {
    if (maxRequestsPerMinute <= 0) maxRequestsPerMinute = 30;
    if (maxTokensPerHour <= 0) maxTokensPerHour = 100_000;
    if (maxCostPerDay == null) maxCostPerDay = new BigDecimal("10.00");
    if (maxErrorsPerHour <= 0) maxErrorsPerHour = 50;
  }
}
