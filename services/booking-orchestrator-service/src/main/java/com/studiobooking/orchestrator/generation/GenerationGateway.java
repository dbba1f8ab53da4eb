package com.studiobooking.orchestrator.generation;

import com.studiobooking.orchestrator.audit.AuditSink;
import com.studiobooking.orchestrator.budget.BudgetExceededException;
import com.studiobooking.orchestrator.budget.BudgetGuard;
import com.studiobooking.orchestrator.budget.BudgetVerdict;
import com.studiobooking.orchestrator.config.GenerationProperties;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Budget-checked entry point to the generation backend. */
@Service
@RequiredArgsConstructor
@Slf4j
public class GenerationGateway {

  private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

  private final GenerationClient client;
  private final BudgetGuard budget;
  private final GenerationProperties props;
  private final AuditSink audit;

  /**
   * @throws BudgetExceededException before any call goes out when a limit is reached
   * @throws GenerationException when the provider call fails; the failure is counted
   */
  public GenerationResponse generate(List<PromptMessage> messages) {
    long tokens = estimateTokens(messages);
    BigDecimal cost = estimateCost(tokens);
    BudgetVerdict verdict = budget.checkAll(tokens, cost);
    if (!verdict.allowed()) {
      audit.error("budget", verdict.reason(), Map.of("tokens", tokens, "cost", cost));
      throw new BudgetExceededException(verdict.reason());
    }

    long started = System.nanoTime();
    try {
      GenerationResponse response = client.complete(messages);
      audit.generationCall(client.modelName(), response.tokensUsed(), cost, elapsed(started), true);
      return response;
    } catch (RuntimeException e) {
      budget.recordError();
      audit.generationCall(client.modelName(), tokens, cost, elapsed(started), false);
      log.warn("Generation call failed: {}", e.getMessage());
      if (e instanceof GenerationException ge) {
        throw ge;
      }
      throw new GenerationException("Generation call failed", e);
    }
  }

  /** About four characters per token. */
  static long estimateTokens(List<PromptMessage> messages) {
    long chars = 0;
    for (PromptMessage m : messages) {
      chars += m.text() == null ? 0 : m.text().length();
    }
    return chars / 4;
  }

  BigDecimal estimateCost(long tokens) {
    return BigDecimal.valueOf(tokens)
        .multiply(props.pricePer1kTokens())
        .divide(THOUSAND, 6, RoundingMode.HALF_UP);
  }

  private static long elapsed(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000;
  }
}
