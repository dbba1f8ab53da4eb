package com.studiobooking.orchestrator.audit;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Fire-and-forget audit events. The current trace id is taken from the MDC. Implementations must
 * not throw.
 */
public interface AuditSink {

  void inbound(String channel, String chatId, String text);

  void outbound(String channel, String chatId, String text);

  void bookingAttempt(String outcome, Map<String, Object> details);

  void toolCall(String tool, Map<String, Object> args, long durationMs, boolean success);

  void generationCall(String model, long tokens, BigDecimal cost, long durationMs, boolean success);

  void error(String stage, String message, Map<String, Object> context);
}
