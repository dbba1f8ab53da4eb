package com.studiobooking.orchestrator.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/** Writes one JSON line per event to the {@code audit} logger. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingAuditSink implements AuditSink {

  private static final Logger AUDIT = LoggerFactory.getLogger("audit");

  private final ObjectMapper mapper;

  @Override
  public void inbound(String channel, String chatId, String text) {
    write("message_in", Map.of("channel", nz(channel), "chat_id", nz(chatId), "text", nz(text)));
  }

  @Override
  public void outbound(String channel, String chatId, String text) {
    write("message_out", Map.of("channel", nz(channel), "chat_id", nz(chatId), "text", nz(text)));
  }

  @Override
  public void bookingAttempt(String outcome, Map<String, Object> details) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("outcome", outcome);
    fields.put("details", details);
    write("booking_attempt", fields);
  }

  @Override
  public void toolCall(String tool, Map<String, Object> args, long durationMs, boolean success) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("tool", tool);
    fields.put("args", args);
    fields.put("duration_ms", durationMs);
    fields.put("success", success);
    write("tool_call", fields);
  }

  @Override
  public void generationCall(
      String model, long tokens, BigDecimal cost, long durationMs, boolean success) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("model", model);
    fields.put("tokens", tokens);
    fields.put("cost", cost);
    fields.put("duration_ms", durationMs);
    fields.put("success", success);
    write("generation_call", fields);
  }

  @Override
  public void error(String stage, String message, Map<String, Object> context) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("stage", stage);
    fields.put("message", message);
    fields.put("context", context);
    write("error", fields);
  }

  private void write(String event, Map<String, Object> fields) {
    try {
      Map<String, Object> line = new LinkedHashMap<>();
      line.put("event", event);
      line.put("trace_id", MDC.get("traceId"));
      line.putAll(fields);
      AUDIT.info(mapper.writeValueAsString(line));
    } catch (Exception e) {
      log.warn("Audit event {} dropped: {}", event, e.getMessage());
    }
  }

  private static String nz(String s) {
    return s == null ? "" : s;
  }
}
