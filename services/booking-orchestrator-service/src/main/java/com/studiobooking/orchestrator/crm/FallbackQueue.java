package com.studiobooking.orchestrator.crm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studiobooking.orchestrator.channel.AdminNotifier;
import com.studiobooking.orchestrator.store.KeyValueStore;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/** FIFO of failed mutating CRM requests: pushed on the left, consumed from the right. */
@Service
@RequiredArgsConstructor
@Slf4j
public class FallbackQueue {

  public static final String QUEUE_KEY = "crm:fallback:queue";

  private final KeyValueStore store;
  private final ObjectMapper mapper;
  private final AdminNotifier adminNotifier;
  private final Clock clock;

  /** Appends the request and alerts the operator. The trace id is read from the MDC. */
  public FallbackItem enqueue(String action, Map<String, Object> data, String error) {
    String traceId = MDC.get("traceId");
    FallbackItem item =
        new FallbackItem(
            UUID.randomUUID().toString(),
            traceId == null ? UUID.randomUUID().toString() : traceId,
            action,
            data,
            error,
            clock.instant().toString());
    try {
      store.leftPush(QUEUE_KEY, mapper.writeValueAsString(item));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize fallback item " + action, e);
    }
    log.warn("CRM request queued for reconciliation: action={} trace={}", action, item.traceId());
    alert(item);
    return item;
  }

  /** @return the oldest item, or empty when the queue is empty or the head is unreadable */
  public Optional<FallbackItem> dequeue() {
    Optional<String> raw = store.rightPop(QUEUE_KEY);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(mapper.readValue(raw.get(), FallbackItem.class));
    } catch (JsonProcessingException e) {
      log.warn("Dropping unreadable fallback item: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }

  public long size() {
    try {
      return store.listSize(QUEUE_KEY);
    } catch (RuntimeException e) {
      log.warn("Cannot read fallback queue size: {}", e.getMessage());
      return 0;
    }
  }

  private void alert(FallbackItem item) {
    String data;
    try {
      data = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(item.data());
    } catch (JsonProcessingException e) {
      data = String.valueOf(item.data());
    }
    String text =
        "⚠️ CRM Fallback Queue\n\n"
            + "Action: "
            + item.action()
            + "\nError: "
            + item.error()
            + "\nTrace ID: "
            + item.traceId()
            + "\nCreated: "
            + item.createdAt()
            + "\n\nData: "
            + data;
    try {
      adminNotifier.notifyAdmin(text);
    } catch (RuntimeException e) {
      log.warn("Fallback alert not delivered: {}", e.getMessage());
    }
  }
}
