package com.studiobooking.orchestrator.crm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studiobooking.orchestrator.audit.AuditSink;
import com.studiobooking.orchestrator.crm.CrmErrorClassifier.Classification;
import com.studiobooking.orchestrator.crm.model.Client;
import com.studiobooking.orchestrator.crm.model.Group;
import com.studiobooking.orchestrator.crm.model.Reservation;
import com.studiobooking.orchestrator.crm.model.ScheduleEntry;
import com.studiobooking.orchestrator.crm.model.Teacher;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Everything the dialogue needs from the CRM. Never throws: each call returns either the value or a
 * {@link CrmFailure} with a message ready for the client. Failed mutating calls are queued for
 * reconciliation when the classification asks for it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrmAdapter {

  private static final int LIST_LIMIT = 1000;

  private final CrmHttpClient client;
  private final CrmCache cache;
  private final CrmErrorClassifier classifier;
  private final FallbackQueue fallback;
  private final ObjectMapper mapper;
  private final AuditSink audit;

  public CrmResult<List<ScheduleEntry>> getSchedule(
      LocalDate dateFrom, LocalDate dateTo, Long groupId) {
    Map<String, Object> args = args("date_from", dateFrom, "date_to", dateTo, "group_id", groupId);
    String paramsKey = dateFrom + "_" + dateTo + "_" + groupId;
    return run(
        "get_schedule",
        args,
        false,
        () -> {
          Optional<List<ScheduleEntry>> cached =
              cache.get(CrmEntity.SCHEDULE, paramsKey, ScheduleEntry.class);
          if (cached.isPresent()) {
            return cached.get();
          }
          Map<String, Object> filters = new LinkedHashMap<>();
          if (dateFrom != null) {
            filters.put("date", dateFrom.toString());
          }
          if (groupId != null) {
            filters.put("group_id", groupId);
          }
          List<ScheduleEntry> entries =
              client.list(CrmEntity.SCHEDULE, ScheduleEntry.FIELDS, filters, LIST_LIMIT).stream()
                  .map(n -> convert(n, ScheduleEntry.class))
                  .filter(e -> notAfter(e, dateTo))
                  .collect(Collectors.toList());
          cache.put(CrmEntity.SCHEDULE, paramsKey, entries);
          return entries;
        });
  }

  public CrmResult<List<Group>> getGroups() {
    return run(
        "get_groups",
        Map.of(),
        false,
        () -> cachedList(CrmEntity.GROUP, Group.FIELDS, Group.class));
  }

  public CrmResult<List<Teacher>> getTeachers() {
    return run(
        "get_teachers",
        Map.of(),
        false,
        () -> cachedList(CrmEntity.TEACHER, Teacher.FIELDS, Teacher.class));
  }

  public CrmResult<Optional<Client>> findClient(String phone) {
    return run(
        "find_client",
        args("phone", phone),
        false,
        () ->
            client.list(CrmEntity.CLIENT, Client.FIELDS, Map.of("phone", phone), 1).stream()
                .findFirst()
                .map(n -> convert(n, Client.class)));
  }

  public CrmResult<Client> createClient(String name, String phone) {
    Map<String, Object> data = args("name", name, "phone", phone);
    return run(
        "create_client",
        data,
        true,
        () -> convert(unwrap(client.create(CrmEntity.CLIENT, data)), Client.class));
  }

  public CrmResult<Reservation> createBooking(long clientId, long scheduleId) {
    Map<String, Object> data = args("client_id", clientId, "schedule_id", scheduleId);
    return run(
        "create_booking",
        data,
        true,
        () -> {
          JsonNode created = client.create(CrmEntity.RESERVATION, data);
          invalidateSchedule();
          return convert(unwrap(created), Reservation.class);
        });
  }

  public CrmResult<List<Reservation>> listBookings(Long clientId, LocalDate dateFrom) {
    Map<String, Object> filters = new LinkedHashMap<>();
    if (clientId != null) {
      filters.put("client_id", clientId);
    }
    if (dateFrom != null) {
      filters.put("date", dateFrom.toString());
    }
    return run(
        "list_bookings",
        args("client_id", clientId, "date_from", dateFrom),
        false,
        () ->
            client.list(CrmEntity.RESERVATION, Reservation.FIELDS, filters, LIST_LIMIT).stream()
                .map(n -> convert(n, Reservation.class))
                .collect(Collectors.toList()));
  }

  public CrmResult<Boolean> cancelBooking(long reservationId) {
    return run(
        "cancel_booking",
        args("reservation_id", reservationId),
        true,
        () -> {
          boolean deleted = client.delete(CrmEntity.RESERVATION, reservationId);
          invalidateSchedule();
          return deleted;
        });
  }

  /** Cheapest list call; any failure means unhealthy. */
  public boolean healthCheck() {
    try {
      client.list(CrmEntity.GROUP, new String[] {"id"}, null, 1);
      return true;
    } catch (RuntimeException e) {
      log.warn("CRM health check failed: {}", e.getMessage());
      return false;
    }
  }

  private <T> List<T> cachedList(CrmEntity entity, String[] fields, Class<T> type) {
    Optional<List<T>> cached = cache.get(entity, "all", type);
    if (cached.isPresent()) {
      return cached.get();
    }
    List<T> items =
        client.list(entity, fields, null, LIST_LIMIT).stream()
            .map(n -> convert(n, type))
            .collect(Collectors.toList());
    cache.put(entity, "all", items);
    return items;
  }

  private void invalidateSchedule() {
    try {
      cache.invalidate(CrmEntity.SCHEDULE);
    } catch (RuntimeException e) {
      // the write went through; reporting failure here would invite a duplicate
      log.error("Schedule cache invalidation failed: {}", e.getMessage());
    }
  }

  private <T> CrmResult<T> run(
      String action, Map<String, Object> args, boolean mutating, Supplier<T> call) {
    long started = System.nanoTime();
    try {
      T value = call.get();
      audit.toolCall(action, args, elapsedMs(started), true);
      return CrmResult.ok(value);
    } catch (RuntimeException e) {
      audit.toolCall(action, args, elapsedMs(started), false);
      Classification c = classifier.classify(e);
      log.warn("CRM {} failed as {}: {}", action, c.kind(), e.getMessage());
      boolean queued = mutating && c.shouldFallback() && enqueue(action, args, e);
      return CrmResult.failed(new CrmFailure(c.kind(), c.userMessage(), queued));
    }
  }

  private boolean enqueue(String action, Map<String, Object> args, RuntimeException cause) {
    try {
      fallback.enqueue(action, args, String.valueOf(cause.getMessage()));
      return true;
    } catch (RuntimeException e) {
      log.error("Could not queue failed CRM {} for reconciliation", action, e);
      return false;
    }
  }

  private <T> T convert(JsonNode node, Class<T> type) {
    return mapper.convertValue(node, type);
  }

  /** Some CRM answers wrap the record in {@code data}. */
  private static JsonNode unwrap(JsonNode node) {
    if (node != null && node.has("data") && node.get("data").isObject()) {
      return node.get("data");
    }
    return node;
  }

  private static Map<String, Object> args(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i + 1 < kv.length; i += 2) {
      Object v = kv[i + 1];
      m.put((String) kv[i], v instanceof LocalDate ? v.toString() : v);
    }
    return m;
  }

  private static boolean notAfter(ScheduleEntry e, LocalDate dateTo) {
    // ISO dates compare correctly as strings
    return dateTo == null || e.date() == null || e.date().compareTo(dateTo.toString()) <= 0;
  }

  private static long elapsedMs(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000;
  }
}
