package com.studiobooking.orchestrator.crm;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studiobooking.orchestrator.config.CrmProperties;
import com.studiobooking.orchestrator.store.KeyValueStore;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Read-through cache for CRM lists, kept in the shared store so every instance sees the same
 * invalidations. A broken cache degrades to a miss.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CrmCache {

  private final KeyValueStore store;
  private final ObjectMapper mapper;
  private final CrmProperties props;

  public <T> Optional<List<T>> get(CrmEntity entity, String paramsKey, Class<T> type) {
    String key = key(entity, paramsKey);
    try {
      Optional<String> raw = store.get(key);
      if (raw.isEmpty()) {
        return Optional.empty();
      }
      JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, type);
      List<T> items = mapper.readValue(raw.get(), listType);
      log.debug("CRM cache hit {}", key);
      return Optional.of(items);
    } catch (Exception e) {
      log.warn("CRM cache read failed for {}: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  public <T> void put(CrmEntity entity, String paramsKey, List<T> items) {
    String key = key(entity, paramsKey);
    try {
      store.set(key, mapper.writeValueAsString(items), ttl(entity));
    } catch (Exception e) {
      log.warn("CRM cache write failed for {}: {}", key, e.getMessage());
    }
  }

  /** Drops every cached entry of the entity. Runs before a mutating call reports success. */
  public long invalidate(CrmEntity entity) {
    long n = store.deleteByPattern("crm:cache:" + entity.cacheName() + ":*");
    log.info("CRM cache invalidated for {} ({} keys)", entity.cacheName(), n);
    return n;
  }

  Duration ttl(CrmEntity entity) {
    switch (entity) {
      case SCHEDULE:
        return props.scheduleCacheTtl();
      case GROUP:
        return props.groupsCacheTtl();
      case TEACHER:
        return props.teachersCacheTtl();
      default:
        return Duration.ofHours(1);
    }
  }

  static String key(CrmEntity entity, String paramsKey) {
    return "crm:cache:" + entity.cacheName() + ":" + paramsKey;
  }
}
