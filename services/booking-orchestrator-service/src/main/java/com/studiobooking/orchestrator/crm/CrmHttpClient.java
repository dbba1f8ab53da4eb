package com.studiobooking.orchestrator.crm;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

/**
 * Wire-level CRM calls. Every request passes the circuit breaker, then the retry template.
 *
 * <p>Throws {@link CircuitBreakerOpenException} without touching the network while the breaker is
 * open; otherwise lets {@code RestClient} exceptions through for classification.
 */
@Component
@Slf4j
public class CrmHttpClient {

  private final RestClient rest;
  private final RetryTemplate retry;
  private final CrmCircuitBreaker breaker;

  public CrmHttpClient(
      @Qualifier("crmRestClient") RestClient rest,
      @Qualifier("crmRetryTemplate") RetryTemplate retry,
      CrmCircuitBreaker breaker) {
    this.rest = rest;
    this.retry = retry;
    this.breaker = breaker;
  }

  public List<JsonNode> list(
      CrmEntity entity, String[] fields, Map<String, Object> filters, int limit) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("limit", limit);
    body.put("page", 1);
    if (fields != null && fields.length > 0) {
      body.put("fields", Arrays.asList(fields));
    }
    if (filters != null && !filters.isEmpty()) {
      body.put("columns", filters);
    }
    JsonNode root = post(entity, "list", body);
    return rows(root);
  }

  /** Create goes through the CRM's {@code update} action without an id. */
  public JsonNode create(CrmEntity entity, Map<String, Object> data) {
    return post(entity, "update", data);
  }

  public boolean delete(CrmEntity entity, long id) {
    post(entity, "delete", Map.of("id", id));
    return true;
  }

  private JsonNode post(CrmEntity entity, String action, Object body) {
    String uri = "/" + entity.path() + "/" + action;
    return guarded(
        uri,
        () ->
            retry.execute(
                ctx -> {
                  if (ctx.getRetryCount() > 0) {
                    log.info("CRM retry #{} for {}", ctx.getRetryCount(), uri);
                  }
                  return rest.post().uri(uri).body(body).retrieve().body(JsonNode.class);
                }));
  }

  private <T> T guarded(String uri, Supplier<T> call) {
    if (!breaker.tryAcquirePermission()) {
      throw new CircuitBreakerOpenException("CRM circuit breaker is open");
    }
    try {
      T result = call.get();
      breaker.onSuccess();
      return result;
    } catch (HttpClientErrorException e) {
      // a 4xx answer still proves the CRM is up
      breaker.onSuccess();
      throw e;
    } catch (RuntimeException e) {
      breaker.onFailure();
      log.warn("CRM call {} failed: {}", uri, e.getMessage());
      throw e;
    }
  }

  private static List<JsonNode> rows(JsonNode root) {
    JsonNode arr = root;
    if (root != null && root.isObject()) {
      arr = root.get("data");
    }
    List<JsonNode> out = new ArrayList<>();
    if (arr != null && arr.isArray()) {
      arr.forEach(out::add);
    }
    return out;
  }
}
