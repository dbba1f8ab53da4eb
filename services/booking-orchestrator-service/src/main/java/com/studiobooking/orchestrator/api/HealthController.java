package com.studiobooking.orchestrator.api;

import com.studiobooking.orchestrator.api.dto.HealthResponse;
import com.studiobooking.orchestrator.budget.BudgetGuard;
import com.studiobooking.orchestrator.budget.BudgetSnapshot;
import com.studiobooking.orchestrator.crm.CrmAdapter;
import com.studiobooking.orchestrator.crm.FallbackQueue;
import com.studiobooking.orchestrator.store.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

  private final KeyValueStore store;
  private final CrmAdapter crm;
  private final BudgetGuard budget;
  private final FallbackQueue fallbackQueue;

  /** 503 only when the store is down; a CRM outage or budget breach is reported as degraded. */
  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    boolean storeUp = store.ping();
    boolean crmUp = crm.healthCheck();
    BudgetSnapshot snapshot = null;
    if (storeUp) {
      try {
        snapshot = budget.snapshot();
      } catch (RuntimeException e) {
        log.warn("Budget snapshot unavailable: {}", e.getMessage());
      }
    }
    long queued = storeUp ? fallbackQueue.size() : 0;

    String status;
    if (!storeUp) {
      status = "DOWN";
    } else if (!crmUp || (snapshot != null && snapshot.breached())) {
      status = "DEGRADED";
    } else {
      status = "UP";
    }
    HealthResponse body = new HealthResponse(status, storeUp, crmUp, snapshot, queued);
    return ResponseEntity.status(storeUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
        .body(body);
  }
}
