package com.studiobooking.orchestrator.api;

import com.studiobooking.orchestrator.crm.FallbackItem;
import com.studiobooking.orchestrator.crm.FallbackQueue;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Lets a reconciliation worker drain CRM operations that could not be completed. */
@RestController
@RequestMapping("/api/fallback")
@RequiredArgsConstructor
public class FallbackController {

  private final FallbackQueue queue;

  @GetMapping("/size")
  public Map<String, Long> size() {
    return Map.of("size", queue.size());
  }

  /** Oldest record first; 204 when the queue is empty. */
  @PostMapping("/dequeue")
  public ResponseEntity<FallbackItem> dequeue() {
    return queue
        .dequeue()
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }
}
