package com.studiobooking.orchestrator.api;

import com.studiobooking.orchestrator.api.dto.ChatMessageRequest;
import com.studiobooking.orchestrator.api.dto.ChatMessageResponse;
import com.studiobooking.orchestrator.channel.MessageDeduplicator;
import com.studiobooking.orchestrator.dialogue.BookingOrchestrator;
import com.studiobooking.orchestrator.dialogue.InboundMessage;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Channel-neutral entry point: a normalized message in, the reply text out. */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

  private final BookingOrchestrator orchestrator;
  private final MessageDeduplicator dedup;

  @PostMapping("/message")
  public ResponseEntity<ChatMessageResponse> message(@Valid @RequestBody ChatMessageRequest req) {
    if (!dedup.firstDelivery(req.channel(), req.messageId())) {
      return ResponseEntity.status(HttpStatus.ACCEPTED).body(new ChatMessageResponse(null, null));
    }
    String traceId = UUID.randomUUID().toString();
    String reply =
        orchestrator.processMessage(
            new InboundMessage(req.channel(), req.chatId(), req.messageId(), req.text()), traceId);
    return ResponseEntity.ok(new ChatMessageResponse(reply, traceId));
  }
}
