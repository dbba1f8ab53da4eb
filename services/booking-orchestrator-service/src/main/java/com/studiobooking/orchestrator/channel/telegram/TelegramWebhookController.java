package com.studiobooking.orchestrator.channel.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.studiobooking.orchestrator.channel.MessageDeduplicator;
import com.studiobooking.orchestrator.dialogue.BookingOrchestrator;
import com.studiobooking.orchestrator.dialogue.InboundMessage;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Telegram webhook endpoint. Replies are sent back through the Bot API, the HTTP response only
 * acknowledges the update.
 */
@RestController
@RequestMapping("/telegram")
@Slf4j
public class TelegramWebhookController {

  static final String TEXT_ONLY =
      "Пока я понимаю только текстовые сообщения. Напишите, пожалуйста, текстом.";

  private final BookingOrchestrator orchestrator;
  private final TelegramBotClient bot;
  private final MessageDeduplicator dedup;
  private final String secretToken;

  public TelegramWebhookController(
      BookingOrchestrator orchestrator,
      TelegramBotClient bot,
      MessageDeduplicator dedup,
      @Value("${telegram.webhook.secret-token:}") String secretToken) {
    this.orchestrator = orchestrator;
    this.bot = bot;
    this.dedup = dedup;
    this.secretToken = secretToken == null ? "" : secretToken.trim();
  }

  @PostMapping("/webhook")
  public Map<String, Object> webhook(
      @RequestBody JsonNode update,
      @RequestHeader(value = "X-Telegram-Bot-Api-Secret-Token", required = false)
          String headerSecret) {

    if (!secretToken.isBlank()) {
      if (headerSecret == null || !secretToken.equals(headerSecret)) {
        log.warn("Webhook secret token mismatch");
        return Map.of("ok", false);
      }
    }

    JsonNode message = update.path("message");
    if (message.isMissingNode() || message.isNull()) {
      return Map.of("ok", true, "ignored", "no_message");
    }

    String chatId = message.path("chat").path("id").asText();
    String messageId = message.path("message_id").asText(null);

    JsonNode textNode = message.path("text");
    if (textNode.isMissingNode() || textNode.isNull()) {
      bot.send(chatId, TEXT_ONLY);
      return Map.of("ok", true, "ignored", "no_text");
    }

    String text = textNode.asText("").trim();
    if (text.isBlank()) {
      return Map.of("ok", true, "ignored", "blank_text");
    }

    if (!dedup.firstDelivery(TelegramBotClient.CHANNEL, messageId)) {
      log.info("Duplicate delivery of message {} in chat {}", messageId, chatId);
      return Map.of("ok", true, "ignored", "duplicate");
    }

    bot.sendTyping(chatId);
    String traceId = UUID.randomUUID().toString();
    String reply =
        orchestrator.processMessage(
            new InboundMessage(TelegramBotClient.CHANNEL, chatId, messageId, text), traceId);
    boolean sent = bot.send(chatId, reply);
    return Map.of("ok", true, "sent", sent ? 1 : 0);
  }
}
