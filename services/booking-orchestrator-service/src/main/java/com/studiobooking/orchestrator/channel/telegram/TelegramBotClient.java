package com.studiobooking.orchestrator.channel.telegram;

import com.studiobooking.orchestrator.channel.ChannelAdapter;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
@Slf4j
public class TelegramBotClient implements ChannelAdapter {

  public static final String CHANNEL = "telegram";

  private final RestClient rest;
  private final String botToken;

  public TelegramBotClient(
      RestClient.Builder builder,
      @Value("${telegram.bot-token:}") String botToken,
      @Value("${telegram.api-base-url:https://api.telegram.org}") String apiBaseUrl) {
    this.botToken = botToken == null ? "" : botToken.trim();
    this.rest = builder.baseUrl(apiBaseUrl).build();
  }

  public boolean isConfigured() {
    return !botToken.isBlank();
  }

  @Override
  public String name() {
    return CHANNEL;
  }

  @Override
  public boolean send(String chatId, String text) {
    if (!isConfigured()) {
      log.warn("Telegram bot token is not configured; skip sending message to chatId={}", chatId);
      return false;
    }
    try {
      Map<String, Object> body = new HashMap<>();
      body.put("chat_id", chatId);
      body.put("text", text);
      rest.post().uri(method("sendMessage")).body(body).retrieve().toBodilessEntity();
      return true;
    } catch (Exception e) {
      log.warn("Failed to send Telegram message: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public void sendTyping(String chatId) {
    if (!isConfigured()) {
      return;
    }
    try {
      rest.post()
          .uri(method("sendChatAction"))
          .body(Map.of("chat_id", chatId, "action", "typing"))
          .retrieve()
          .toBodilessEntity();
    } catch (Exception e) {
      log.debug("Failed to send typing action: {}", e.getMessage());
    }
  }

  private String method(String name) {
    return "/bot" + botToken + "/" + name;
  }
}
