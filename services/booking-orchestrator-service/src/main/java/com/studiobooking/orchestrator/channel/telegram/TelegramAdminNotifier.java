package com.studiobooking.orchestrator.channel.telegram;

import com.studiobooking.orchestrator.channel.AdminNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Sends operator alerts to the admin Telegram chat. Without a chat id they only go to the log. */
@Component
@Slf4j
public class TelegramAdminNotifier implements AdminNotifier {

  private final TelegramBotClient bot;
  private final String adminChatId;

  public TelegramAdminNotifier(
      TelegramBotClient bot, @Value("${telegram.admin-chat-id:}") String adminChatId) {
    this.bot = bot;
    this.adminChatId = adminChatId == null ? "" : adminChatId.trim();
  }

  @Override
  public void notifyAdmin(String text) {
    if (adminChatId.isBlank()) {
      log.info("Admin chat is not configured; alert: {}", text);
      return;
    }
    try {
      if (!bot.send(adminChatId, text)) {
        log.warn("Admin alert was not delivered");
      }
    } catch (RuntimeException e) {
      log.warn("Admin alert failed: {}", e.getMessage());
    }
  }
}
