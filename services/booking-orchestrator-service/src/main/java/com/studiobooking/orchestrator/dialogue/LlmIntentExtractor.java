package com.studiobooking.orchestrator.dialogue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studiobooking.orchestrator.config.StudioProperties;
import com.studiobooking.orchestrator.generation.GenerationGateway;
import com.studiobooking.orchestrator.generation.GenerationResponse;
import com.studiobooking.orchestrator.generation.PromptMessage;
import com.studiobooking.orchestrator.session.ChatTurn;
import com.studiobooking.orchestrator.session.ConversationState;
import com.studiobooking.orchestrator.session.SlotValues;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Intent and slot extraction through the generation backend. No tool calls. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmIntentExtractor implements IntentExtractor {

  private final GenerationGateway generation;
  private final JsonReplyParser parser;
  private final ObjectMapper mapper;
  private final StudioProperties studio;

  @Override
  public IntentResult resolve(
      String message, ConversationState state, SlotValues slots, List<ChatTurn> history) {
    List<PromptMessage> prompt = new ArrayList<>();
    prompt.add(PromptMessage.system(systemPrompt(state, slots)));
    int from = Math.max(0, history.size() - SlotValues.MAX_HISTORY);
    for (ChatTurn turn : history.subList(from, history.size())) {
      prompt.add(new PromptMessage(turn.role(), turn.text()));
    }
    prompt.add(PromptMessage.user(message));

    GenerationResponse response = generation.generate(prompt);
    String raw = response.text();

    Optional<JsonNode> json = parser.extract(raw);
    if (json.isEmpty()) {
      log.info("Model reply is not JSON, answering with raw text");
      return IntentResult.fallback(raw);
    }
    JsonNode node = json.get();
    ExtractedSlots extracted = ExtractedSlots.empty();
    JsonNode slotsNode = node.get("slots");
    if (slotsNode != null && slotsNode.isObject()) {
      try {
        extracted = mapper.treeToValue(slotsNode, ExtractedSlots.class);
      } catch (Exception e) {
        log.info("Ignoring unreadable slots in model reply: {}", e.getMessage());
      }
    }
    String text = node.hasNonNull("response") ? node.get("response").asText() : raw;
    return new IntentResult(
        Intent.fromWire(node.path("intent").asText(null)), cleaned(extracted), text);
  }

  String systemPrompt(ConversationState state, SlotValues slots) {
    Map<String, Object> known = new LinkedHashMap<>();
    known.put("group", slots.getGroup());
    known.put("datetime", slots.getDatetimeRaw());
    known.put("client_name", slots.getClientName());
    known.put("client_phone", slots.getClientPhone());
    String knownJson;
    try {
      knownJson = mapper.writeValueAsString(known);
    } catch (Exception e) {
      knownJson = known.toString();
    }

    return "Ты помощник студии танцев «"
        + studio.name()
        + "». Помогаешь клиентам записаться на занятия.\n\n"
        + "Студия: "
        + studio.name()
        + ", адрес: "
        + studio.address()
        + ", телефон: "
        + studio.phone()
        + ".\n\n"
        + "Текущее состояние диалога:\n"
        + "- Состояние: "
        + state.name().toLowerCase(Locale.ROOT)
        + "\n"
        + "- Заполненные слоты: "
        + knownJson
        + "\n\n"
        + "Правила:\n"
        + "1. Определи intent: booking, schedule_query, price_query, info, greeting, cancel,"
        + " admin\n"
        + "2. Извлеки слоты из сообщения: group, datetime, client_name, client_phone\n"
        + "3. datetime передавай так, как написал клиент (например, \"завтра в 19:00\"),"
        + " не вычисляй дату сам\n"
        + "4. Не придумывай расписание или цены\n"
        + "5. Отвечай кратко (до 300 символов), дружелюбно, без канцелярита\n\n"
        + "Отвечай только JSON:\n"
        + "{\"intent\": \"booking|schedule_query|price_query|info|greeting|cancel|admin\", "
        + "\"slots\": {\"group\": \"...\", \"datetime\": \"...\", \"client_name\": \"...\", "
        + "\"client_phone\": \"...\"}, \"response\": \"текст ответа клиенту\"}";
  }

  /** Models like to echo placeholders back; those are not values. */
  private static ExtractedSlots cleaned(ExtractedSlots s) {
    return new ExtractedSlots(
        value(s.group()), value(s.datetime()), value(s.clientName()), value(s.clientPhone()));
  }

  private static String value(String s) {
    if (s == null) {
      return null;
    }
    String t = s.trim();
    if (t.isEmpty() || t.equals("...") || t.equalsIgnoreCase("null")) {
      return null;
    }
    return t;
  }
}
