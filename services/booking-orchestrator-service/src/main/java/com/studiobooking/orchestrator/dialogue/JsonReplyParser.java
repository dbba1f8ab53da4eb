package com.studiobooking.orchestrator.dialogue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Pulls a JSON object out of model text: the whole reply, then a fenced block, then gives up. */
@Component
@RequiredArgsConstructor
public class JsonReplyParser {

  private static final List<Pattern> FENCES =
      List.of(
          Pattern.compile("```json\\s*\\n(.*?)\\n```", Pattern.DOTALL),
          Pattern.compile("```\\s*\\n(.*?)\\n```", Pattern.DOTALL),
          Pattern.compile("```json\\s*(.*?)\\s*```", Pattern.DOTALL),
          Pattern.compile("```\\s*(.*?)\\s*```", Pattern.DOTALL));

  private final ObjectMapper mapper;

  public Optional<JsonNode> extract(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    Optional<JsonNode> whole = parseObject(text.trim());
    if (whole.isPresent()) {
      return whole;
    }
    for (Pattern fence : FENCES) {
      Matcher m = fence.matcher(text);
      if (m.find()) {
        Optional<JsonNode> inner = parseObject(m.group(1).trim());
        if (inner.isPresent()) {
          return inner;
        }
      }
    }
    return Optional.empty();
  }

  private Optional<JsonNode> parseObject(String s) {
    try {
      JsonNode node = mapper.readTree(s);
      return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }
}
