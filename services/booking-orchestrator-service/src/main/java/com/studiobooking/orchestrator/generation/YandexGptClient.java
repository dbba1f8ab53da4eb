package com.studiobooking.orchestrator.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.studiobooking.orchestrator.config.GenerationProperties;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** YandexGPT foundation models completion API, synchronous mode. */
@Component
@Slf4j
public class YandexGptClient implements GenerationClient {

  private final RestClient rest;
  private final GenerationProperties props;

  public YandexGptClient(
      @Qualifier("generationRestClient") RestClient rest, GenerationProperties props) {
    this.rest = rest;
    this.props = props;
  }

  @Override
  public String modelName() {
    return props.model();
  }

  @Override
  public GenerationResponse complete(List<PromptMessage> messages) {
    JsonNode root;
    try {
      root =
          rest.post()
              .uri("/completion")
              .contentType(MediaType.APPLICATION_JSON)
              .body(request(messages))
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientException e) {
      throw new GenerationException("YandexGPT call failed: " + e.getMessage(), e);
    }

    JsonNode result = root == null ? null : root.path("result");
    JsonNode alternatives = result == null ? null : result.path("alternatives");
    if (alternatives == null || !alternatives.isArray() || alternatives.isEmpty()) {
      throw new GenerationException("No alternatives in YandexGPT response");
    }
    String text = alternatives.get(0).path("message").path("text").asText("");
    // totalTokens comes back as a string
    long tokens = result.path("usage").path("totalTokens").asLong(0);
    return new GenerationResponse(text, tokens);
  }

  private Map<String, Object> request(List<PromptMessage> messages) {
    Map<String, Object> options = new LinkedHashMap<>();
    options.put("stream", false);
    options.put("temperature", props.temperature());
    options.put("maxTokens", Integer.toString(props.maxTokens()));

    List<Map<String, String>> msgs = new ArrayList<>();
    for (PromptMessage m : messages) {
      msgs.add(Map.of("role", m.role(), "text", m.text() == null ? "" : m.text()));
    }

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("modelUri", "gpt://" + props.folderId() + "/" + props.model());
    body.put("completionOptions", options);
    body.put("messages", msgs);
    return body;
  }
}
