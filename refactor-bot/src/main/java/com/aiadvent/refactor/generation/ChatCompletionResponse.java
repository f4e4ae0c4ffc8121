package com.aiadvent.refactor.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletionResponse(String id, String model, List<Choice> choices, Usage usage) {

  public String firstContent() {
    if (choices == null || choices.isEmpty()) {
      return null;
    }
    Choice choice = choices.get(0);
    return choice != null && choice.message() != null ? choice.message().content() : null;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Choice(
      Integer index, Message message, @JsonProperty("finish_reason") String finishReason) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Message(String role, String content) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Usage(
      @JsonProperty("prompt_tokens") Long promptTokens,
      @JsonProperty("completion_tokens") Long completionTokens,
      @JsonProperty("total_tokens") Long totalTokens,
      @JsonProperty("total_cost") Double totalCost,
      Double cost) {}
}
