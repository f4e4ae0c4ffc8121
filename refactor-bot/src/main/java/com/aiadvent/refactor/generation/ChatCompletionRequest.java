package com.aiadvent.refactor.generation;

import java.util.List;

public record ChatCompletionRequest(String model, List<ChatMessage> messages, double temperature) {

  public ChatCompletionRequest {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }
}
