package com.aiadvent.refactor.generation;

import com.aiadvent.refactor.config.RefactorBotProperties;
import com.aiadvent.refactor.patch.GenerationResult;
import com.aiadvent.refactor.patch.InvalidPatchOutputException;
import com.aiadvent.refactor.patch.PatchExtractor;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** {@link GenerationPort} backed by a chat-completions model. */
@Component
public class LlmPatchGenerator implements GenerationPort {

  private static final Logger log = LoggerFactory.getLogger(LlmPatchGenerator.class);

  private final OpenRouterClient client;
  private final RefactorBotProperties.GenerationProperties properties;

  public LlmPatchGenerator(OpenRouterClient client, RefactorBotProperties properties) {
    this.client = Objects.requireNonNull(client, "client");
    this.properties = Objects.requireNonNull(properties, "properties").getGeneration();
  }

  @Override
  public GenerationResult generate(GenerationRequest request) {
    String prompt = RefactorPrompts.generationPrompt(request);
    log.debug(
        "Requesting refactor patch: files={}, promptChars={}",
        request.chunk().files(),
        prompt.length());
    return interpret(invoke(prompt, request.usage()));
  }

  @Override
  public GenerationResult repair(RepairRequest request) {
    String prompt = RefactorPrompts.repairPrompt(request);
    log.debug(
        "Requesting patch repair: files={}, promptChars={}",
        request.chunk().files(),
        prompt.length());
    return interpret(invoke(prompt, request.usage()));
  }

  private String invoke(String prompt, UsageStats usage) {
    ChatCompletionRequest completion =
        new ChatCompletionRequest(
            properties.getModel(),
            List.of(ChatMessage.system(RefactorPrompts.SYSTEM_PROMPT), ChatMessage.user(prompt)),
            properties.getTemperature());
    return client.complete(completion, usage);
  }

  private GenerationResult interpret(String content) {
    if (content == null || content.isBlank()) {
      throw new InvalidPatchOutputException("Generation response did not include content");
    }
    return PatchExtractor.extract(content);
  }
}
