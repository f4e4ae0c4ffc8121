package com.aiadvent.refactor.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aiadvent.refactor.config.RefactorBotProperties;
import com.aiadvent.refactor.patch.DiffChunk;
import com.aiadvent.refactor.patch.FileSnapshot;
import com.aiadvent.refactor.patch.GenerationResult;
import com.aiadvent.refactor.patch.InvalidPatchOutputException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LlmPatchGeneratorTest {

  private static final DiffChunk CHUNK =
      new DiffChunk(
          List.of("src/app.ts"),
          "diff --git a/src/app.ts b/src/app.ts\n@@ -1 +1 @@\n-let x=1\n+let x = 1",
          List.of(new FileSnapshot("src/app.ts", "let x = 1\n")));

  private OpenRouterClient client;
  private LlmPatchGenerator generator;

  @BeforeEach
  void setUp() {
    client = mock(OpenRouterClient.class);
    RefactorBotProperties properties = new RefactorBotProperties();
    properties.getGeneration().setModel("test/model");
    generator = new LlmPatchGenerator(client, properties);
  }

  @Test
  void generationPromptCarriesChunkAndSnapshots() {
    UsageStats usage = new UsageStats();
    when(client.complete(any(), same(usage))).thenReturn("NO_CHANGES_NEEDED");

    GenerationResult result =
        generator.generate(new GenerationRequest("acme/shop", "base1", "head2", CHUNK, usage));

    assertThat(result.hasPatch()).isFalse();
    ArgumentCaptor<ChatCompletionRequest> captor =
        ArgumentCaptor.forClass(ChatCompletionRequest.class);
    verify(client).complete(captor.capture(), same(usage));
    ChatCompletionRequest request = captor.getValue();
    assertThat(request.model()).isEqualTo("test/model");
    assertThat(request.messages()).extracting(ChatMessage::role).containsExactly("system", "user");
    assertThat(request.messages().get(1).content())
        .contains("repository: acme/shop")
        .contains("- src/app.ts")
        .contains("### src/app.ts")
        .contains("let x = 1");
  }

  @Test
  void repairPromptIncludesFailedPatchAndError() {
    String patch =
        String.join(
            "\n",
            "--- a/src/app.ts",
            "+++ b/src/app.ts",
            "@@ -1 +1 @@",
            "-let x = 1",
            "+let x = 1;");
    when(client.complete(any(), any())).thenReturn("```diff\n" + patch + "\n```");

    GenerationResult result =
        generator.repair(
            new RepairRequest(
                "acme/shop",
                "base1",
                "head2",
                CHUNK,
                "--- broken",
                "error: corrupt patch at line 3",
                new UsageStats()));

    assertThat(result.hasPatch()).isTrue();
    assertThat(result.patch()).isEqualTo(patch);
    ArgumentCaptor<ChatCompletionRequest> captor =
        ArgumentCaptor.forClass(ChatCompletionRequest.class);
    verify(client).complete(captor.capture(), any());
    assertThat(captor.getValue().messages().get(1).content())
        .contains("## Previous patch (rejected)")
        .contains("--- broken")
        .contains("error: corrupt patch at line 3");
  }

  @Test
  void blankContentIsInvalidOutput() {
    when(client.complete(any(), any())).thenReturn("  ");

    assertThatThrownBy(
            () ->
                generator.generate(
                    new GenerationRequest("acme/shop", "b", "h", CHUNK, new UsageStats())))
        .isInstanceOf(InvalidPatchOutputException.class)
        .hasMessage("Generation response did not include content");
  }
}
