package com.aiadvent.refactor.git;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CommitRangeResolverTest {

  @TempDir Path tempDir;

  private GitClient git;
  private CommitRangeResolver resolver;

  @BeforeEach
  void setUp() {
    git = mock(GitClient.class);
    resolver = new CommitRangeResolver(git, new ObjectMapper());
  }

  @Test
  void usesBeforeAndAfterFromPushEvent() throws Exception {
    Path event =
        writeEvent(
            "{\"before\":\"1111111\",\"after\":\"2222222\",\"ref\":\"refs/heads/main\","
                + "\"repository\":{\"full_name\":\"acme/shop\"}}");

    CommitRange range = resolver.resolve(event);

    assertThat(range).isEqualTo(new CommitRange("1111111", "2222222"));
    verifyNoInteractions(git);
  }

  @Test
  void zeroBeforeFallsBackToParentOfHead() throws Exception {
    Path event =
        writeEvent("{\"before\":\"0000000000000000000000000000000000000000\",\"after\":\"abc\"}");
    stubHead();

    assertThat(resolver.resolve(event)).isEqualTo(new CommitRange("parent", "head"));
  }

  @Test
  void missingPayloadFallsBackToParentOfHead() {
    stubHead();

    assertThat(resolver.resolve(tempDir.resolve("missing.json")))
        .isEqualTo(new CommitRange("parent", "head"));
    assertThat(resolver.resolve(null)).isEqualTo(new CommitRange("parent", "head"));
  }

  @Test
  void unreadablePayloadIsReported() throws Exception {
    Path event = writeEvent("{not json");

    assertThatThrownBy(() -> resolver.resolve(event))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Failed to read push event payload");
  }

  private void stubHead() {
    when(git.revParse("HEAD")).thenReturn("head");
    when(git.revParse("HEAD~1")).thenReturn("parent");
  }

  private Path writeEvent(String json) throws Exception {
    Path event = tempDir.resolve("event.json");
    Files.writeString(event, json, StandardCharsets.UTF_8);
    return event;
  }
}
