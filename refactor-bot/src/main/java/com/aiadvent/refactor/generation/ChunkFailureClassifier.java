package com.aiadvent.refactor.generation;

import com.aiadvent.refactor.patch.InvalidPatchOutputException;
import java.util.Locale;

/** Maps a chunk generation failure onto the reporting taxonomy. */
public final class ChunkFailureClassifier {

  private ChunkFailureClassifier() {}

  public static ChunkFailureType classify(Throwable error) {
    if (error instanceof InvalidPatchOutputException) {
      return ChunkFailureType.INVALID_OUTPUT;
    }
    if (error instanceof GenerationTimeoutException) {
      return ChunkFailureType.TIMEOUT;
    }
    if (error instanceof GenerationApiException || error instanceof GenerationTransportException) {
      return ChunkFailureType.API_ERROR;
    }
    if (error != null && OpenRouterClient.isTimeout(error)) {
      return ChunkFailureType.TIMEOUT;
    }
    String message = error == null ? null : error.getMessage();
    if (message != null) {
      String lower = message.toLowerCase(Locale.ROOT);
      if (lower.contains("timed out") || lower.contains("timeout") || lower.contains("aborted")) {
        return ChunkFailureType.TIMEOUT;
      }
    }
    return ChunkFailureType.UNKNOWN;
  }
}
