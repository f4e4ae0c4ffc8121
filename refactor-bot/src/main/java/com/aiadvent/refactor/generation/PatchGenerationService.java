package com.aiadvent.refactor.generation;

import com.aiadvent.refactor.patch.DiffChunk;
import com.aiadvent.refactor.patch.GenerationResult;
import com.aiadvent.refactor.patch.PatchCandidate;
import com.aiadvent.refactor.patch.PatchLifecycleStats;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Asks the generator for a patch per chunk, strictly in order. A failing chunk is classified,
 * counted and skipped; it never aborts the loop.
 */
@Service
public class PatchGenerationService {

  private static final Logger log = LoggerFactory.getLogger(PatchGenerationService.class);

  private final GenerationPort generationPort;
  private final MeterRegistry meterRegistry;

  public PatchGenerationService(
      GenerationPort generationPort, @Nullable MeterRegistry meterRegistry) {
    this.generationPort = Objects.requireNonNull(generationPort, "generationPort");
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
  }

  public ChunkGenerationReport generate(
      String repository,
      String baseRef,
      String headRef,
      List<DiffChunk> chunks,
      UsageStats usage,
      PatchLifecycleStats stats) {
    Objects.requireNonNull(chunks, "chunks");
    Objects.requireNonNull(stats, "stats");
    List<PatchCandidate> candidates = new ArrayList<>();
    FailureBreakdown breakdown = new FailureBreakdown();
    int skipped = 0;
    int failed = 0;
    for (int index = 0; index < chunks.size(); index++) {
      DiffChunk chunk = chunks.get(index);
      GenerationResult result;
      try {
        result =
            generationPort.generate(
                new GenerationRequest(repository, baseRef, headRef, chunk, usage));
      } catch (RuntimeException ex) {
        ChunkFailureType type = ChunkFailureClassifier.classify(ex);
        breakdown.record(type);
        stats.recordFailedChunk();
        failed++;
        meterRegistry.counter("refactor_chunk_generation_failure_total", "type", type.code())
            .increment();
        log.warn(
            "Chunk {}/{} generation failed: files={}, type={}, error={}",
            index + 1,
            chunks.size(),
            chunk.files(),
            type.code(),
            ex.getMessage());
        continue;
      }
      if (!result.hasPatch()) {
        stats.recordSkippedChunk();
        skipped++;
        log.info(
            "Chunk {}/{} needs no changes: files={}", index + 1, chunks.size(), chunk.files());
        continue;
      }
      stats.recordGenerated();
      candidates.add(new PatchCandidate(chunk, result.patch()));
      log.info(
          "Chunk {}/{} produced a patch: files={}, patchChars={}",
          index + 1,
          chunks.size(),
          chunk.files(),
          result.patch().length());
    }
    return new ChunkGenerationReport(candidates, chunks.size(), skipped, failed, breakdown);
  }
}
