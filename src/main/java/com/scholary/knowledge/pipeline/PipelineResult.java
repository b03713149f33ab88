package com.scholary.knowledge.pipeline;

import com.scholary.knowledge.chunking.Chunk;
import com.scholary.knowledge.chunking.ChunkingResult;
import com.scholary.knowledge.cleaning.CleaningResult;
import com.scholary.knowledge.extraction.ExtractionResult;
import com.scholary.knowledge.reconstruct.ReconstructionResult;
import com.scholary.knowledge.transcript.Segment;
import com.scholary.knowledge.transcript.SegmentStatistics;
import java.util.List;

/** Every stage's output for one transcript. */
public record PipelineResult(
    String transcriptName,
    String contentHash,
    String ruleSetVersion,
    List<Segment> segments,
    SegmentStatistics segmentStatistics,
    ReconstructionResult reconstruction,
    CleaningResult cleaning,
    ExtractionResult extraction,
    ChunkingResult chunking,
    long elapsedMs) {

  public List<Chunk> chunks() {
    return chunking.chunks();
  }
}
