package com.scholary.knowledge.cli;

import com.scholary.knowledge.output.ChunkSink;
import com.scholary.knowledge.pipeline.BatchItemResult;
import com.scholary.knowledge.pipeline.KnowledgePipeline;
import com.scholary.knowledge.pipeline.PipelineResult;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Processes the transcripts named on the command line.
 *
 * <pre>
 * java -jar transcript-knowledge.jar --transcript=talk-01.srt --transcript=talk-02.srt
 * </pre>
 *
 * <p>Chunks of each successful transcript go to the configured {@link ChunkSink}; failures are
 * logged and the remaining files still run.
 */
@Component
public class ProcessTranscriptRunner implements ApplicationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessTranscriptRunner.class);

  static final String TRANSCRIPT_OPTION = "transcript";

  private final KnowledgePipeline pipeline;
  private final ChunkSink chunkSink;

  public ProcessTranscriptRunner(KnowledgePipeline pipeline, ChunkSink chunkSink) {
    this.pipeline = pipeline;
    this.chunkSink = chunkSink;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> transcripts = args.getOptionValues(TRANSCRIPT_OPTION);
    if (transcripts == null || transcripts.isEmpty()) {
      LOGGER.info("No --{}=<path> given, nothing to process", TRANSCRIPT_OPTION);
      return;
    }

    List<BatchItemResult> results =
        pipeline.processBatch(transcripts.stream().map(Path::of).toList());

    for (BatchItemResult item : results) {
      if (item.success()) {
        PipelineResult result = item.result();
        chunkSink.accept(result.transcriptName(), result.chunks());
        LOGGER.info(
            "{}: {} segments -> {} knowledge objects -> {} chunks",
            item.file(),
            result.segments().size(),
            result.extraction().knowledge().size(),
            result.chunks().size());
      } else {
        LOGGER.error(
            "{}: failed at stage {} ({}): {}",
            item.file(),
            item.failedStage(),
            item.errorKind(),
            item.error());
      }
    }
  }
}
