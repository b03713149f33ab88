package com.scholary.knowledge.cli;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.knowledge.error.ErrorKind;
import com.scholary.knowledge.output.ChunkSink;
import com.scholary.knowledge.pipeline.BatchItemResult;
import com.scholary.knowledge.pipeline.KnowledgePipeline;
import com.scholary.knowledge.pipeline.PipelineResults;
import com.scholary.knowledge.pipeline.PipelineStage;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class ProcessTranscriptRunnerTest {

  @Mock private KnowledgePipeline pipeline;

  @Mock private ChunkSink chunkSink;

  @Test
  void run_shouldSendChunksOfSuccessfulTranscriptsToSink() {
    when(pipeline.processBatch(List.of(Path.of("a.srt"), Path.of("b.srt"))))
        .thenReturn(
            List.of(
                BatchItemResult.succeeded(Path.of("a.srt"), PipelineResults.empty("a.srt")),
                BatchItemResult.failed(
                    Path.of("b.srt"), PipelineStage.PARSE, ErrorKind.NOT_FOUND, "missing")));

    new ProcessTranscriptRunner(pipeline, chunkSink)
        .run(new DefaultApplicationArguments("--transcript=a.srt", "--transcript=b.srt"));

    verify(chunkSink).accept(eq("a.srt"), anyList());
    verify(chunkSink, never()).accept(eq("b.srt"), anyList());
  }

  @Test
  void run_shouldDoNothingWithoutTranscriptArguments() {
    new ProcessTranscriptRunner(pipeline, chunkSink).run(new DefaultApplicationArguments());

    verify(pipeline, never()).processBatch(any());
    verify(chunkSink, never()).accept(anyString(), anyList());
  }
}
