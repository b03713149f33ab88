package com.scholary.knowledge;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.knowledge.config.PipelineProperties;
import com.scholary.knowledge.pipeline.KnowledgePipeline;
import com.scholary.knowledge.pipeline.PipelineProgressListener;
import com.scholary.knowledge.pipeline.PipelineResult;
import com.scholary.knowledge.rules.KnowledgeRuleSet;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;

@SpringBootTest(properties = "pipeline.output.dir=target/test-output")
class KnowledgePipelineApplicationTest {

  @Autowired private KnowledgePipeline pipeline;

  @Autowired private KnowledgeRuleSet ruleSet;

  @Autowired private PipelineProperties properties;

  @Test
  void contextLoads_withBundledRulesAndDefaults() {
    assertThat(ruleSet.version()).isEqualTo("ja-v1");
    assertThat(properties.chunking().maxChunkChars()).isEqualTo(1000);
    assertThat(properties.reconstruction().silenceGapMs()).isEqualTo(2000);
    assertThat(properties.cleaning().removeFillers()).isFalse();
    assertThat(properties.output().saveIntermediateResults()).isFalse();
  }

  @Test
  void pipeline_shouldProcessSampleTranscript() throws IOException {
    String content =
        new ClassPathResource("transcripts/sample.srt")
            .getContentAsString(StandardCharsets.UTF_8);

    PipelineResult result =
        pipeline.process("sample.srt", content, PipelineProgressListener.NONE);

    assertThat(result.segments()).hasSize(8);
    assertThat(result.chunks()).hasSize(1);
    assertThat(result.chunks().get(0).metadata().language()).isEqualTo("ja");
  }
}
