package com.scholary.knowledge.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.knowledge.pipeline.PipelineResult;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Caffeine-backed result cache keyed by transcript name.
 *
 * <p>Each transcript keeps only its latest run. A lookup with a different {@link RunKey} drops the
 * stale run. Size and time-to-live bound the transcripts held.
 */
@Component
public class InMemoryPipelineResultCache implements PipelineResultCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryPipelineResultCache.class);

  private final Cache<String, CachedRun> runs;

  public InMemoryPipelineResultCache(
      @Value("${pipeline.cache.max-size:100}") int maxTranscripts,
      @Value("${pipeline.cache.ttl-hours:24}") int ttlHours) {
    this.runs =
        Caffeine.newBuilder()
            .maximumSize(maxTranscripts)
            .expireAfterWrite(Duration.ofHours(ttlHours))
            .build();
    LOGGER.info(
        "Result cache holds up to {} transcripts for {} hours", maxTranscripts, ttlHours);
  }

  @Override
  public Optional<PipelineResult> lookup(RunKey key) {
    CachedRun run = runs.getIfPresent(key.transcriptName());
    if (run == null) {
      return Optional.empty();
    }
    if (run.key().equals(key)) {
      return Optional.of(run.result());
    }
    runs.asMap().remove(key.transcriptName(), run);
    LOGGER.info(
        "Dropped stale run of {}: {} changed", key.transcriptName(), key.changeFrom(run.key()));
    return Optional.empty();
  }

  @Override
  public void store(RunKey key, PipelineResult result) {
    runs.put(key.transcriptName(), new CachedRun(key, result));
    LOGGER.debug("Cached run {} with {} chunks", key.describe(), result.chunks().size());
  }

  private record CachedRun(RunKey key, PipelineResult result) {}
}
