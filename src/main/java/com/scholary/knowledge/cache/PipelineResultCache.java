package com.scholary.knowledge.cache;

import com.scholary.knowledge.pipeline.PipelineResult;
import java.util.Optional;

/**
 * Latest finished run per transcript.
 *
 * <p>A transcript whose content, rule set and options are unchanged gets its cached result back
 * instead of running the five stages again. Any change makes the cached run stale.
 */
public interface PipelineResultCache {

  /**
   * Find the run for this key.
   *
   * @param key the run being requested
   * @return the cached result, or empty when the transcript was never run or its last run is stale
   */
  Optional<PipelineResult> lookup(RunKey key);

  /** Record a finished run, replacing any earlier run of the same transcript. */
  void store(RunKey key, PipelineResult result);
}
