package com.reasonai.infrastructure.pipeline.stage;

import com.reasonai.domain.reasoning.model.StageOutput;
import com.reasonai.infrastructure.cache.Cache;
import com.reasonai.infrastructure.cache.CacheKeyBuilder;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Services every stage shares.
 *
 * @param executor        runs collaborator calls so stages can wait on them with a deadline
 * @param cache           stage output cache (nullable: no caching)
 * @param cacheKeyBuilder builds namespaced stage cache keys
 * @param cacheTtl        time-to-live of cached outputs (nullable: never expire)
 */
public record StageRuntime(Executor executor,
                           Cache<StageOutput> cache,
                           CacheKeyBuilder cacheKeyBuilder,
                           Duration cacheTtl) {}
