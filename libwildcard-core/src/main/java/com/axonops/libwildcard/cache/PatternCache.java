/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libwildcard.cache;

import com.axonops.libwildcard.api.WildcardOption;
import com.axonops.libwildcard.api.WildcardPattern;
import com.axonops.libwildcard.metrics.MetricNames;
import com.axonops.libwildcard.metrics.WildcardMetricsRegistry;
import com.axonops.libwildcard.util.PatternHasher;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe cache of compiled wildcard patterns with dual eviction.
 *
 * <p>Eviction strategies: 1. LRU (soft limit): when the cache exceeds max size, least recently
 * used entries are evicted asynchronously 2. Idle time: a background thread evicts entries idle
 * beyond the timeout
 *
 * <p>Compiled patterns are immutable, so an evicted entry is simply dropped; callers still holding
 * it keep using it.
 *
 * @since 1.0.0
 */
public final class PatternCache {
  private static final Logger logger = LoggerFactory.getLogger(PatternCache.class);

  private static final int LRU_SAMPLE_SIZE = 500;

  // Config, map and background workers are swapped together by reconfigure
  private volatile CacheState state;

  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictionsLRU = new AtomicLong(0);
  private final AtomicLong evictionsIdle = new AtomicLong(0);

  /**
   * Creates a new pattern cache with the given configuration.
   *
   * @param config the cache configuration
   */
  public PatternCache(WildcardConfig config) {
    CacheState created = initialize(config);
    this.state = created;
    created.start();
  }

  public WildcardConfig getConfig() {
    return state.config();
  }

  private CacheState initialize(WildcardConfig config) {
    if (!config.cacheEnabled()) {
      logger.info("Wildcard: Pattern caching disabled");
      return new CacheState(config, null, null, null);
    }

    ThreadPoolExecutor lruEvictionExecutor =
        new ThreadPoolExecutor(
            1,
            1,
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            r -> {
              Thread t = new Thread(r, "Wildcard-LRU-Eviction");
              t.setDaemon(true);
              t.setPriority(Thread.MIN_PRIORITY);
              return t;
            });
    CacheState created =
        new CacheState(
            config,
            new ConcurrentHashMap<>(Math.min(config.maxCacheSize(), 1024)),
            lruEvictionExecutor,
            new IdleEvictionTask(this, config));

    logger.debug(
        "Wildcard: Pattern cache initialized - maxSize: {}, idleTimeout: {}s, scanInterval: {}s",
        config.maxCacheSize(),
        config.idleTimeoutSeconds(),
        config.evictionScanIntervalSeconds());

    config.metricsRegistry().registerGauge(MetricNames.CACHE_PATTERNS, this::size);
    return created;
  }

  /**
   * Gets or compiles a pattern.
   *
   * <p>Lock-free for cache hits. Uses computeIfAbsent so only one thread compiles each key. A
   * concurrent {@link #reconfigure} never fails the call; the caller finishes against the state it
   * started with.
   *
   * @param patternString wildcard pattern
   * @param options matching options, part of the cache key
   * @param compiler function to compile the pattern on a cache miss
   * @return cached or newly compiled pattern
   */
  public WildcardPattern getOrCompile(
      String patternString, Set<WildcardOption> options, Supplier<WildcardPattern> compiler) {
    CacheState current = state;
    WildcardMetricsRegistry metrics = current.config().metricsRegistry();

    if (current.patterns() == null) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
      return compiler.get();
    }

    CacheKey key = new CacheKey(patternString, Set.copyOf(options));

    CachedPattern cached = current.patterns().get(key);
    if (cached != null) {
      cached.touch();
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_HITS);
      logger.trace("Wildcard: Cache hit - hash: {}", PatternHasher.hash(patternString));
      return cached.pattern();
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
    logger.trace("Wildcard: Cache miss - hash: {}, compiling", PatternHasher.hash(patternString));

    // A failing compiler throws out of computeIfAbsent and leaves no entry behind
    CachedPattern newCached =
        current.patterns().computeIfAbsent(key, k -> new CachedPattern(compiler.get()));

    // Soft limit: trigger eviction if over, but don't block
    if (current.patterns().size() > current.config().maxCacheSize()) {
      triggerAsyncLRUEviction(current);
    }

    return newCached.pattern();
  }

  /** At most one eviction is queued or running per cache state. */
  private void triggerAsyncLRUEviction(CacheState current) {
    if (!current.evictionScheduled().compareAndSet(false, true)) {
      return;
    }

    try {
      current
          .lruEvictionExecutor()
          .execute(
              () -> {
                try {
                  evictLRUBatch(current);
                } catch (RuntimeException e) {
                  logger.warn("Wildcard: Error during async LRU eviction", e);
                } finally {
                  current.evictionScheduled().set(false);
                }
              });
    } catch (RejectedExecutionException e) {
      // Executor shut down by reconfigure or shutdown; that state's map is being discarded
      current.evictionScheduled().set(false);
      logger.debug("Wildcard: LRU eviction skipped, cache is shutting down");
    }
  }

  /**
   * Evicts least-recently-used patterns until the cache is back under its limit.
   *
   * <p>Sample-based: sorts a bounded sample of entries older than the eviction protection window
   * and removes the oldest.
   */
  private void evictLRUBatch(CacheState current) {
    ConcurrentHashMap<CacheKey, CachedPattern> patterns = current.patterns();
    WildcardConfig config = current.config();
    int toEvict = patterns.size() - config.maxCacheSize();
    if (toEvict <= 0) {
      return;
    }

    int sampleSize = Math.min(LRU_SAMPLE_SIZE, patterns.size());
    long cutoffTime = System.nanoTime() - config.evictionProtectionMs() * 1_000_000L;

    List<Map.Entry<CacheKey, CachedPattern>> candidates =
        patterns.entrySet().stream()
            .filter(e -> e.getValue().lastAccessTimeNanos() < cutoffTime)
            .limit(sampleSize)
            .sorted(Comparator.comparingLong(e -> e.getValue().lastAccessTimeNanos()))
            .limit(toEvict)
            .collect(Collectors.toList());

    int evicted = 0;
    for (Map.Entry<CacheKey, CachedPattern> entry : candidates) {
      if (patterns.remove(entry.getKey(), entry.getValue())) {
        evictionsLRU.incrementAndGet();
        config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_LRU);
        logger.trace("Wildcard: LRU evicting pattern: {}", entry.getKey());
        evicted++;
      }
    }

    if (evicted > 0) {
      logger.debug(
          "Wildcard: LRU eviction completed - evicted: {}, cacheSize: {}/{}",
          evicted,
          patterns.size(),
          config.maxCacheSize());
    }
  }

  /**
   * Evicts idle patterns (called by background thread).
   *
   * @return number of patterns evicted
   */
  int evictIdlePatterns() {
    CacheState current = state;
    ConcurrentHashMap<CacheKey, CachedPattern> patterns = current.patterns();
    if (patterns == null) {
      return 0;
    }

    WildcardConfig config = current.config();
    long cutoffNanos = System.nanoTime() - config.idleTimeoutSeconds() * 1_000_000_000L;
    AtomicLong evictedCount = new AtomicLong(0);

    patterns
        .entrySet()
        .removeIf(
            entry -> {
              if (entry.getValue().lastAccessTimeNanos() < cutoffNanos) {
                logger.trace("Wildcard: Idle evicting pattern: {}", entry.getKey());
                evictionsIdle.incrementAndGet();
                config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_IDLE);
                evictedCount.incrementAndGet();
                return true;
              }
              return false;
            });

    int evicted = (int) evictedCount.get();
    if (evicted > 0) {
      logger.debug(
          "Wildcard: Idle eviction completed - evicted: {}, cacheSize: {}",
          evicted,
          patterns.size());
    }
    return evicted;
  }

  /** Current number of cached patterns (0 when caching is disabled). */
  public int size() {
    ConcurrentHashMap<CacheKey, CachedPattern> patterns = state.patterns();
    return patterns != null ? patterns.size() : 0;
  }

  /** Gets cache statistics snapshot. */
  public CacheStatistics getStatistics() {
    CacheState current = state;
    ConcurrentHashMap<CacheKey, CachedPattern> patterns = current.patterns();
    return new CacheStatistics(
        hits.get(),
        misses.get(),
        evictionsLRU.get(),
        evictionsIdle.get(),
        patterns != null ? patterns.size() : 0,
        current.config().maxCacheSize());
  }

  /** Removes every cached pattern. Statistics are kept. */
  public void clear() {
    clear(state);
  }

  private static void clear(CacheState current) {
    ConcurrentHashMap<CacheKey, CachedPattern> patterns = current.patterns();
    if (patterns == null) {
      return;
    }
    logger.debug("Wildcard: Clearing cache - {} cached patterns", patterns.size());
    patterns.clear();
  }

  /** Resets cache statistics (for testing only). */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictionsLRU.set(0);
    evictionsIdle.set(0);
    logger.trace("Wildcard: Cache statistics reset");
  }

  /** Full reset for testing (clears cache and resets statistics). */
  public void reset() {
    clear();
    resetStatistics();
  }

  /**
   * Reconfigures the cache with new settings.
   *
   * <p>Stops the background eviction, drops every cached pattern and statistic, then starts over
   * with {@code newConfig}. Calls to {@link #getOrCompile} racing with this method complete
   * normally against whichever state they observed.
   *
   * @param newConfig the new configuration
   */
  public synchronized void reconfigure(WildcardConfig newConfig) {
    logger.info("Wildcard: Reconfiguring cache with new settings");
    CacheState old = state;
    stopBackgroundEviction(old);
    clear(old);
    resetStatistics();
    old.config().metricsRegistry().removeGauge(MetricNames.CACHE_PATTERNS);

    CacheState created = initialize(newConfig);
    this.state = created;
    created.start();
  }

  /** Shuts down the cache (stops eviction thread, clears cache). */
  public synchronized void shutdown() {
    logger.info("Wildcard: Shutting down cache");
    CacheState current = state;
    stopBackgroundEviction(current);
    clear(current);
  }

  /** Whether the idle eviction thread is alive. */
  boolean isEvictionRunning() {
    IdleEvictionTask task = state.evictionTask();
    return task != null && task.isRunning();
  }

  /** LRU eviction tasks waiting for the eviction thread. */
  int queuedLRUEvictions() {
    ThreadPoolExecutor executor = state.lruEvictionExecutor();
    return executor != null ? executor.getQueue().size() : 0;
  }

  private static void stopBackgroundEviction(CacheState current) {
    if (current.evictionTask() != null) {
      current.evictionTask().stop();
    }
    if (current.lruEvictionExecutor() != null) {
      current.lruEvictionExecutor().shutdown();
    }
  }

  /**
   * Everything a cache operation reads, published as one volatile reference. The map, executor
   * and idle task are null when caching is disabled.
   */
  private record CacheState(
      WildcardConfig config,
      ConcurrentHashMap<CacheKey, CachedPattern> patterns,
      ThreadPoolExecutor lruEvictionExecutor,
      IdleEvictionTask evictionTask,
      AtomicBoolean evictionScheduled) {

    CacheState(
        WildcardConfig config,
        ConcurrentHashMap<CacheKey, CachedPattern> patterns,
        ThreadPoolExecutor lruEvictionExecutor,
        IdleEvictionTask evictionTask) {
      this(config, patterns, lruEvictionExecutor, evictionTask, new AtomicBoolean(false));
    }

    void start() {
      if (evictionTask != null) {
        evictionTask.start();
      }
    }
  }

  /** Cache key combining pattern text and options. */
  private record CacheKey(String pattern, Set<WildcardOption> options) {
    @Override
    public String toString() {
      return PatternHasher.hash(pattern) + " " + options;
    }
  }

  /** Cached pattern with atomic access time tracking. */
  private static final class CachedPattern {
    private final WildcardPattern pattern;
    private final AtomicLong lastAccessTimeNanos;

    CachedPattern(WildcardPattern pattern) {
      this.pattern = pattern;
      this.lastAccessTimeNanos = new AtomicLong(System.nanoTime());
    }

    WildcardPattern pattern() {
      return pattern;
    }

    long lastAccessTimeNanos() {
      return lastAccessTimeNanos.get();
    }

    void touch() {
      lastAccessTimeNanos.set(System.nanoTime());
    }
  }
}
