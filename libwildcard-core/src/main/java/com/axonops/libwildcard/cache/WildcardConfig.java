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

import com.axonops.libwildcard.metrics.NoOpMetricsRegistry;
import com.axonops.libwildcard.metrics.WildcardMetricsRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the wildcard library: compiled-pattern caching and metrics.
 *
 * <p>Immutable configuration using Java 17 records.
 *
 * <h2>Pattern Cache</h2>
 *
 * <p>{@link com.axonops.libwildcard.api.WildcardPattern#compile(String)} caches compiled patterns
 * keyed by pattern text and options, so the same filter applied over and over (command names,
 * provider paths, module names) is parsed once. The cache uses two eviction strategies:
 *
 * <ol>
 *   <li><b>LRU Eviction</b> - When cache exceeds {@code maxCacheSize}, least-recently-used patterns
 *       are evicted asynchronously
 *   <li><b>Idle Eviction</b> - A background thread evicts patterns unused for {@code
 *       idleTimeoutSeconds}
 * </ol>
 *
 * <p>Compiled patterns are immutable heap objects. An evicted pattern stays valid for every
 * caller still holding it; eviction only means the next {@code compile} builds a new one.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults (10K cache, 5min idle, metrics disabled)
 * WildcardConfig config = WildcardConfig.DEFAULT;
 *
 * // Large command tables, metrics enabled
 * WildcardConfig config = WildcardConfig.builder()
 *     .maxCacheSize(50_000)
 *     .idleTimeoutSeconds(600)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.wildcard"))
 *     .build();
 *
 * // No caching: every compile() parses the pattern
 * WildcardConfig config = WildcardConfig.NO_CACHE;
 * }</pre>
 *
 * @param cacheEnabled Enable pattern caching
 * @param maxCacheSize Maximum patterns in cache before LRU eviction (must be > 0 if cache enabled)
 * @param idleTimeoutSeconds Evict patterns unused for this duration (must be > 0 if cache enabled)
 * @param evictionScanIntervalSeconds How often idle eviction task runs (must be > 0 if cache
 *     enabled)
 * @param evictionProtectionMs Protect recently used patterns from LRU eviction for this duration
 * @param metricsRegistry Metrics implementation (use {@link NoOpMetricsRegistry} for zero overhead)
 * @since 1.0.0
 * @see PatternCache
 * @see com.axonops.libwildcard.metrics.MetricNames
 */
public record WildcardConfig(
    boolean cacheEnabled,
    int maxCacheSize,
    long idleTimeoutSeconds,
    long evictionScanIntervalSeconds,
    long evictionProtectionMs,
    WildcardMetricsRegistry metricsRegistry) {

  private static final Logger logger = LoggerFactory.getLogger(WildcardConfig.class);

  /**
   * Default configuration.
   *
   * <p>Cache of 10K patterns, 5 minute idle timeout, scan every minute, 1 second eviction
   * protection, metrics disabled.
   */
  public static final WildcardConfig DEFAULT =
      new WildcardConfig(
          true, // Cache enabled
          10000, // Max 10K cached patterns
          300, // 5 minute idle timeout
          60, // Scan every 60 seconds
          1000, // 1 second eviction protection
          NoOpMetricsRegistry.INSTANCE // Metrics disabled (zero overhead)
          );

  /** Configuration with caching disabled. Every compile parses the pattern. */
  public static final WildcardConfig NO_CACHE =
      new WildcardConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Compact constructor with validation. */
  public WildcardConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");

    // Validate cache parameters only if cache enabled
    if (cacheEnabled) {
      if (maxCacheSize <= 0) {
        throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
      }
      if (idleTimeoutSeconds <= 0) {
        throw new IllegalArgumentException(
            "idleTimeoutSeconds must be positive when cache enabled");
      }
      if (evictionScanIntervalSeconds <= 0) {
        throw new IllegalArgumentException(
            "evictionScanIntervalSeconds must be positive when cache enabled");
      }
      if (evictionProtectionMs < 0) {
        throw new IllegalArgumentException(
            "evictionProtectionMs must be non-negative when cache enabled");
      }

      // Still valid, just suboptimal
      if (evictionScanIntervalSeconds > idleTimeoutSeconds) {
        logger.warn(
            "Wildcard: evictionScanIntervalSeconds ({}s) exceeds idleTimeoutSeconds ({}s) - idle patterns may not be evicted promptly",
            evictionScanIntervalSeconds,
            idleTimeoutSeconds);
      }
    }
  }

  /**
   * Creates a builder for custom configuration, starting from {@link #DEFAULT}.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom configuration. */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCacheSize = 10000;
    private long idleTimeoutSeconds = 300;
    private long evictionScanIntervalSeconds = 60;
    private long evictionProtectionMs = 1000;
    private WildcardMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Enable or disable pattern caching.
     *
     * @param enabled true to enable caching (default), false to disable
     * @return this builder
     */
    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * Set maximum number of patterns in cache before LRU eviction.
     *
     * <p><b>Default: 10,000</b>
     *
     * @param size maximum cached patterns (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * Set idle timeout for pattern eviction.
     *
     * <p><b>Default: 300 seconds (5 minutes)</b>
     *
     * @param seconds idle timeout in seconds (must be > 0)
     * @return this builder
     */
    public Builder idleTimeoutSeconds(long seconds) {
      this.idleTimeoutSeconds = seconds;
      return this;
    }

    /**
     * Set how often idle eviction task runs.
     *
     * <p><b>Default: 60 seconds</b>. Should be ≤ {@code idleTimeoutSeconds}.
     *
     * @param seconds scan interval in seconds (must be > 0)
     * @return this builder
     */
    public Builder evictionScanIntervalSeconds(long seconds) {
      this.evictionScanIntervalSeconds = seconds;
      return this;
    }

    /**
     * Set how long a recently used pattern is protected from LRU eviction.
     *
     * <p><b>Default: 1000 ms</b>
     *
     * @param millis protection window in milliseconds (must be ≥ 0)
     * @return this builder
     */
    public Builder evictionProtectionMs(long millis) {
      this.evictionProtectionMs = millis;
      return this;
    }

    /**
     * Set the metrics implementation.
     *
     * @param registry metrics registry (not null)
     * @return this builder
     */
    public Builder metricsRegistry(WildcardMetricsRegistry registry) {
      this.metricsRegistry = Objects.requireNonNull(registry, "registry cannot be null");
      return this;
    }

    public WildcardConfig build() {
      return new WildcardConfig(
          cacheEnabled,
          maxCacheSize,
          idleTimeoutSeconds,
          evictionScanIntervalSeconds,
          evictionProtectionMs,
          metricsRegistry);
    }
  }
}
