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

package com.axonops.libwildcard.metrics;

/**
 * Metric name constants for wildcard library instrumentation.
 *
 * <h2>Categories</h2>
 *
 * <ul>
 *   <li><b>Pattern Compilation</b> - compilations, latency, cache hits and misses
 *   <li><b>Cache</b> - current size and evictions (LRU and idle)
 *   <li><b>Matching</b> - single and bulk match operations and their latency. Matching is
 *       linear in pattern length times input length, so latency tracks input size
 *   <li><b>Errors</b> - malformed patterns and failed format conversions
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.*})
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * WildcardPattern.configureCache(WildcardConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.wildcard"))
 *     .build());
 *
 * WildcardPattern.compile("Get-*", WildcardOption.IGNORE_CASE).isMatch("get-item");
 *
 * registry.counter("myapp.wildcard.patterns.compiled.total.count").getCount(); // 1
 * }</pre>
 *
 * @since 1.0.0
 */
public final class MetricNames {

  private MetricNames() {
    // Constants class
  }

  // ========================================
  // Pattern Compilation
  // ========================================

  /**
   * Total patterns compiled (cache misses and uncached compilations).
   *
   * <p>Type: Counter
   */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /**
   * Compilation latency (parse and element construction).
   *
   * <p>Type: Timer (nanoseconds)
   */
  public static final String PATTERNS_COMPILATION_LATENCY = "patterns.compilation.latency";

  /**
   * Total cache hits (pattern found in cache, no compilation).
   *
   * <p>Type: Counter
   */
  public static final String PATTERNS_CACHE_HITS = "patterns.cache.hits.total.count";

  /**
   * Total cache misses (pattern compiled and stored).
   *
   * <p>Type: Counter
   */
  public static final String PATTERNS_CACHE_MISSES = "patterns.cache.misses.total.count";

  /**
   * Total times the shared match-all pattern for {@code "*"} was returned without touching
   * the cache.
   *
   * <p>Type: Counter
   */
  public static final String PATTERNS_MATCH_ALL_SHORTCUTS = "patterns.match_all.shortcuts.total.count";

  // ========================================
  // Cache
  // ========================================

  /**
   * Number of compiled patterns currently cached.
   *
   * <p>Type: Gauge
   */
  public static final String CACHE_PATTERNS = "cache.patterns.current.count";

  /**
   * Total LRU evictions (cache exceeded maxCacheSize).
   *
   * <p>Type: Counter
   */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  /**
   * Total idle evictions (pattern unused for idleTimeoutSeconds).
   *
   * <p>Type: Counter
   */
  public static final String CACHE_EVICTIONS_IDLE = "cache.evictions.idle.total.count";

  // ========================================
  // Matching
  // ========================================

  /**
   * Total match operations, counting each input of a bulk call.
   *
   * <p>Type: Counter
   */
  public static final String MATCHING_OPERATIONS = "matching.operations.total.count";

  /**
   * Per-input matching latency. Bulk calls record the average per input.
   *
   * <p>Type: Timer (nanoseconds)
   */
  public static final String MATCHING_LATENCY = "matching.latency";

  /**
   * Total bulk calls ({@code matchAll}, {@code filter}).
   *
   * <p>Type: Counter
   */
  public static final String MATCHING_BULK_OPERATIONS = "matching.bulk.operations.total.count";

  /**
   * Total inputs processed by bulk calls.
   *
   * <p>Type: Counter
   */
  public static final String MATCHING_BULK_ITEMS = "matching.bulk.items.total.count";

  /**
   * Per-input latency of bulk calls.
   *
   * <p>Type: Timer (nanoseconds)
   */
  public static final String MATCHING_BULK_LATENCY = "matching.bulk.latency";

  // ========================================
  // Errors
  // ========================================

  /**
   * Total malformed patterns rejected at compile time.
   *
   * <p>Type: Counter
   */
  public static final String ERRORS_COMPILATION_FAILED = "errors.compilation.failed.total.count";

  /**
   * Total conversions rejected because the target format cannot express the pattern.
   *
   * <p>Type: Counter
   */
  public static final String ERRORS_CONVERSION_FAILED = "errors.conversion.failed.total.count";
}
