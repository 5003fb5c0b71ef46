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

import java.util.function.Supplier;

/**
 * Sink for the metrics reported by the wildcard library.
 *
 * <p>The library reports under the names in {@link MetricNames}: counters for compilations,
 * cache hits and misses, evictions, matches and failures; timers for compilation and match
 * latency; one gauge for the number of cached patterns. The gauge is registered when a cache is
 * created and removed when it is reconfigured.
 *
 * <p>A single {@code isMatch} call usually takes well under a microsecond, so implementations are
 * on the matching hot path and must be cheap and thread-safe. When {@link #isEnabled()} returns
 * {@code false} matching skips the clock reads altogether.
 *
 * @since 1.0.0
 */
public interface WildcardMetricsRegistry {

    /**
     * Whether metrics are recorded at all.
     *
     * @return {@code false} to let callers skip timing work
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Increment a counter by 1.
     *
     * @param name metric name from {@link MetricNames}
     */
    default void incrementCounter(String name) {
        incrementCounter(name, 1);
    }

    /**
     * Increment a counter, e.g. {@link MetricNames#MATCHING_BULK_ITEMS} by the batch size.
     *
     * @param name metric name from {@link MetricNames}
     * @param delta non-negative amount
     */
    void incrementCounter(String name, long delta);

    /**
     * Record one latency sample.
     *
     * @param name timer name, e.g. {@link MetricNames#MATCHING_LATENCY}
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge read on demand. Replaces any gauge of the same name.
     *
     * @param name gauge name, in practice {@link MetricNames#CACHE_PATTERNS}
     * @param valueSupplier non-blocking supplier of the current value
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a gauge. No-op if absent.
     *
     * @param name gauge name
     */
    void removeGauge(String name);
}
