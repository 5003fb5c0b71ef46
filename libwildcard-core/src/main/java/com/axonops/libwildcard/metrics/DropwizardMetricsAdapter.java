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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Publishes wildcard metrics into a Dropwizard {@link MetricRegistry}.
 *
 * <p>Every name from {@link MetricNames} is registered under {@code <prefix>.<name>}. With the
 * default prefix the registry ends up holding:
 * <pre>
 * com.axonops.libwildcard.patterns.compiled.total.count        Counter
 * com.axonops.libwildcard.patterns.compilation.latency         Timer
 * com.axonops.libwildcard.patterns.cache.hits.total.count      Counter
 * com.axonops.libwildcard.patterns.cache.misses.total.count    Counter
 * com.axonops.libwildcard.patterns.match_all.shortcuts.total.count  Counter
 * com.axonops.libwildcard.cache.patterns.current.count         Gauge
 * com.axonops.libwildcard.cache.evictions.lru.total.count      Counter
 * com.axonops.libwildcard.cache.evictions.idle.total.count     Counter
 * com.axonops.libwildcard.matching.operations.total.count      Counter
 * com.axonops.libwildcard.matching.latency                     Timer
 * com.axonops.libwildcard.matching.bulk.operations.total.count Counter
 * com.axonops.libwildcard.matching.bulk.items.total.count      Counter
 * com.axonops.libwildcard.matching.bulk.latency                Timer
 * com.axonops.libwildcard.errors.compilation.failed.total.count Counter
 * com.axonops.libwildcard.errors.conversion.failed.total.count Counter
 * </pre>
 * Counters and timers appear on first use; the gauge appears when the cache is created.
 *
 * <pre>{@code
 * WildcardPattern.configureCache(WildcardConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "com.myapp.wildcard"))
 *     .build());
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements WildcardMetricsRegistry {

    public static final String DEFAULT_PREFIX = "com.axonops.libwildcard";

    private final MetricRegistry registry;
    private final String prefix;

    // isMatch reports on every call; avoid rebuilding the dotted name each time
    private final Map<String, String> fullNames = new ConcurrentHashMap<>();

    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates an adapter publishing under a custom prefix.
     *
     * @param registry registry to publish into
     * @param prefix non-blank prefix prepended to every metric name
     * @throws NullPointerException if registry or prefix is null
     * @throws IllegalArgumentException if prefix is blank
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
        if (prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be blank");
        }
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(fullName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(fullName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        String fullName = fullName(name);
        // A reconfigured cache registers its gauge again
        registry.remove(fullName);
        registry.register(fullName, (Gauge<Number>) valueSupplier::get);
    }

    @Override
    public void removeGauge(String name) {
        registry.remove(fullName(name));
    }

    /**
     * Name under which {@code name} is published.
     *
     * @param name metric name from {@link MetricNames}
     * @return prefixed name
     */
    public String fullName(String name) {
        return fullNames.computeIfAbsent(name, n -> MetricRegistry.name(prefix, n));
    }

    @Override
    public String toString() {
        return "DropwizardMetricsAdapter{prefix='" + prefix + "'}";
    }
}
