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
 * Registry used by {@link com.axonops.libwildcard.cache.WildcardConfig#DEFAULT}: records nothing
 * and reports itself disabled, so {@code isMatch} and {@code matchAll} never read the clock.
 *
 * @since 1.0.0
 */
public final class NoOpMetricsRegistry implements WildcardMetricsRegistry {

    public static final NoOpMetricsRegistry INSTANCE = new NoOpMetricsRegistry();

    private NoOpMetricsRegistry() {
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void incrementCounter(String name, long delta) {
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
    }

    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
    }

    @Override
    public void removeGauge(String name) {
    }

    @Override
    public String toString() {
        return "NoOpMetricsRegistry";
    }
}
