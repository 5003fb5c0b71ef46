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
import com.axonops.libwildcard.test.TestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.*;

/**
 * Idle eviction, driven directly through the package-private scan. The background scan
 * interval is long enough never to fire during a test.
 */
class IdleEvictionTest {

    private PatternCache cache;

    @BeforeEach
    void setup() {
        cache = new PatternCache(TestUtils.testConfigBuilder()
            .idleTimeoutSeconds(1)
            .evictionScanIntervalSeconds(3600)
            .build());
    }

    @AfterEach
    void cleanup() {
        cache.shutdown();
    }

    private WildcardPattern compile(String pattern) {
        return cache.getOrCompile(pattern, EnumSet.noneOf(WildcardOption.class),
            () -> WildcardPattern.compileWithoutCache(pattern));
    }

    @Test
    void testFreshPatternsAreKept() {
        compile("fresh*");

        assertThat(cache.evictIdlePatterns()).isZero();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void testIdlePatternsAreEvicted() throws InterruptedException {
        WildcardPattern idle = compile("idle*");
        Thread.sleep(1100);
        compile("recent*");

        assertThat(cache.evictIdlePatterns()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.getStatistics().evictionsIdle()).isEqualTo(1);

        // Evicted instance stays usable
        assertThat(idle.isMatch("idle-one")).isTrue();
    }

    @Test
    void testCacheHitRefreshesAccessTime() throws InterruptedException {
        compile("touched*");
        Thread.sleep(600);
        compile("touched*");
        Thread.sleep(600);

        assertThat(cache.evictIdlePatterns()).isZero();
    }

    @Test
    void testBackgroundThreadLifecycle() {
        assertThat(cache.isEvictionRunning()).isTrue();

        cache.shutdown();

        assertThat(cache.isEvictionRunning()).isFalse();
    }

    @Test
    void testNoCacheHasNoBackgroundThread() {
        PatternCache disabled = new PatternCache(WildcardConfig.NO_CACHE);
        try {
            assertThat(disabled.isEvictionRunning()).isFalse();
            assertThat(disabled.evictIdlePatterns()).isZero();
        } finally {
            disabled.shutdown();
        }
    }
}
