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
import com.axonops.libwildcard.api.WildcardPatternException;
import com.axonops.libwildcard.test.TestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Compiled-pattern cache behaviour through the public API.
 */
class CacheTest {

    private PatternCache originalCache;

    @BeforeEach
    void setup() {
        originalCache = TestUtils.replaceGlobalCache(TestUtils.testConfigBuilder().build());
    }

    @AfterEach
    void cleanup() {
        TestUtils.restoreGlobalCache(originalCache);
    }

    @Test
    void testSecondCompileIsHitAndReturnsSameInstance() {
        WildcardPattern first = WildcardPattern.compile("Get-*");
        WildcardPattern second = WildcardPattern.compile("Get-*");

        assertThat(second).isSameAs(first);

        CacheStatistics stats = WildcardPattern.getCacheStatistics();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.currentSize()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);
    }

    @Test
    void testDifferentOptionsAreDifferentEntries() {
        WildcardPattern sensitive = WildcardPattern.compile("abc");
        WildcardPattern insensitive = WildcardPattern.compile("abc", WildcardOption.IGNORE_CASE);

        assertThat(insensitive).isNotSameAs(sensitive);
        assertThat(sensitive.isMatch("ABC")).isFalse();
        assertThat(insensitive.isMatch("ABC")).isTrue();
        assertThat(WildcardPattern.getCacheStatistics().currentSize()).isEqualTo(2);
    }

    @Test
    void testOptionOrderDoesNotMatter() {
        WildcardPattern a = WildcardPattern.compile("x?", WildcardOption.IGNORE_CASE, WildcardOption.CULTURE_INVARIANT);
        WildcardPattern b = WildcardPattern.compile("x?", WildcardOption.CULTURE_INVARIANT, WildcardOption.IGNORE_CASE);

        assertThat(b).isSameAs(a);
    }

    @Test
    void testMatchAllShortcutBypassesCache() {
        WildcardPattern.compile("*");

        CacheStatistics stats = WildcardPattern.getCacheStatistics();
        assertThat(stats.totalRequests()).isZero();
        assertThat(stats.currentSize()).isZero();
    }

    @Test
    void testFailedCompileIsNotCached() {
        assertThatThrownBy(() -> WildcardPattern.compile("[oops"))
            .isInstanceOf(WildcardPatternException.class);
        assertThatThrownBy(() -> WildcardPattern.compile("[oops"))
            .isInstanceOf(WildcardPatternException.class);

        CacheStatistics stats = WildcardPattern.getCacheStatistics();
        assertThat(stats.misses()).isEqualTo(2);
        assertThat(stats.currentSize()).isZero();
    }

    @Test
    void testCompileWithoutCacheReturnsNewInstance() {
        WildcardPattern cached = WildcardPattern.compile("abc*");
        WildcardPattern uncached = WildcardPattern.compileWithoutCache("abc*");

        assertThat(uncached).isNotSameAs(cached);
        assertThat(WildcardPattern.getCacheStatistics().totalRequests()).isEqualTo(1);
    }

    @Test
    void testClearAndReset() {
        WildcardPattern first = WildcardPattern.compile("p1?");
        WildcardPattern.compile("p2?");

        WildcardPattern.clearCache();
        assertThat(WildcardPattern.getCacheStatistics().currentSize()).isZero();
        assertThat(WildcardPattern.getCacheStatistics().misses()).isEqualTo(2);

        // Patterns handed out before clearing stay usable
        assertThat(first.isMatch("p1x")).isTrue();
        assertThat(WildcardPattern.compile("p1?")).isNotSameAs(first);

        WildcardPattern.resetCache();
        CacheStatistics stats = WildcardPattern.getCacheStatistics();
        assertThat(stats.totalRequests()).isZero();
        assertThat(stats.currentSize()).isZero();
    }

    @Test
    void testNoCacheCompilesEveryTime() {
        WildcardPattern.configureCache(WildcardConfig.NO_CACHE);

        WildcardPattern first = WildcardPattern.compile("abc?");
        WildcardPattern second = WildcardPattern.compile("abc?");

        assertThat(second).isNotSameAs(first);
        CacheStatistics stats = WildcardPattern.getCacheStatistics();
        assertThat(stats.misses()).isEqualTo(2);
        assertThat(stats.hits()).isZero();
        assertThat(stats.currentSize()).isZero();
        assertThat(stats.utilization()).isZero();
    }

    @Test
    void testConfigureCache() {
        WildcardPattern.compile("before*");
        WildcardConfig config = TestUtils.testConfigBuilder().maxCacheSize(42).build();

        WildcardPattern.configureCache(config);

        assertThat(WildcardPattern.getCacheConfig()).isEqualTo(config);
        CacheStatistics stats = WildcardPattern.getCacheStatistics();
        assertThat(stats.maxSize()).isEqualTo(42);
        assertThat(stats.currentSize()).isZero();
        assertThat(stats.totalRequests()).isZero();
    }

    @Test
    void testConfigureCacheCanDisableCaching() {
        PatternCache cache = WildcardPattern.getGlobalCache();
        assertThat(cache.isEvictionRunning()).isTrue();

        WildcardPattern.configureCache(WildcardConfig.NO_CACHE);

        assertThat(cache.isEvictionRunning()).isFalse();
        assertThat(WildcardPattern.compile("x*")).isNotSameAs(WildcardPattern.compile("x*"));
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void testLruEvictionKeepsCacheNearMaxSize() throws InterruptedException {
        WildcardPattern.configureCache(
            TestUtils.testConfigBuilder().maxCacheSize(10).evictionProtectionMs(0).build());

        for (int i = 0; i < 50; i++) {
            WildcardPattern.compile("lru_" + i + "_*");
        }

        // Eviction runs asynchronously
        while (WildcardPattern.getCacheStatistics().currentSize() > 10) {
            Thread.sleep(10);
        }

        CacheStatistics stats = WildcardPattern.getCacheStatistics();
        assertThat(stats.currentSize()).isLessThanOrEqualTo(10);
        assertThat(stats.evictionsLRU()).isGreaterThanOrEqualTo(40);
        assertThat(stats.evictionsIdle()).isZero();
    }

    @Test
    void testEvictionProtectionKeepsRecentPatterns() throws InterruptedException {
        WildcardPattern.configureCache(
            TestUtils.testConfigBuilder().maxCacheSize(2).evictionProtectionMs(60_000).build());

        for (int i = 0; i < 5; i++) {
            WildcardPattern.compile("protected_" + i + "?");
        }
        Thread.sleep(200);

        // Soft limit: everything is younger than the protection window
        assertThat(WildcardPattern.getCacheStatistics().currentSize()).isEqualTo(5);
        assertThat(WildcardPattern.getCacheStatistics().evictionsLRU()).isZero();
    }
}
