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
import org.junit.jupiter.api.Timeout;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Concurrent compilation and matching through the shared cache.
 */
class ThreadSafetyTest {

    private PatternCache originalCache;

    @BeforeEach
    void setUp() {
        originalCache = TestUtils.replaceGlobalCache(TestUtils.testConfigBuilder().build());
    }

    @AfterEach
    void tearDown() {
        TestUtils.restoreGlobalCache(originalCache);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentCompileOfSameKeyYieldsOneInstance() throws InterruptedException {
        int threadCount = 50;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        Set<WildcardPattern> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger errors = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    start.await();
                    seen.add(WildcardPattern.compile("shared-*", WildcardOption.IGNORE_CASE));
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isZero();
        assertThat(seen).hasSize(1);
        assertThat(WildcardPattern.getCacheStatistics().currentSize()).isEqualTo(1);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentStatisticsAreAccurate() throws InterruptedException {
        int threadCount = 100;
        int opsPerThread = 100;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int j = 0; j < opsPerThread; j++) {
                        WildcardPattern.compile("pattern" + (j % 10) + "*");
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isZero();

        // No lost increments
        CacheStatistics stats = WildcardPattern.getCacheStatistics();
        assertThat(stats.totalRequests()).isEqualTo(threadCount * opsPerThread);
        assertThat(stats.currentSize()).isEqualTo(10);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testSharedPatternMatchesConsistentlyAcrossThreads() throws InterruptedException {
        WildcardPattern pattern = WildcardPattern.compile("*a*b*c*");
        int threadCount = 32;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger wrong = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            int threadId = i;
            new Thread(() -> {
                try {
                    start.await();
                    for (int j = 0; j < 1000; j++) {
                        String matching = "x" + threadId + "a" + j + "b" + "c";
                        String failing = "c" + j + "b" + threadId + "a";
                        if (!pattern.isMatch(matching) || pattern.isMatch(failing)) {
                            wrong.incrementAndGet();
                        }
                    }
                } catch (Exception e) {
                    wrong.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(wrong.get()).isZero();
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testCompileSurvivesConcurrentReconfigure() throws InterruptedException {
        PatternCache cache = new PatternCache(TestUtils.testConfigBuilder().maxCacheSize(1).build());
        WildcardConfig tiny = TestUtils.testConfigBuilder().maxCacheSize(1).evictionProtectionMs(0).build();
        int threadCount = 8;
        AtomicBoolean stop = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);
        AtomicInteger compiled = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            int threadId = i;
            new Thread(() -> {
                try {
                    int j = 0;
                    while (!stop.get()) {
                        String pattern = "t" + threadId + "_" + j++ + "*";
                        WildcardPattern result = cache.getOrCompile(pattern, Set.of(),
                            () -> WildcardPattern.compileWithoutCache(pattern));
                        if (!result.isMatch(pattern.substring(0, pattern.length() - 1) + "x")) {
                            errors.incrementAndGet();
                        }
                        compiled.incrementAndGet();
                    }
                } catch (RuntimeException e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        try {
            for (int round = 0; round < 200; round++) {
                cache.reconfigure(round % 2 == 0 ? WildcardConfig.NO_CACHE : tiny);
            }
        } finally {
            stop.set(true);
            done.await();
            cache.shutdown();
        }

        assertThat(errors.get()).isZero();
        assertThat(compiled.get()).isPositive();
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testBurstOfMissesQueuesAtMostOneEviction() throws InterruptedException {
        // Every entry stays protected, so eviction tasks find nothing to remove
        PatternCache cache = new PatternCache(
            TestUtils.testConfigBuilder().maxCacheSize(10).evictionProtectionMs(600_000).build());
        int threadCount = 8;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);
        AtomicInteger maxQueued = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            int threadId = i;
            new Thread(() -> {
                try {
                    start.await();
                    for (int j = 0; j < 500; j++) {
                        String pattern = "burst" + threadId + "_" + j + "?";
                        cache.getOrCompile(pattern, Set.of(), () -> WildcardPattern.compileWithoutCache(pattern));
                        maxQueued.accumulateAndGet(cache.queuedLRUEvictions(), Math::max);
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        try {
            start.countDown();
            done.await();

            assertThat(errors.get()).isZero();
            assertThat(cache.size()).isEqualTo(threadCount * 500);
            assertThat(maxQueued.get()).isLessThanOrEqualTo(1);
            assertThat(cache.queuedLRUEvictions()).isLessThanOrEqualTo(1);
            assertThat(cache.getStatistics().evictionsLRU()).isZero();
        } finally {
            cache.shutdown();
        }
    }
}
