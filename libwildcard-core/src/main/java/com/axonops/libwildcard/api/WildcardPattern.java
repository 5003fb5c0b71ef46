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

package com.axonops.libwildcard.api;

import com.axonops.libwildcard.cache.CacheStatistics;
import com.axonops.libwildcard.cache.PatternCache;
import com.axonops.libwildcard.cache.WildcardConfig;
import com.axonops.libwildcard.engine.WildcardPatternMatcher;
import com.axonops.libwildcard.metrics.MetricNames;
import com.axonops.libwildcard.metrics.WildcardMetricsRegistry;
import com.axonops.libwildcard.parser.WildcardPatternParser;
import com.axonops.libwildcard.parser.WildcardPatternToDosWildcardParser;
import com.axonops.libwildcard.parser.WildcardPatternToRegexParser;
import com.axonops.libwildcard.parser.WildcardPatternToWqlParser;
import com.axonops.libwildcard.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A compiled wildcard pattern.
 *
 * <p>Wildcard syntax: {@code *} matches any sequence of characters, {@code ?} matches one
 * character, {@code [abc]} and {@code [a-z]} match one character from a set, and the backtick
 * {@code `} escapes the character after it. A pattern always matches the whole input.
 *
 * <pre>{@code
 * WildcardPattern pattern = WildcardPattern.compile("Get-*", WildcardOption.IGNORE_CASE);
 * pattern.isMatch("get-childitem");   // true
 * pattern.isMatch("Set-Item");        // false
 *
 * WildcardPattern.escape("file[1].txt"); // "file`[1`].txt"
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe. Matching never backtracks: time is bounded by
 * pattern length times input length whatever the pattern.
 *
 * @since 1.0.0
 */
public final class WildcardPattern {
    private static final Logger logger = LoggerFactory.getLogger(WildcardPattern.class);

    private static final Set<WildcardOption> NO_OPTIONS = Collections.unmodifiableSet(EnumSet.noneOf(WildcardOption.class));

    private static final String MATCH_ALL_PATTERN = "*";

    private static final WildcardPattern MATCH_ALL = new WildcardPattern(MATCH_ALL_PATTERN, NO_OPTIONS, input -> true);

    // Global pattern cache (mutable for testing only)
    private static volatile PatternCache cache = new PatternCache(WildcardConfig.DEFAULT);

    /**
     * Gets the global pattern cache (for internal use).
     */
    public static PatternCache getGlobalCache() {
        return cache;
    }

    private final String patternString;
    private final Set<WildcardOption> options;
    private final Predicate<String> predicate;

    private WildcardPattern(String patternString, Set<WildcardOption> options, Predicate<String> predicate) {
        this.patternString = patternString;
        this.options = options;
        this.predicate = predicate;
    }

    public static WildcardPattern compile(String pattern) {
        return compile(pattern, NO_OPTIONS);
    }

    public static WildcardPattern compile(String pattern, WildcardOption... options) {
        Objects.requireNonNull(options, "options cannot be null");
        return compile(pattern, toOptionSet(Arrays.asList(options)));
    }

    /**
     * Compiles a pattern, returning a cached instance when the same pattern and options were
     * compiled before.
     *
     * <p>The pattern {@code "*"} always returns one shared instance (with no options) whatever
     * {@code options} holds.
     *
     * @param pattern wildcard pattern
     * @param options matching options
     * @return compiled pattern
     * @throws WildcardPatternException if the pattern is malformed
     */
    public static WildcardPattern compile(String pattern, Set<WildcardOption> options) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(options, "options cannot be null");

        PatternCache current = cache;
        if (MATCH_ALL_PATTERN.equals(pattern)) {
            current.getConfig().metricsRegistry().incrementCounter(MetricNames.PATTERNS_MATCH_ALL_SHORTCUTS);
            return MATCH_ALL;
        }

        Set<WildcardOption> optionSet = toOptionSet(options);
        return current.getOrCompile(pattern, optionSet, () -> doCompile(pattern, optionSet));
    }

    /**
     * Compiles a pattern without using the cache (for testing/special cases).
     *
     * @param pattern wildcard pattern
     * @param options matching options
     * @return a new pattern instance
     * @throws WildcardPatternException if the pattern is malformed
     */
    public static WildcardPattern compileWithoutCache(String pattern, Set<WildcardOption> options) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        return doCompile(pattern, toOptionSet(options));
    }

    public static WildcardPattern compileWithoutCache(String pattern, WildcardOption... options) {
        Objects.requireNonNull(options, "options cannot be null");
        return compileWithoutCache(pattern, toOptionSet(Arrays.asList(options)));
    }

    /**
     * Actual compilation logic.
     */
    private static WildcardPattern doCompile(String pattern, Set<WildcardOption> options) {
        WildcardMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        long startNanos = System.nanoTime();

        Predicate<String> predicate;
        if (MATCH_ALL_PATTERN.equals(pattern)) {
            predicate = input -> true;
        } else {
            try {
                predicate = WildcardPatternMatcher.compile(pattern, options)::isMatch;
            } catch (WildcardPatternException e) {
                metrics.incrementCounter(MetricNames.ERRORS_COMPILATION_FAILED);
                logger.debug("Wildcard: Pattern compilation failed - hash: {}, error: {}",
                    PatternHasher.hash(pattern), e.getMessage());
                throw e;
            }
        }

        long durationNanos = System.nanoTime() - startNanos;
        metrics.recordTimer(MetricNames.PATTERNS_COMPILATION_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.PATTERNS_COMPILED);

        if (logger.isTraceEnabled()) {
            logger.trace("Wildcard: Pattern compiled - {}, timeNs: {}",
                PatternHasher.describe(pattern, options), durationNanos);
        }

        return new WildcardPattern(pattern, options, predicate);
    }

    private static Set<WildcardOption> toOptionSet(Collection<WildcardOption> options) {
        if (options.isEmpty()) {
            return NO_OPTIONS;
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(options));
    }

    /**
     * Tests whether {@code input} matches this pattern.
     *
     * @param input string to test; {@code null} never matches
     * @return true if the whole input matches
     */
    public boolean isMatch(String input) {
        if (input == null) {
            return false;
        }

        WildcardMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        if (!metrics.isEnabled()) {
            return predicate.test(input);
        }

        long startNanos = System.nanoTime();
        boolean result = predicate.test(input);
        long durationNanos = System.nanoTime() - startNanos;

        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
        metrics.recordTimer(MetricNames.MATCHING_LATENCY, durationNanos);

        return result;
    }

    /**
     * Matches multiple inputs.
     *
     * <p><b>Example - Select cmdlet names:</b>
     * <pre>{@code
     * WildcardPattern pattern = WildcardPattern.compile("Get-*");
     * boolean[] results = pattern.matchAll(List.of("Get-Item", "Set-Item", "Get-Date"));
     * // results = [true, false, true]
     * }</pre>
     *
     * @param inputs collection of strings to match
     * @return boolean array parallel to inputs (same size and iteration order)
     * @throws NullPointerException if inputs is null
     * @see #filter(Collection) to extract only matching elements
     */
    public boolean[] matchAll(Collection<String> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        if (inputs.isEmpty()) {
            return new boolean[0];
        }

        try {
            return matchAll(inputs.toArray(new String[0]));
        } catch (ArrayStoreException e) {
            throw new IllegalArgumentException(
                "Collection contains non-String elements. Convert them first: " +
                "collection.stream().map(Object::toString).toList()", e);
        }
    }

    /**
     * Matches multiple inputs (array variant). A {@code null} element never matches.
     *
     * @param inputs array of strings to match
     * @return boolean array parallel to inputs
     * @throws NullPointerException if inputs is null
     */
    public boolean[] matchAll(String[] inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        if (inputs.length == 0) {
            return new boolean[0];
        }

        WildcardMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        long startNanos = metrics.isEnabled() ? System.nanoTime() : 0L;
        boolean[] results = new boolean[inputs.length];
        for (int i = 0; i < inputs.length; i++) {
            results[i] = inputs[i] != null && predicate.test(inputs[i]);
        }
        if (!metrics.isEnabled()) {
            return results;
        }
        long durationNanos = System.nanoTime() - startNanos;

        // Per-item latency keeps the timers comparable with single matches
        long perItemNanos = durationNanos / inputs.length;

        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS, inputs.length);
        metrics.recordTimer(MetricNames.MATCHING_LATENCY, perItemNanos);

        metrics.incrementCounter(MetricNames.MATCHING_BULK_OPERATIONS);
        metrics.incrementCounter(MetricNames.MATCHING_BULK_ITEMS, inputs.length);
        metrics.recordTimer(MetricNames.MATCHING_BULK_LATENCY, perItemNanos);

        return results;
    }

    /**
     * Filters a collection, returning only the matching elements.
     *
     * @param inputs collection to filter
     * @return new list of matching elements, in iteration order
     * @throws NullPointerException if inputs is null
     */
    public List<String> filter(Collection<String> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        if (inputs.isEmpty()) {
            return new ArrayList<>();
        }

        String[] array;
        try {
            array = inputs.toArray(new String[0]);
        } catch (ArrayStoreException e) {
            throw new IllegalArgumentException(
                "Collection contains non-String elements. Use stream().map(Object::toString).toList() to convert.", e);
        }

        boolean[] matches = matchAll(array);

        List<String> result = new ArrayList<>();
        for (int i = 0; i < array.length; i++) {
            if (matches[i]) {
                result.add(array[i]);
            }
        }
        return result;
    }

    /**
     * Renders this pattern as a regular expression string.
     *
     * <p>The rendering is anchored ({@code ^...$}); a leading {@code ^.*} and a trailing
     * {@code .*$} are dropped, and {@code "*"} renders as the empty string.
     */
    public String toRegexString() {
        return WildcardPatternToRegexParser.toRegexString(patternString, options);
    }

    /**
     * Compiles {@link #toRegexString()} into a {@link Pattern} that finds the same strings with
     * {@link java.util.regex.Matcher#find()}.
     *
     * @throws WildcardPatternException if the regex engine rejects the rendering
     */
    public Pattern toRegex() {
        return WildcardPatternToRegexParser.toRegex(patternString, options);
    }

    /**
     * Renders this pattern as a DOS wildcard. Bracket expressions become {@code ?}.
     */
    public String toDosWildcardString() {
        return WildcardPatternToDosWildcardParser.toDosWildcard(patternString);
    }

    /**
     * Renders this pattern as the operand of a WQL {@code LIKE} clause.
     *
     * @throws WildcardConversionException if the pattern has no exact {@code LIKE} equivalent
     */
    public String toWql() {
        try {
            return WildcardPatternToWqlParser.toWql(patternString);
        } catch (WildcardConversionException e) {
            cache.getConfig().metricsRegistry().incrementCounter(MetricNames.ERRORS_CONVERSION_FAILED);
            logger.debug("Wildcard: {} conversion failed - hash: {}", e.getTargetFormat(), PatternHasher.hash(patternString));
            throw e;
        }
    }

    public String pattern() {
        return patternString;
    }

    /**
     * Options this pattern was compiled with (unmodifiable).
     */
    public Set<WildcardOption> options() {
        return options;
    }

    @Override
    public String toString() {
        return "WildcardPattern{pattern='" + patternString + "', options=" + options + "}";
    }

    // ========== Escaping ==========

    private static boolean isWildcardChar(char ch) {
        return ch == '*' || ch == '?' || ch == '[' || ch == ']';
    }

    /**
     * Escapes every wildcard character ({@code * ? [ ]}) in {@code pattern}.
     *
     * <p>The backtick escape character is not itself escaped, so for text containing a
     * backtick the result does not match that text literally: {@code escape("a`b")} is
     * {@code "a`b"}, a pattern matching {@code "ab"}.
     *
     * @param pattern text to escape
     * @return escaped text
     */
    public static String escape(String pattern) {
        return escape(pattern, new char[0]);
    }

    /**
     * Escapes wildcard characters ({@code * ? [ ]}) except those in {@code charsNotToEscape}.
     *
     * @param pattern text to escape
     * @param charsNotToEscape wildcard characters to leave as they are
     * @return escaped text
     */
    public static String escape(String pattern, char[] charsNotToEscape) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(charsNotToEscape, "charsNotToEscape cannot be null");

        StringBuilder sb = new StringBuilder(pattern.length() * 2);
        for (int i = 0; i < pattern.length(); i++) {
            char ch = pattern.charAt(i);
            if (isWildcardChar(ch) && !contains(charsNotToEscape, ch)) {
                sb.append(WildcardPatternParser.ESCAPE_CHAR);
            }
            sb.append(ch);
        }
        return sb.toString();
    }

    private static boolean contains(char[] chars, char ch) {
        for (char c : chars) {
            if (c == ch) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reverses {@link #escape(String)}.
     *
     * <p>An escaped wildcard character or backtick loses its escape; any other escape sequence is
     * kept as it is, and so is a trailing lone backtick.
     *
     * @param pattern text to unescape
     * @return unescaped text
     */
    public static String unescape(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");

        StringBuilder sb = new StringBuilder(pattern.length());
        boolean prevCharWasEscapeChar = false;

        for (int i = 0; i < pattern.length(); i++) {
            char ch = pattern.charAt(i);

            if (ch == WildcardPatternParser.ESCAPE_CHAR) {
                if (prevCharWasEscapeChar) {
                    sb.append(ch);
                    prevCharWasEscapeChar = false;
                } else {
                    prevCharWasEscapeChar = true;
                }
                continue;
            }

            if (prevCharWasEscapeChar && !isWildcardChar(ch)) {
                sb.append(WildcardPatternParser.ESCAPE_CHAR);
            }
            sb.append(ch);
            prevCharWasEscapeChar = false;
        }

        if (prevCharWasEscapeChar) {
            sb.append(WildcardPatternParser.ESCAPE_CHAR);
        }
        return sb.toString();
    }

    /**
     * Checks whether {@code pattern} contains an unescaped {@code *}, {@code ?} or {@code [}.
     *
     * @param pattern text to check, may be null
     * @return false for null or empty text
     */
    public static boolean containsWildcardCharacters(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return false;
        }

        for (int index = 0; index < pattern.length(); index++) {
            char ch = pattern.charAt(index);
            if (ch == '*' || ch == '?' || ch == '[') {
                return true;
            }
            // Skip the escaped character
            if (ch == WildcardPatternParser.ESCAPE_CHAR) {
                index++;
            }
        }
        return false;
    }

    // ========== Cache Management ==========

    /**
     * Gets cache statistics (for monitoring).
     */
    public static CacheStatistics getCacheStatistics() {
        return cache.getStatistics();
    }

    /**
     * Clears the pattern cache (for testing/maintenance).
     */
    public static void clearCache() {
        cache.clear();
    }

    /**
     * Fully resets the cache including statistics (for testing only).
     */
    public static void resetCache() {
        cache.reset();
    }

    /**
     * Reconfigures the global cache with new settings. All cached patterns are dropped.
     *
     * @param config the new configuration
     */
    public static void configureCache(WildcardConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        cache.reconfigure(config);
    }

    /**
     * Sets a new global cache (for testing only).
     *
     * <p>WARNING: This replaces the entire global cache. The previous cache is not shut down.
     *
     * @param newCache the new cache to use globally
     */
    public static void setGlobalCache(PatternCache newCache) {
        cache = Objects.requireNonNull(newCache, "newCache cannot be null");
    }

    /**
     * Gets the current cache configuration.
     */
    public static WildcardConfig getCacheConfig() {
        return cache.getConfig();
    }
}
