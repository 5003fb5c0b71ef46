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

package com.axonops.libwildcard.dropwizard;

import com.axonops.libwildcard.cache.WildcardConfig;
import com.axonops.libwildcard.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for {@link WildcardConfig} with Dropwizard Metrics integration.
 *
 * <p>Sets up the Dropwizard adapter and, unless told otherwise, a {@link JmxReporter} so the
 * wildcard metrics are visible over JMX.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Application registry, custom namespace:
 * MetricRegistry registry = getApplicationMetricRegistry();
 * WildcardPattern.configureCache(WildcardMetricsConfig.withMetrics(registry, "com.myapp.wildcard"));
 *
 * // Standalone, default namespace (com.axonops.libwildcard):
 * WildcardConfig config = WildcardMetricsConfig.withMetrics(new MetricRegistry());
 * }</pre>
 *
 * @since 1.0.0
 */
public final class WildcardMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(WildcardMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private WildcardMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a WildcardConfig with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured WildcardConfig with metrics enabled
     */
    public static WildcardConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a WildcardConfig with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to set up JMX exposure
     * @return configured WildcardConfig with metrics enabled
     */
    public static WildcardConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return WildcardConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /**
     * Creates a WildcardConfig with Dropwizard Metrics under {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured WildcardConfig with metrics enabled
     */
    public static WildcardConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Starts one JmxReporter for the first registry seen. Later calls are no-ops.
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("Wildcard: Registering JmxReporter for metrics");
                JmxReporter reporter = JmxReporter.forRegistry(registry).build();
                reporter.start();
                jmxReporter = reporter;
                logger.info("Wildcard: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal - the registry may already be exposed
                logger.warn("Wildcard: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /** Whether a JmxReporter has been started by this class. */
    static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Stops the JmxReporter started by {@link #withMetrics}, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("Wildcard: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
