/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.waterdata.exporter.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.waterdata.exporter.common.Constants;
import org.waterdata.exporter.common.MetricNameBuilder;
import org.waterdata.exporter.gauge.GaugeRegistry;
import org.waterdata.exporter.model.FailureKind;
import org.waterdata.exporter.model.GaugeDescriptor;
import org.waterdata.exporter.model.MetricSnapshot;
import org.waterdata.exporter.model.RateLimitStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToDoubleFunction;

/**
 * Exposes the aggregator's state as Micrometer meters.
 *
 * <p>Meters live in the {@link ExporterRegistry} and read the aggregator's current
 * snapshot when scraped. Streamflow and
 * rate limit meters are registered from a commit listener the first time a value
 * exists for a gauge or credential, so a gauge that never reported has no series.
 */
@Slf4j
@Startup
@ApplicationScoped
public class ExporterMetrics {

    static final String NAME_STREAMFLOW = MetricNameBuilder.build("streamflow_cfs");
    static final String NAME_SCRAPE_SUCCESS = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "scrape_success");
    static final String NAME_SCRAPE_FAILURE = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "scrape_failure");
    static final String NAME_FETCH_FAILURES = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "fetch_failures");
    static final String NAME_CYCLES = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "cycles");
    static final String NAME_GAUGES_TOTAL = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "gauges_total");
    static final String NAME_SCRAPE_DURATION = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "scrape_duration_seconds");
    static final String NAME_UPTIME = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "uptime_seconds");
    static final String NAME_RATELIMIT_LIMIT = MetricNameBuilder.build(Constants.SUBSYSTEM_API, "ratelimit_limit");
    static final String NAME_RATELIMIT_REMAINING = MetricNameBuilder.build(Constants.SUBSYSTEM_API, "ratelimit_remaining");
    static final String NAME_REQUESTS_PER_HOUR = MetricNameBuilder.build(Constants.SUBSYSTEM_API, "requests_per_hour");

    private final Set<String> registeredGauges = ConcurrentHashMap.newKeySet();
    private final Set<String> registeredCredentials = ConcurrentHashMap.newKeySet();
    private final Instant startTime = Instant.now();

    private final MeterRegistry registry;
    private final MetricAggregator aggregator;
    private final GaugeRegistry gaugeRegistry;

    @Inject
    public ExporterMetrics(ExporterRegistry exporterRegistry, MetricAggregator aggregator, GaugeRegistry gaugeRegistry) {
        this(exporterRegistry.meterRegistry(), aggregator, gaugeRegistry);
    }

    ExporterMetrics(MeterRegistry registry, MetricAggregator aggregator, GaugeRegistry gaugeRegistry) {
        this.registry = registry;
        this.aggregator = aggregator;
        this.gaugeRegistry = gaugeRegistry;
    }

    @PostConstruct
    public void init() {
        registerFetchCounters();
        registerCycleMeters();
        registerUptimeGauge();
        aggregator.addCommitListener(this::registerNewMeters);
        registerNewMeters(aggregator.snapshot());
        log.info("Exporter metrics initialized for {} gauges", gaugeRegistry.size());
    }

    private void registerFetchCounters() {
        FunctionCounter.builder(NAME_SCRAPE_SUCCESS, aggregator, a -> a.snapshot().successCount())
                .description("Number of successful gauge fetches")
                .register(registry);

        FunctionCounter.builder(NAME_SCRAPE_FAILURE, aggregator, a -> a.snapshot().failureCount())
                .description("Number of failed gauge fetches")
                .register(registry);

        for (FailureKind kind : FailureKind.values()) {
            FunctionCounter.builder(NAME_FETCH_FAILURES, aggregator,
                            a -> a.snapshot().failuresByKind().getOrDefault(kind, 0L))
                    .description("Number of failed gauge fetches per failure kind")
                    .tag(Constants.TAG_FAILURE_KIND, kind.tagValue())
                    .register(registry);
        }
    }

    private void registerCycleMeters() {
        FunctionCounter.builder(NAME_CYCLES, aggregator, a -> a.snapshot().completedCycles())
                .description("Number of completed poll cycles")
                .register(registry);

        Gauge.builder(NAME_GAUGES_TOTAL, () -> aggregator.snapshot().configuredGaugeCount())
                .description("Total number of gauges configured for polling")
                .register(registry);

        Gauge.builder(NAME_SCRAPE_DURATION, () -> aggregator.snapshot().lastScrapeDurationSeconds())
                .description("Time spent scraping all gauges in the last cycle")
                .register(registry);
    }

    private void registerUptimeGauge() {
        Gauge.builder(NAME_UPTIME, () -> Duration.between(startTime, Instant.now()).toSeconds())
                .description("Duration in seconds since the exporter started")
                .register(registry);
    }

    /**
     * Register meters for gauges and credentials that have a value for the first time.
     * Runs inside the aggregator's commit, so renderers see new meters and new values together.
     */
    void registerNewMeters(MetricSnapshot snapshot) {
        for (String gaugeId : snapshot.streamflow().keySet()) {
            if (registeredGauges.add(gaugeId)) {
                registerStreamflowGauge(gaugeId);
            }
        }
        for (String label : snapshot.rateLimits().keySet()) {
            if (registeredCredentials.add(label)) {
                registerRateLimitGauges(label);
            }
        }
    }

    private void registerStreamflowGauge(String gaugeId) {
        Optional<GaugeDescriptor> gauge = gaugeRegistry.find(gaugeId);
        String locationName = gauge.map(GaugeDescriptor::name).orElse(gaugeId);
        String friendlyName = gauge.map(GaugeDescriptor::friendlyName).orElse(gaugeId);

        Gauge.builder(NAME_STREAMFLOW, () -> {
                    Double value = aggregator.snapshot().streamflow().get(gaugeId);
                    return value != null ? value : Double.NaN;
                })
                .description("USGS streamflow in cubic feet per second")
                .tags(Tags.of(
                        Constants.TAG_GAUGE_ID, gaugeId,
                        Constants.TAG_FRIENDLY_NAME, friendlyName,
                        Constants.TAG_LOCATION_NAME, locationName))
                .register(registry);
        log.debug("Registered streamflow gauge for {}", gaugeId);
    }

    private void registerRateLimitGauges(String label) {
        registerRateLimitGauge(NAME_RATELIMIT_LIMIT, label, RateLimitStatus::limit,
                "Limit of allowed requests per hour");
        registerRateLimitGauge(NAME_RATELIMIT_REMAINING, label, RateLimitStatus::remaining,
                "Remaining allowed requests per hour for each USGS API key");
        registerRateLimitGauge(NAME_REQUESTS_PER_HOUR, label, RateLimitStatus::requestsUsed,
                "Number of USGS API requests used in the current hour");
        log.debug("Registered rate limit gauges for {} key", label);
    }

    private void registerRateLimitGauge(String name, String label,
                                        ToDoubleFunction<RateLimitStatus> extractor, String description) {
        Gauge.builder(name, () -> {
                    RateLimitStatus status = aggregator.snapshot().rateLimits().get(label);
                    return status != null ? extractor.applyAsDouble(status) : Double.NaN;
                })
                .description(description)
                .tag(Constants.TAG_API_KEY_LABEL, label)
                .register(registry);
    }
}
