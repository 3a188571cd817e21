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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Prometheus registry holding the exporter's meters.
 *
 * <p>The registry is not exposed as a {@link MeterRegistry} bean, so Quarkus does not add it
 * to its global registry or render it on its own endpoint. {@link #render()} is the only way
 * to scrape it, and it always runs under {@link MetricAggregator#readConsistently}: every
 * meter in one render reads the same committed snapshot.
 */
@ApplicationScoped
public class ExporterRegistry {

    private final PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    private final MetricAggregator aggregator;

    @Inject
    public ExporterRegistry(MetricAggregator aggregator) {
        this.aggregator = aggregator;
    }

    /**
     * Registry to register exporter meters with.
     */
    public MeterRegistry meterRegistry() {
        return registry;
    }

    /**
     * Render all meters in the Prometheus text format with commits held off.
     *
     * @return Prometheus exposition text
     */
    public String render() {
        return aggregator.readConsistently(registry::scrape);
    }

    @PreDestroy
    void close() {
        registry.close();
    }
}
