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
package org.waterdata.exporter.bootstrap;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.waterdata.exporter.config.ApiConfig;
import org.waterdata.exporter.config.GaugesConfig;
import org.waterdata.exporter.credential.CredentialPool;
import org.waterdata.exporter.gauge.GaugeRegistry;
import org.waterdata.exporter.model.Credential;
import org.waterdata.exporter.poll.PollCoordinator;

/**
 * Application lifecycle bean that validates configuration and logs it on startup.
 *
 * <p>There is no scheduler: polling happens when Prometheus scrapes {@code /metrics}.
 * Injecting the gauge registry here loads the gauge file at startup, so a missing or
 * invalid file stops the application instead of failing the first scrape.
 */
@Slf4j
@ApplicationScoped
public class ExporterApp {
    private final ApiConfig apiConfig;
    private final GaugesConfig gaugesConfig;
    private final GaugeRegistry gaugeRegistry;
    private final CredentialPool credentialPool;
    private final PollCoordinator coordinator;
    private final Banners banner;

    @Inject
    public ExporterApp(ApiConfig apiConfig,
                       GaugesConfig gaugesConfig,
                       GaugeRegistry gaugeRegistry,
                       CredentialPool credentialPool,
                       PollCoordinator coordinator,
                       Banners banner) {
        this.apiConfig = apiConfig;
        this.gaugesConfig = gaugesConfig;
        this.gaugeRegistry = gaugeRegistry;
        this.credentialPool = credentialPool;
        this.coordinator = coordinator;
        this.banner = banner;
    }

    void onStartup(@Observes StartupEvent event) {
        banner.printHeader();
        logConfiguration();
        banner.printFooter();
    }

    void logConfiguration() {
        log.info("Configuration:");
        log.info("  API URL:                {}", apiConfig.url());
        log.info("  Request timeout:        {}", apiConfig.requestTimeout());
        log.info("  Max workers:            {}", coordinator.getMaxWorkers());
        log.info("  Gauge file:             {}", gaugesConfig.file());
        log.info("  Configured gauges:      {}", gaugeRegistry.size());
        for (Credential credential : credentialPool.ordered()) {
            log.info("  API key ({}):{}{}", credential.label(),
                    " ".repeat(Math.max(1, 15 - credential.label().length())), credential.maskedKey());
        }
        if (credentialPool.isAnonymous()) {
            log.warn("No USGS API key configured, requests are sent anonymously with a lower rate limit");
        }
        if (gaugeRegistry.isEmpty()) {
            log.warn("No gauges configured, scrapes will only report exporter metrics");
        }
    }
}
