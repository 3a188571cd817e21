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
package org.waterdata.exporter.web;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import lombok.extern.slf4j.Slf4j;
import org.waterdata.exporter.metrics.ExporterRegistry;
import org.waterdata.exporter.poll.PollCoordinator;

/**
 * Prometheus scrape endpoint. Every request runs a poll cycle and then renders the registry.
 *
 * <p>Always answers with the metrics: gauge failures only show up in the failure
 * counters and stale values, never as an endpoint error.
 */
@Slf4j
@Path("/metrics")
public class MetricsResource {

    static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final PollCoordinator coordinator;
    private final ExporterRegistry registry;

    @Inject
    public MetricsResource(PollCoordinator coordinator, ExporterRegistry registry) {
        this.coordinator = coordinator;
        this.registry = registry;
    }

    @GET
    @Produces(CONTENT_TYPE)
    public String scrape() {
        try {
            coordinator.runCycle();
        } catch (RuntimeException e) {
            // Render the last committed state rather than failing the scrape
            log.error("Unexpected error during poll cycle: {}", e.getMessage(), e);
        }
        return registry.render();
    }
}
