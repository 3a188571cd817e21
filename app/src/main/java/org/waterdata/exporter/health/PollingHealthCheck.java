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
package org.waterdata.exporter.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.waterdata.exporter.metrics.MetricAggregator;
import org.waterdata.exporter.model.MetricSnapshot;

/**
 * Readiness check over the last poll cycle.
 * Down only when the last cycle failed for every configured gauge.
 * Note: This is a readiness check, not liveness, so an upstream outage won't restart the pod
 */
@Readiness
@ApplicationScoped
public class PollingHealthCheck implements HealthCheck {

    private final MetricAggregator aggregator;

    @Inject
    public PollingHealthCheck(MetricAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @Override
    public HealthCheckResponse call() {
        MetricSnapshot snapshot = aggregator.snapshot();
        boolean up = snapshot.completedCycles() == 0
                || snapshot.configuredGaugeCount() == 0
                || snapshot.lastCycleSuccesses() > 0;

        return HealthCheckResponse.named("gauge-polling")
                .status(up)
                .withData("configuredGauges", snapshot.configuredGaugeCount())
                .withData("completedCycles", snapshot.completedCycles())
                .withData("lastCycleSuccesses", snapshot.lastCycleSuccesses())
                .withData("lastCycleFailures", snapshot.lastCycleFailures())
                .build();
    }
}
