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
package org.waterdata.exporter.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Complete, immutable view of the exporter's metric state after a commit.
 *
 * @param streamflow                Last known streamflow per gauge id; absent until the first success
 * @param successCount              Successful fetches over the process lifetime
 * @param failureCount              Failed fetches over the process lifetime
 * @param failuresByKind            Failed fetches per failure kind over the process lifetime
 * @param configuredGaugeCount      Number of configured gauges
 * @param lastScrapeDurationSeconds Wall-clock duration of the last cycle
 * @param completedCycles           Number of completed poll cycles
 * @param lastCycleSuccesses        Successful fetches in the last cycle
 * @param lastCycleFailures         Failed fetches in the last cycle
 * @param lastCycleCompletedAt      When the last cycle was committed, null before the first one
 * @param rateLimits                Latest rate limit status per credential label
 */
public record MetricSnapshot(Map<String, Double> streamflow,
                             long successCount,
                             long failureCount,
                             Map<FailureKind, Long> failuresByKind,
                             int configuredGaugeCount,
                             double lastScrapeDurationSeconds,
                             long completedCycles,
                             int lastCycleSuccesses,
                             int lastCycleFailures,
                             Instant lastCycleCompletedAt,
                             Map<String, RateLimitStatus> rateLimits) {

    public MetricSnapshot {
        streamflow = Collections.unmodifiableMap(new LinkedHashMap<>(streamflow));
        EnumMap<FailureKind, Long> kinds = new EnumMap<>(FailureKind.class);
        for (FailureKind kind : FailureKind.values()) {
            kinds.put(kind, failuresByKind.getOrDefault(kind, 0L));
        }
        failuresByKind = Collections.unmodifiableMap(kinds);
        rateLimits = Collections.unmodifiableMap(new LinkedHashMap<>(rateLimits));
    }

    /**
     * State before any cycle has run.
     *
     * @param configuredGaugeCount Number of configured gauges
     * @return Empty snapshot
     */
    public static MetricSnapshot initial(int configuredGaugeCount) {
        return new MetricSnapshot(Map.of(), 0, 0, Map.of(), configuredGaugeCount,
                0.0, 0, 0, 0, null, Map.of());
    }

    public long totalFetches() {
        return successCount + failureCount;
    }
}
