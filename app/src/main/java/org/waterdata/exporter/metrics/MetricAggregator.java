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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.waterdata.exporter.gauge.GaugeRegistry;
import org.waterdata.exporter.model.FailureKind;
import org.waterdata.exporter.model.FetchOutcome;
import org.waterdata.exporter.model.MetricSnapshot;
import org.waterdata.exporter.model.RateLimitStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Holds the exporter's metric state as an immutable {@link MetricSnapshot}.
 *
 * <p>Every write builds a complete new snapshot and publishes it by reference swap
 * while holding the write lock. {@link #snapshot()} is lock-free and always returns a
 * complete snapshot. {@link #readConsistently(Supplier)} holds the read lock, so a
 * renderer reading several meters one after another cannot straddle a commit.
 */
@Slf4j
@ApplicationScoped
public class MetricAggregator {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Consumer<MetricSnapshot>> commitListeners = new CopyOnWriteArrayList<>();
    private volatile MetricSnapshot current;

    @Inject
    public MetricAggregator(GaugeRegistry gaugeRegistry) {
        this(gaugeRegistry.size());
    }

    public MetricAggregator(int configuredGaugeCount) {
        if (configuredGaugeCount < 0) {
            throw new IllegalArgumentException("configuredGaugeCount must not be negative");
        }
        this.current = MetricSnapshot.initial(configuredGaugeCount);
    }

    /**
     * Current snapshot. Never null, never partially updated.
     */
    public MetricSnapshot snapshot() {
        return current;
    }

    /**
     * Run a read against the last committed state with commits held off until it returns.
     *
     * @param reader Read to perform, e.g. rendering the meter registry
     * @return Whatever the reader returns
     */
    public <T> T readConsistently(Supplier<T> reader) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return reader.get();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Apply the outcome of a single fetch.
     *
     * @param gaugeId Gauge the outcome belongs to
     * @param outcome Fetch outcome
     * @return Snapshot after the commit
     */
    public MetricSnapshot applyOutcome(String gaugeId, FetchOutcome outcome) {
        return commit(draft -> draft.apply(gaugeId, outcome));
    }

    /**
     * Overwrite the duration of the last scrape.
     *
     * @param duration Wall-clock duration of the cycle
     * @return Snapshot after the commit
     */
    public MetricSnapshot recordCycleDuration(Duration duration) {
        return commit(draft -> draft.durationSeconds = toSeconds(duration));
    }

    /**
     * Apply all outcomes of one poll cycle and its duration in a single commit.
     *
     * @param outcomes Outcome per gauge id, one per configured gauge
     * @param duration Wall-clock duration of the cycle
     * @return Snapshot after the commit
     */
    public MetricSnapshot applyCycle(Map<String, FetchOutcome> outcomes, Duration duration) {
        return commit(draft -> {
            int successes = 0;
            int failures = 0;
            for (Map.Entry<String, FetchOutcome> entry : outcomes.entrySet()) {
                draft.apply(entry.getKey(), entry.getValue());
                if (entry.getValue().isSuccess()) {
                    successes++;
                } else {
                    failures++;
                }
            }
            draft.durationSeconds = toSeconds(duration);
            draft.completedCycles++;
            draft.lastCycleSuccesses = successes;
            draft.lastCycleFailures = failures;
            draft.lastCycleCompletedAt = Instant.now();
        });
    }

    /**
     * Register a callback run inside every commit, after the new snapshot is published.
     * {@link #readConsistently(Supplier)} readers are held off until the listeners return;
     * {@link #snapshot()} does not wait and may already return the new snapshot.
     *
     * <p>Listeners must be quick and must not call back into the aggregator's write methods.
     */
    public void addCommitListener(Consumer<MetricSnapshot> listener) {
        commitListeners.add(listener);
    }

    private MetricSnapshot commit(Consumer<Draft> mutation) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            Draft draft = new Draft(current);
            mutation.accept(draft);
            MetricSnapshot next = draft.toSnapshot();
            current = next;
            notifyListeners(next);
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    private void notifyListeners(MetricSnapshot snapshot) {
        for (Consumer<MetricSnapshot> listener : commitListeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                log.error("Commit listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    /**
     * Mutable working copy of a snapshot, confined to the committing thread.
     */
    private static final class Draft {
        private final Map<String, Double> streamflow;
        private final Map<FailureKind, Long> failuresByKind;
        private final Map<String, RateLimitStatus> rateLimits;
        private final int configuredGaugeCount;
        private long successCount;
        private long failureCount;
        private double durationSeconds;
        private long completedCycles;
        private int lastCycleSuccesses;
        private int lastCycleFailures;
        private Instant lastCycleCompletedAt;

        Draft(MetricSnapshot base) {
            this.streamflow = new LinkedHashMap<>(base.streamflow());
            this.failuresByKind = new EnumMap<>(base.failuresByKind());
            this.rateLimits = new LinkedHashMap<>(base.rateLimits());
            this.configuredGaugeCount = base.configuredGaugeCount();
            this.successCount = base.successCount();
            this.failureCount = base.failureCount();
            this.durationSeconds = base.lastScrapeDurationSeconds();
            this.completedCycles = base.completedCycles();
            this.lastCycleSuccesses = base.lastCycleSuccesses();
            this.lastCycleFailures = base.lastCycleFailures();
            this.lastCycleCompletedAt = base.lastCycleCompletedAt();
        }

        void apply(String gaugeId, FetchOutcome outcome) {
            if (outcome.isSuccess()) {
                successCount++;
                streamflow.put(gaugeId, outcome.value());
            } else {
                // Keep the previous value: stale beats absent
                failureCount++;
                failuresByKind.merge(outcome.failureKind(), 1L, Long::sum);
            }
            for (RateLimitStatus status : outcome.rateLimits()) {
                rateLimits.put(status.credentialLabel(), status);
            }
        }

        MetricSnapshot toSnapshot() {
            return new MetricSnapshot(streamflow, successCount, failureCount, failuresByKind,
                    configuredGaugeCount, durationSeconds, completedCycles,
                    lastCycleSuccesses, lastCycleFailures, lastCycleCompletedAt, rateLimits);
        }
    }
}
