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
package org.waterdata.exporter.poll;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.waterdata.exporter.config.ApiConfig;
import org.waterdata.exporter.config.PollConfig;
import org.waterdata.exporter.credential.CredentialPool;
import org.waterdata.exporter.fetch.GaugeFetcher;
import org.waterdata.exporter.gauge.GaugeRegistry;
import org.waterdata.exporter.metrics.MetricAggregator;
import org.waterdata.exporter.model.FailureKind;
import org.waterdata.exporter.model.FetchOutcome;
import org.waterdata.exporter.model.GaugeDescriptor;
import org.waterdata.exporter.model.MetricSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs poll cycles: one fetch per configured gauge on a fixed-size worker pool,
 * all outcomes committed to the {@link MetricAggregator} at once.
 *
 * <p>Cycles are serialized. A scrape arriving while a cycle is running waits for it
 * and, when coalescing is enabled, returns that cycle's snapshot instead of fanning
 * out again, so overlapping scrapes never double count.
 *
 * <p>A cycle always completes: fetch failures are contained per gauge, and fetches
 * still running at the cycle deadline are cancelled and counted as transport failures.
 */
@Slf4j
@ApplicationScoped
public class PollCoordinator {

    private final Lock cycleLock = new ReentrantLock();
    private final AtomicLong completedCycles = new AtomicLong();

    private final GaugeRegistry gaugeRegistry;
    private final GaugeFetcher fetcher;
    private final MetricAggregator aggregator;
    private final ExecutorService workerPool;
    private final int maxWorkers;
    private final Duration fetchBudget;
    private final Duration deadlineGrace;
    private final boolean coalesceOverlappingCycles;

    @Inject
    public PollCoordinator(PollConfig config,
                           ApiConfig apiConfig,
                           GaugeRegistry gaugeRegistry,
                           CredentialPool credentialPool,
                           GaugeFetcher fetcher,
                           MetricAggregator aggregator) {
        this(config, apiConfig, gaugeRegistry, credentialPool, fetcher, aggregator,
                newWorkerPool(config.maxWorkers()));
    }

    PollCoordinator(PollConfig config,
                    ApiConfig apiConfig,
                    GaugeRegistry gaugeRegistry,
                    CredentialPool credentialPool,
                    GaugeFetcher fetcher,
                    MetricAggregator aggregator,
                    ExecutorService workerPool) {
        requirePositiveWorkers(config.maxWorkers());
        this.gaugeRegistry = gaugeRegistry;
        this.fetcher = fetcher;
        this.aggregator = aggregator;
        this.maxWorkers = config.maxWorkers();
        // One fetch may use every credential, each attempt bounded by the request timeout
        this.fetchBudget = apiConfig.requestTimeout().multipliedBy(credentialPool.size());
        this.deadlineGrace = config.cycleDeadlineGrace();
        this.coalesceOverlappingCycles = config.coalesceOverlappingCycles();
        this.workerPool = workerPool;
        log.info("Poll coordinator ready: {} gauges, {} workers", gaugeRegistry.size(), maxWorkers);
    }

    /**
     * Run one poll cycle and return the snapshot it committed.
     *
     * <p>Blocks until every gauge has an outcome or the cycle deadline passes. If another
     * cycle is in progress, waits for it first.
     *
     * @return Snapshot after the cycle
     */
    public MetricSnapshot runCycle() {
        long observedCycles = completedCycles.get();
        boolean waited = !cycleLock.tryLock();
        if (waited) {
            log.debug("Poll cycle already in progress, waiting for it to complete");
            cycleLock.lock();
        }
        try {
            if (waited && coalesceOverlappingCycles && completedCycles.get() != observedCycles) {
                log.debug("Returning snapshot of the cycle that completed while waiting");
                return aggregator.snapshot();
            }
            return performCycle();
        } finally {
            cycleLock.unlock();
        }
    }

    private MetricSnapshot performCycle() {
        Instant start = Instant.now();
        List<GaugeDescriptor> gauges = gaugeRegistry.gauges();
        log.debug("Starting poll cycle for {} gauges", gauges.size());

        Map<String, FetchOutcome> outcomes = gauges.isEmpty() ? Map.of() : collectOutcomes(gauges);

        Duration duration = Duration.between(start, Instant.now());
        MetricSnapshot snapshot = aggregator.applyCycle(outcomes, duration);
        completedCycles.incrementAndGet();

        if (snapshot.lastCycleFailures() > 0) {
            log.warn("Poll cycle completed in {} ms with {} of {} gauges failing",
                    duration.toMillis(), snapshot.lastCycleFailures(), gauges.size());
        } else {
            log.debug("Poll cycle completed in {} ms, {} gauges fetched",
                    duration.toMillis(), snapshot.lastCycleSuccesses());
        }
        return snapshot;
    }

    /**
     * Dispatch one fetch per gauge and wait for all of them, up to the cycle deadline.
     * Every gauge gets exactly one outcome.
     */
    private Map<String, FetchOutcome> collectOutcomes(List<GaugeDescriptor> gauges) {
        CompletionService<FetchOutcome> completion = new ExecutorCompletionService<>(workerPool);
        Map<Future<FetchOutcome>, GaugeDescriptor> pending = new HashMap<>();
        for (GaugeDescriptor gauge : gauges) {
            pending.put(completion.submit(() -> fetchContained(gauge)), gauge);
        }

        Map<String, FetchOutcome> outcomes = new LinkedHashMap<>();
        Duration deadline = cycleDeadline(gauges.size());
        long deadlineNanos = System.nanoTime() + deadline.toNanos();
        try {
            while (!pending.isEmpty()) {
                long remaining = deadlineNanos - System.nanoTime();
                // Past the deadline, still collect fetches that already finished
                Future<FetchOutcome> done = remaining > 0
                        ? completion.poll(remaining, TimeUnit.NANOSECONDS)
                        : completion.poll();
                if (done == null) {
                    log.warn("Poll cycle deadline of {} exceeded with {} fetches outstanding",
                            deadline, pending.size());
                    break;
                }
                GaugeDescriptor gauge = pending.remove(done);
                outcomes.put(gauge.id(), resultOf(done, gauge));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Poll cycle interrupted with {} fetches outstanding", pending.size());
        }

        for (Map.Entry<Future<FetchOutcome>, GaugeDescriptor> abandoned : pending.entrySet()) {
            abandoned.getKey().cancel(true);
            outcomes.put(abandoned.getValue().id(),
                    FetchOutcome.failure(FailureKind.TRANSPORT, "cycle deadline exceeded"));
        }
        return outcomes;
    }

    /**
     * Run the fetcher so that nothing it throws escapes the worker task.
     */
    private FetchOutcome fetchContained(GaugeDescriptor gauge) {
        try {
            FetchOutcome outcome = fetcher.fetch(gauge);
            if (outcome == null) {
                log.error("Fetcher returned no outcome for gauge {}", gauge.id());
                return FetchOutcome.failure(FailureKind.TRANSPORT, "no outcome");
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Unexpected error fetching gauge {}: {}", gauge.id(), e.getMessage(), e);
            return FetchOutcome.failure(FailureKind.TRANSPORT, "unexpected error: " + e.getMessage());
        }
    }

    private FetchOutcome resultOf(Future<FetchOutcome> done, GaugeDescriptor gauge) {
        try {
            return done.get();
        } catch (ExecutionException e) {
            log.error("Fetch task for gauge {} failed: {}", gauge.id(), e.getCause().getMessage(), e.getCause());
            return FetchOutcome.failure(FailureKind.TRANSPORT, "task failed: " + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.failure(FailureKind.TRANSPORT, "interrupted");
        }
    }

    /**
     * Worst-case latency of a cycle: the gauges run in waves of {@code maxWorkers},
     * each wave bounded by the budget of a single fetch.
     */
    Duration cycleDeadline(int gaugeCount) {
        int waves = (gaugeCount + maxWorkers - 1) / maxWorkers;
        return fetchBudget.multipliedBy(waves).plus(deadlineGrace);
    }

    private static ExecutorService newWorkerPool(int maxWorkers) {
        requirePositiveWorkers(maxWorkers);
        return Executors.newFixedThreadPool(maxWorkers, new FetchThreadFactory());
    }

    private static void requirePositiveWorkers(int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("usgs.poll.max-workers must be positive, got " + maxWorkers);
        }
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    @PreDestroy
    void shutdown() {
        log.info("Shutting down poll worker pool");
        workerPool.shutdownNow();
    }

    private static final class FetchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "gauge-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
