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
package org.waterdata.exporter.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration for poll cycle behavior: worker pool size, deadlines and overlap handling.
 */
@ConfigMapping(prefix = "usgs.poll")
public interface PollConfig {

    /**
     * Number of worker threads fetching gauges concurrently.
     * Bounds the number of simultaneous connections to the upstream API.
     *
     * @return Worker count (default: 10)
     */
    @WithDefault("10")
    int maxWorkers();

    /**
     * Slack added on top of the computed worst-case cycle latency
     * before outstanding fetches are cancelled.
     *
     * @return Grace period (default: 5 seconds)
     */
    @WithDefault("5s")
    Duration cycleDeadlineGrace();

    /**
     * Whether a scrape that arrives while a cycle is running reuses the result of
     * that cycle instead of starting another one once it finishes.
     *
     * @return true to coalesce overlapping scrapes (default: true)
     */
    @WithDefault("true")
    boolean coalesceOverlappingCycles();
}
