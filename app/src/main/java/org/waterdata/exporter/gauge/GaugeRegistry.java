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
package org.waterdata.exporter.gauge;

import org.waterdata.exporter.model.GaugeDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable list of configured gauges, loaded once at startup and shared read-only
 * by all fetch workers.
 */
public final class GaugeRegistry {

    private final List<GaugeDescriptor> gauges;
    private final Map<String, GaugeDescriptor> byId;

    public GaugeRegistry(List<GaugeDescriptor> gauges) {
        Map<String, GaugeDescriptor> index = new LinkedHashMap<>();
        for (GaugeDescriptor gauge : gauges) {
            if (index.putIfAbsent(gauge.id(), gauge) != null) {
                throw new GaugeConfigurationException("Duplicate gauge id: " + gauge.id());
            }
        }
        this.gauges = List.copyOf(gauges);
        this.byId = Collections.unmodifiableMap(index);
    }

    public static GaugeRegistry of(GaugeDescriptor... gauges) {
        return new GaugeRegistry(List.of(gauges));
    }

    /**
     * Gauges in configuration order.
     */
    public List<GaugeDescriptor> gauges() {
        return gauges;
    }

    public Optional<GaugeDescriptor> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return gauges.size();
    }

    public boolean isEmpty() {
        return gauges.isEmpty();
    }
}
